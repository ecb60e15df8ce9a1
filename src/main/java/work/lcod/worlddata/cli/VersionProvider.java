package work.lcod.worlddata.cli;

import picocli.CommandLine;

/**
 * Reports the jar manifest version along with the Java runtime loading the data.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String DEVELOPMENT_VERSION = "development";

    @Override
    public String[] getVersion() {
        String manifestVersion = Main.class.getPackage().getImplementationVersion();
        return new String[] {
            "worlddata (java) " + (manifestVersion != null ? manifestVersion : DEVELOPMENT_VERSION),
            "Java " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
