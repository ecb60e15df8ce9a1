package work.lcod.worlddata.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import work.lcod.worlddata.api.LogLevel;
import work.lcod.worlddata.support.WorldDataTestSupport;

class ConfigurationLoaderTest {
    @Test
    void loadsFixtureConfiguration() {
        var config = ConfigurationLoader.load(WorldDataTestSupport.fixtureRoot().resolve("worlddata.toml"));

        assertEquals(WorldDataTestSupport.fixtureRoot(), config.dataRoot());
        assertEquals(WorldDataTestSupport.fixtureDefinitions(), config.definitionsFile().orElseThrow());
        assertEquals(LogLevel.INFO, config.logLevel());
    }

    @Test
    void definitionsAndLoggingAreOptional() {
        var base = Path.of("/srv/game").toAbsolutePath();
        var config = ConfigurationLoader.parse("[data]\nroot = \"world\"\n", base);

        assertEquals(base.resolve("world"), config.dataRoot());
        assertTrue(config.definitionsFile().isEmpty());
        assertEquals(LogLevel.WARN, config.logLevel());
    }

    @Test
    void keepsAbsolutePaths() {
        var absolute = Path.of("/opt/world").toAbsolutePath();
        var raw = "[data]\nroot = '" + absolute + "'\n";
        var config = ConfigurationLoader.parse(raw, Path.of("/srv/game").toAbsolutePath());
        assertEquals(absolute, config.dataRoot());
    }

    @Test
    void requiresDataRoot() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> ConfigurationLoader.parse("[logging]\nlevel = \"debug\"\n", null));
        assertEquals("Configuration is missing [data] root", ex.getMessage());
    }

    @Test
    void reportsSyntaxErrors() {
        var ex = assertThrows(IllegalArgumentException.class,
            () -> ConfigurationLoader.parse("[data\nroot = ", null));
        assertTrue(ex.getMessage().startsWith("Invalid configuration: "));
    }

    @Test
    void rejectsUnknownLogLevels() {
        assertThrows(IllegalArgumentException.class,
            () -> ConfigurationLoader.parse("[data]\nroot = \"x\"\n[logging]\nlevel = \"loud\"\n", null));
    }

    @Test
    void rejectsMissingFile() {
        assertThrows(IllegalArgumentException.class, () -> ConfigurationLoader.load(Path.of("missing.toml")));
    }
}
