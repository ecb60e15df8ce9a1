package work.lcod.worlddata.support;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import work.lcod.worlddata.schema.DefinitionRegistryLoader;
import work.lcod.worlddata.schema.InMemoryDefinitionRegistry;
import work.lcod.worlddata.script.InvalidScriptException;
import work.lcod.worlddata.script.ScriptDefinition;
import work.lcod.worlddata.script.ScriptInspector;

/**
 * Shared helpers for the world data test suites. The stub inspector reads script metadata with regular
 * expressions so loader tests do not need a JavaScript engine.
 */
public final class WorldDataTestSupport {
    private static final Pattern NAME = Pattern.compile("script\\.name\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern TYPE = Pattern.compile("script\\.type\\s*=\\s*\"([^\"]*)\"");
    private static final Pattern FUNCTION = Pattern.compile("function\\s+([A-Za-z_$][\\w$]*)\\s*\\(");

    private WorldDataTestSupport() {}

    public static Path fixtureRoot() {
        return Path.of("src", "test", "resources", "worlddata").toAbsolutePath().normalize();
    }

    public static Path fixtureDefinitions() {
        return fixtureRoot().resolve("definitions.yaml");
    }

    public static InMemoryDefinitionRegistry fixtureRegistry() {
        return DefinitionRegistryLoader.load(fixtureDefinitions());
    }

    public static ScriptInspector stubInspector() {
        return (path, source) -> {
            String name = firstGroup(NAME.matcher(source));
            String type = firstGroup(TYPE.matcher(source));
            if (name == null || type == null) {
                throw new InvalidScriptException("Script is not properly defined: " + path);
            }
            Set<String> functions = new LinkedHashSet<>();
            Matcher matcher = FUNCTION.matcher(source);
            while (matcher.find()) {
                functions.add(matcher.group(1));
            }
            return new ScriptDefinition(name, type, functions);
        };
    }

    private static String firstGroup(Matcher matcher) {
        return matcher.find() ? matcher.group(1) : null;
    }
}
