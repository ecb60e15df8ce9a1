package work.lcod.worlddata.script;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.lcod.worlddata.load.DataStore;
import work.lcod.worlddata.load.DefinitionLoadException;
import work.lcod.worlddata.validation.Diagnostics;

/**
 * Loads and checks every {@code .js} script found under a data store path.
 */
public final class ScriptLoader {
    public static final String SCRIPT_EXTENSION = ".js";

    private final ScriptInspector inspector;
    private final Diagnostics diagnostics;

    public ScriptLoader(ScriptInspector inspector, Diagnostics diagnostics) {
        this.inspector = Objects.requireNonNull(inspector, "inspector");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Loads the scripts below {@code path} (recursively) without registering them anywhere.
     *
     * @throws DefinitionLoadException on the first invalid script or on a name used twice within a name space
     */
    public List<ServerScript> loadScripts(DataStore dataStore, String path) {
        List<ServerScript> scripts = new ArrayList<>();
        Set<String> names = new HashSet<>();
        Set<String> aiNames = new HashSet<>();
        for (String file : dataStore.listDirectory(path, true).files()) {
            if (!file.endsWith(SCRIPT_EXTENSION)) {
                continue;
            }
            String source = new String(dataStore.readFile(file), StandardCharsets.UTF_8);
            ServerScript script = loadScript(file, source);
            Set<String> namespace = script.isAi() ? aiNames : names;
            if (!namespace.add(script.name())) {
                throw new DefinitionLoadException((script.isAi() ? "Duplicate AI script encountered: "
                    : "Duplicate script encountered: ") + script.name(), file);
            }
            scripts.add(script);
            diagnostics.debug("Loaded script file: " + file);
        }
        return scripts;
    }

    /**
     * Inspects one script source and checks its declared type against the functions it defines.
     */
    public ServerScript loadScript(String path, String source) {
        ScriptDefinition definition;
        try {
            definition = inspector.inspect(path, source);
        } catch (InvalidScriptException ex) {
            throw new DefinitionLoadException(ex.getMessage(), path, ex);
        }

        ScriptType type = ScriptType.fromTag(definition.typeTag())
            .orElseThrow(() -> new DefinitionLoadException("Invalid script type encountered: "
                + definition.typeTag(), path));
        for (String required : type.requiredFunctions()) {
            if (!definition.defines(required)) {
                throw new DefinitionLoadException(describe(type) + " script encountered with no '" + required
                    + "' function: " + definition.name(), path);
            }
        }
        for (String reserved : type.reservedFunctions()) {
            if (definition.defines(reserved)) {
                throw new DefinitionLoadException(describe(type) + " script encountered with reserved function name '"
                    + reserved + "': " + definition.name(), path);
            }
        }
        return new ServerScript(definition.name(), type, source, path);
    }

    private static String describe(ScriptType type) {
        return switch (type) {
            case AI -> "AI";
            case EVENT_CONDITION, EVENT_BRANCH_LOGIC -> "Event conditional";
            case ACTION_TRANSFORM, EVENT_TRANSFORM -> "Transform";
            case ACTION_CUSTOM -> "Custom action";
            case WEBGAME -> "Web game";
        };
    }
}
