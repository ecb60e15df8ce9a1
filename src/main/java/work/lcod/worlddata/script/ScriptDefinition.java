package work.lcod.worlddata.script;

import java.util.Set;

/**
 * What a script declares about itself through its {@code define} function, plus the top-level functions it
 * exposes.
 */
public record ScriptDefinition(String name, String typeTag, Set<String> functions) {
    public ScriptDefinition {
        functions = Set.copyOf(functions);
    }

    public boolean defines(String function) {
        return functions.contains(function);
    }
}
