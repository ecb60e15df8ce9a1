package work.lcod.worlddata.script;

/**
 * Evaluates script sources far enough to learn their declared name, type and top-level functions.
 */
public interface ScriptInspector {
    /**
     * @throws InvalidScriptException when the source does not evaluate, has no {@code define} function, or
     *                                {@code define} does not return 0 with a non-empty name and type
     */
    ScriptDefinition inspect(String path, String source);
}
