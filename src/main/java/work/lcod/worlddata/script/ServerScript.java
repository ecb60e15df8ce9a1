package work.lcod.worlddata.script;

/**
 * Script registered by the server. AI scripts and all other scripts live in separate name spaces.
 */
public record ServerScript(String name, ScriptType type, String source, String path) {
    public boolean isAi() {
        return type.isAi();
    }
}
