package work.lcod.worlddata.script;

public class InvalidScriptException extends RuntimeException {
    public InvalidScriptException(String message) {
        super(message);
    }

    public InvalidScriptException(String message, Throwable cause) {
        super(message, cause);
    }
}
