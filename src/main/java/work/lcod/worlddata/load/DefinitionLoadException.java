package work.lcod.worlddata.load;

import java.util.Optional;

/**
 * Fatal condition met while loading definitions. Aborts the whole load.
 */
public class DefinitionLoadException extends RuntimeException {
    private final String path;

    public DefinitionLoadException(String message) {
        this(message, null, null);
    }

    public DefinitionLoadException(String message, String path) {
        this(message, path, null);
    }

    public DefinitionLoadException(String message, String path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * Data store path of the file being loaded, when known.
     */
    public Optional<String> path() {
        return Optional.ofNullable(path);
    }
}
