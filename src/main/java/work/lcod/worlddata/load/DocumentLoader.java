package work.lcod.worlddata.load;

import java.util.List;

/**
 * Turns a definition document into typed objects, one per {@code object} element under the document root.
 */
public interface DocumentLoader {
    /**
     * @throws DefinitionLoadException when the document is malformed or an object does not bind to {@code type}
     */
    <T> List<T> loadObjects(byte[] document, String path, Class<T> type);
}
