package work.lcod.worlddata.load;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemDataStoreTest {
    @TempDir
    Path root;

    @Test
    void listsDirectoriesWithVirtualPaths() throws Exception {
        Files.createDirectories(root.resolve("zones/partial"));
        Files.writeString(root.resolve("zones/b.xml"), "<objects/>");
        Files.writeString(root.resolve("zones/a.xml"), "<objects/>");
        Files.writeString(root.resolve("zones/partial/p.xml"), "<objects/>");
        var store = new FileSystemDataStore(root);

        var flat = store.listDirectory("/zones", false);
        assertEquals(List.of("/zones/a.xml", "/zones/b.xml"), flat.files());
        assertEquals(List.of("/zones/partial"), flat.directories());

        var deep = store.listDirectory("/zones", true);
        assertEquals(List.of("/zones/a.xml", "/zones/b.xml", "/zones/partial/p.xml"), deep.files());
    }

    @Test
    void missingEntriesAreEmpty() {
        var store = new FileSystemDataStore(root);
        assertTrue(store.listDirectory("/events", true).files().isEmpty());
        assertEquals(0, store.readFile("/data/dropset.xml").length);
    }

    @Test
    void readsFileContents() throws Exception {
        Files.createDirectories(root.resolve("data"));
        Files.writeString(root.resolve("data/dropset.xml"), "<objects/>");
        var store = new FileSystemDataStore(root);
        assertArrayEquals("<objects/>".getBytes(StandardCharsets.UTF_8), store.readFile("/data/dropset.xml"));
    }

    @Test
    void refusesPathsOutsideTheRoot() {
        var store = new FileSystemDataStore(root.resolve("data"));
        assertThrows(IllegalArgumentException.class, () -> store.readFile("/../secret.xml"));
    }
}
