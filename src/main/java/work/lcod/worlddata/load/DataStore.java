package work.lcod.worlddata.load;

import java.util.List;

/**
 * Hierarchical storage the definitions are read from. Paths are absolute, {@code /}-separated and rooted at the
 * store, e.g. {@code /zones/z_00001.xml}.
 */
public interface DataStore {
    /**
     * Lists a directory. A missing directory yields an empty listing.
     */
    Listing listDirectory(String path, boolean recursive);

    /**
     * Reads a whole file; a missing file yields an empty array.
     */
    byte[] readFile(String path);

    record Listing(List<String> files, List<String> directories, List<String> symbolicLinks) {
        public Listing {
            files = List.copyOf(files);
            directories = List.copyOf(directories);
            symbolicLinks = List.copyOf(symbolicLinks);
        }

        public static Listing empty() {
            return new Listing(List.of(), List.of(), List.of());
        }
    }
}
