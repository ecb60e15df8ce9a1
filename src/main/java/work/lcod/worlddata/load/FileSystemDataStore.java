package work.lcod.worlddata.load;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * {@link DataStore} backed by a directory on the local filesystem.
 */
public final class FileSystemDataStore implements DataStore {
    private final Path root;

    public FileSystemDataStore(Path root) {
        this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    @Override
    public Listing listDirectory(String path, boolean recursive) {
        Path dir = resolve(path);
        if (!Files.isDirectory(dir)) {
            return Listing.empty();
        }
        List<String> files = new ArrayList<>();
        List<String> directories = new ArrayList<>();
        List<String> links = new ArrayList<>();
        try (Stream<Path> stream = recursive ? Files.walk(dir) : Files.list(dir)) {
            stream.filter(p -> !p.equals(dir)).forEach(p -> {
                String virtual = toVirtual(p);
                if (Files.isSymbolicLink(p)) {
                    links.add(virtual);
                } else if (Files.isDirectory(p, LinkOption.NOFOLLOW_LINKS)) {
                    directories.add(virtual);
                } else if (Files.isRegularFile(p, LinkOption.NOFOLLOW_LINKS)) {
                    files.add(virtual);
                }
            });
        } catch (IOException ex) {
            throw new IllegalStateException("failed to list directory: " + dir + ": " + ex.getMessage(), ex);
        }
        Collections.sort(files);
        Collections.sort(directories);
        Collections.sort(links);
        return new Listing(files, directories, links);
    }

    @Override
    public byte[] readFile(String path) {
        Path file = resolve(path);
        if (!Files.isRegularFile(file)) {
            return new byte[0];
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException ex) {
            throw new IllegalStateException("failed to read file: " + file + ": " + ex.getMessage(), ex);
        }
    }

    private Path resolve(String path) {
        String relative = path == null ? "" : path.replaceFirst("^/+", "");
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the data root: " + path);
        }
        return resolved;
    }

    private String toVirtual(Path path) {
        String relative = root.relativize(path).toString().replace('\\', '/');
        return "/" + relative;
    }
}
