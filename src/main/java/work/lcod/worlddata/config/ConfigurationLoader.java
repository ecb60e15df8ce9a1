package work.lcod.worlddata.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Collectors;
import org.tomlj.Toml;
import org.tomlj.TomlParseResult;
import work.lcod.worlddata.api.LogLevel;

/**
 * Reads a TOML configuration file:
 *
 * <pre>
 * [data]
 * root = "data"
 * definitions = "definitions.yaml"
 *
 * [logging]
 * level = "info"
 * </pre>
 *
 * Relative paths resolve against the directory holding the file.
 */
public final class ConfigurationLoader {
    private ConfigurationLoader() {}

    public static WorldDataConfiguration load(Path file) {
        Path path = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Configuration file not found: " + path);
        }
        String raw;
        try {
            raw = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read configuration: " + path, ex);
        }
        return parse(raw, path.getParent());
    }

    static WorldDataConfiguration parse(String raw, Path baseDirectory) {
        TomlParseResult result = Toml.parse(raw);
        if (result.hasErrors()) {
            String errors = result.errors().stream()
                .map(Object::toString)
                .collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid configuration: " + errors);
        }
        String root = result.getString("data.root");
        if (root == null || root.isBlank()) {
            throw new IllegalArgumentException("Configuration is missing [data] root");
        }
        String definitions = result.getString("data.definitions");
        return WorldDataConfiguration.builder()
            .dataRoot(resolve(baseDirectory, root))
            .definitionsFile(definitions == null || definitions.isBlank() ? null : resolve(baseDirectory, definitions))
            .logLevel(LogLevel.from(result.getString("logging.level")))
            .build();
    }

    private static Path resolve(Path baseDirectory, String value) {
        Path path = Path.of(value);
        if (path.isAbsolute() || baseDirectory == null) {
            return path.normalize();
        }
        return baseDirectory.resolve(path).normalize();
    }
}
