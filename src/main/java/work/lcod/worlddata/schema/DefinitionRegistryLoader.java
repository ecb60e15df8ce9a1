package work.lcod.worlddata.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a registry file:
 *
 * <pre>
 * zones:
 *   - { id: 1, type: 2 }
 * devils: [101, 102]
 * </pre>
 */
public final class DefinitionRegistryLoader {
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private DefinitionRegistryLoader() {}

    public static InMemoryDefinitionRegistry load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Definitions file not found: " + path);
        }
        try (var in = Files.newInputStream(path)) {
            return fromTree(YAML_MAPPER.readTree(in), path.toString());
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read definitions: " + path, ex);
        }
    }

    static InMemoryDefinitionRegistry fromTree(JsonNode root, String origin) {
        var registry = new InMemoryDefinitionRegistry();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return registry;
        }
        if (!root.isObject()) {
            throw new IllegalArgumentException("Definitions file must contain a mapping: " + origin);
        }
        JsonNode zones = root.path("zones");
        if (zones.isArray()) {
            for (JsonNode zone : zones) {
                if (!zone.hasNonNull("id")) {
                    throw new IllegalArgumentException("Zone definition without id in " + origin);
                }
                registry.addZone(new ZoneDefinition(zone.get("id").asInt(), zone.path("type").asInt(0)));
            }
        }
        JsonNode devils = root.path("devils");
        if (devils.isArray()) {
            for (JsonNode devil : devils) {
                registry.addDevil(devil.asInt());
            }
        }
        return registry;
    }
}
