package work.lcod.worlddata.api;

import java.nio.file.Files;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.worlddata.config.WorldDataConfiguration;
import work.lcod.worlddata.load.FileSystemDataStore;
import work.lcod.worlddata.load.ServerDataLoader;
import work.lcod.worlddata.load.XmlDocumentLoader;
import work.lcod.worlddata.schema.DefinitionRegistry;
import work.lcod.worlddata.schema.DefinitionRegistryLoader;
import work.lcod.worlddata.script.GraalScriptInspector;
import work.lcod.worlddata.script.ScriptInspector;
import work.lcod.worlddata.store.DefinitionKind;
import work.lcod.worlddata.store.DefinitionStore;
import work.lcod.worlddata.validation.Diagnostics;

/**
 * Public entry point for embedding the world data loader.
 */
public final class WorldDataService {
    /** System property that makes failed loads print their stack trace. */
    public static final String DEBUG_PROPERTY = "worlddata.debug";

    private final ScriptInspector scriptInspector;
    private final Diagnostics diagnostics;

    public WorldDataService() {
        this(new GraalScriptInspector(), Diagnostics.slf4j(WorldDataService.class));
    }

    public WorldDataService(ScriptInspector scriptInspector, Diagnostics diagnostics) {
        this.scriptInspector = Objects.requireNonNull(scriptInspector, "scriptInspector");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public LoadResult load(WorldDataConfiguration configuration) {
        var started = Instant.now();
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("dataRoot", configuration.dataRoot().toString());
        configuration.definitionsFile().ifPresent(path -> metadata.put("definitions", path.toString()));
        metadata.put("logLevel", configuration.logLevel().name());
        try {
            if (!Files.isDirectory(configuration.dataRoot())) {
                throw new IllegalArgumentException("Data root is not a directory: " + configuration.dataRoot());
            }
            Optional<DefinitionRegistry> registry = configuration.definitionsFile()
                .map(DefinitionRegistryLoader::load);
            var loader = new ServerDataLoader(new XmlDocumentLoader(), scriptInspector, diagnostics);
            if (!loader.loadAll(new FileSystemDataStore(configuration.dataRoot()), registry)) {
                return LoadResult.failure("Failed to load server data from " + configuration.dataRoot(), metadata,
                    started);
            }
            DefinitionStore store = loader.store().orElseThrow();
            metadata.put("counts", countsByLabel(store));
            metadata.put("status", "ok");
            return LoadResult.success(store, metadata, started);
        } catch (Exception ex) {
            if (Boolean.getBoolean(DEBUG_PROPERTY)) {
                ex.printStackTrace();
            }
            return LoadResult.failure(ex.getMessage(), metadata, started);
        }
    }

    private static Map<String, Integer> countsByLabel(DefinitionStore store) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Map.Entry<DefinitionKind, Integer> entry : store.counts().entrySet()) {
            counts.put(entry.getKey().label(), entry.getValue());
        }
        return counts;
    }
}
