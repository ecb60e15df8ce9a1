package work.lcod.worlddata.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.worlddata.api.LoadResult;
import work.lcod.worlddata.api.LogLevel;
import work.lcod.worlddata.api.WorldDataService;
import work.lcod.worlddata.config.ConfigurationLoader;
import work.lcod.worlddata.config.WorldDataConfiguration;
import work.lcod.worlddata.model.zone.ServerZone;
import work.lcod.worlddata.validation.Diagnostics;
import work.lcod.worlddata.zone.ZoneComposer;

@CommandLine.Command(
    name = "worlddata",
    description = "Load and validate game server world definitions.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class WorldDataCommand implements Callable<Integer> {
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"--config"},
        description = "TOML configuration file.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configFile;

    @CommandLine.Option(
        names = {"-d", "--data"},
        description = "World data directory (overrides [data] root).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path dataRoot;

    @CommandLine.Option(
        names = {"--definitions"},
        description = "Definition registry YAML file (overrides [data] definitions).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path definitionsFile;

    @CommandLine.Option(
        names = {"--log-level"},
        description = "Minimum log level (trace, debug, info, warn, error, fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = {"-z", "--zone"},
        description = "Zone to compose after a successful load.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer zoneId;

    @CommandLine.Option(
        names = {"--dynamic-map"},
        description = "Dynamic map ID of the zone to compose; 0 picks the first one.",
        defaultValue = "0"
    )
    private int dynamicMapId;

    @CommandLine.Option(
        names = {"-p", "--partial"},
        description = "Extra partial ID to apply to the composed zone (repeatable)."
    )
    private List<Integer> partialIds = new ArrayList<>();

    @CommandLine.Option(
        names = {"--no-partials"},
        description = "Skip partials when composing the zone."
    )
    private boolean noPartials;

    @Override
    public Integer call() {
        WorldDataConfiguration configuration = resolveConfiguration();
        System.setProperty(SIMPLE_LOGGER_LEVEL, configuration.logLevel().simpleLoggerName());

        var service = new WorldDataService();
        LoadResult result = service.load(configuration);
        if (result.isSuccess() && zoneId != null) {
            var composer = new ZoneComposer(result.store().orElseThrow(), Diagnostics.slf4j(ZoneComposer.class));
            Optional<ServerZone> zone = composer.resolve(zoneId, dynamicMapId, !noPartials,
                new LinkedHashSet<>(partialIds));
            if (zone.isEmpty()) {
                System.out.println(result.toPrettyJson());
                System.err.println("Zone could not be resolved: " + ServerZone.label(zoneId, dynamicMapId));
                return LoadResult.Status.FAILURE.exitCode();
            }
            result = result.withMetadata("zone", describeZone(zone.get()));
        }
        System.out.println(result.toPrettyJson());
        return result.status().exitCode();
    }

    private WorldDataConfiguration resolveConfiguration() {
        WorldDataConfiguration.Builder builder;
        if (configFile != null) {
            builder = ConfigurationLoader.load(configFile).toBuilder();
        } else {
            if (dataRoot == null) {
                throw new CommandLine.ParameterException(spec.commandLine(),
                    "Either --config or --data is required.");
            }
            builder = WorldDataConfiguration.builder();
            builder.logLevel(LogLevel.from(System.getenv("WORLDDATA_LOG_LEVEL")));
        }
        if (dataRoot != null) {
            builder.dataRoot(dataRoot.toAbsolutePath().normalize());
        }
        if (definitionsFile != null) {
            builder.definitionsFile(definitionsFile.toAbsolutePath().normalize());
        }
        if (logLevelRaw != null && !logLevelRaw.isBlank()) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return builder.build();
    }

    static Map<String, Object> describeZone(ServerZone zone) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("id", zone.id());
        summary.put("dynamicMapId", zone.dynamicMapId());
        summary.put("derived", zone.isDerived());
        summary.put("spawns", zone.spawns().size());
        summary.put("spawnGroups", new ArrayList<>(zone.spawnGroups().keySet()));
        summary.put("spawnLocationGroups", new ArrayList<>(zone.spawnLocationGroups().keySet()));
        summary.put("npcs", zone.npcs().size());
        summary.put("objects", zone.objects().size());
        summary.put("spots", zone.spots().size());
        summary.put("triggers", zone.triggers().size());
        summary.put("dropSetIds", new ArrayList<>(zone.dropSetIds()));
        return summary;
    }
}
