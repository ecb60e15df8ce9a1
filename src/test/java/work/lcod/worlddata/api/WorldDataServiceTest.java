package work.lcod.worlddata.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.worlddata.config.WorldDataConfiguration;
import work.lcod.worlddata.support.RecordingDiagnostics;
import work.lcod.worlddata.support.WorldDataTestSupport;

class WorldDataServiceTest {
    private final RecordingDiagnostics diagnostics = new RecordingDiagnostics();
    private final WorldDataService service = new WorldDataService(WorldDataTestSupport.stubInspector(), diagnostics);

    @Test
    void loadsFixtureDirectory() {
        var config = WorldDataConfiguration.builder()
            .dataRoot(WorldDataTestSupport.fixtureRoot())
            .definitionsFile(WorldDataTestSupport.fixtureDefinitions())
            .logLevel(LogLevel.DEBUG)
            .build();

        var result = service.load(config);

        assertEquals(LoadResult.Status.SUCCESS, result.status());
        assertEquals(0, result.status().exitCode());
        assertTrue(result.store().isPresent());
        var counts = (Map<?, ?>) result.metadata().get("counts");
        assertEquals(5, counts.get("zone"));
        assertEquals(1, counts.get("AI script"));
        assertEquals("DEBUG", result.metadata().get("logLevel"));
        assertTrue(result.toPrettyJson().contains("\"status\" : \"success\""));
    }

    @Test
    void reportsMissingDataRoot(@TempDir Path dir) {
        var config = WorldDataConfiguration.builder().dataRoot(dir.resolve("absent")).build();

        var result = service.load(config);

        assertEquals(LoadResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertTrue(((String) result.metadata().get("error")).startsWith("Data root is not a directory"));
        assertTrue(result.store().isEmpty());
    }

    @Test
    void reportsInvalidDefinitions(@TempDir Path dir) throws Exception {
        Files.createDirectories(dir.resolve("zones"));
        Files.writeString(dir.resolve("zones/z.xml"), "<objects><object><id>1</id>");
        var config = WorldDataConfiguration.builder().dataRoot(dir).build();

        var result = service.load(config);

        assertEquals(LoadResult.Status.FAILURE, result.status());
        assertTrue(((String) result.metadata().get("error")).startsWith("Failed to load server data"));
        assertTrue(diagnostics.hasError("Failed to load file: /zones/z.xml"));
    }

    @Test
    void reportsMissingRegistryFile(@TempDir Path dir) {
        var config = WorldDataConfiguration.builder()
            .dataRoot(dir)
            .definitionsFile(dir.resolve("none.yaml"))
            .build();

        var result = service.load(config);

        assertEquals(LoadResult.Status.FAILURE, result.status());
        assertTrue(((String) result.metadata().get("error")).startsWith("Definitions file not found"));
    }
}
