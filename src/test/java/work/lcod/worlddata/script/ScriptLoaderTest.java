package work.lcod.worlddata.script;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.worlddata.load.DefinitionLoadException;
import work.lcod.worlddata.load.FileSystemDataStore;
import work.lcod.worlddata.support.RecordingDiagnostics;
import work.lcod.worlddata.support.WorldDataTestSupport;

class ScriptLoaderTest {
    @TempDir
    Path root;

    private final RecordingDiagnostics diagnostics = new RecordingDiagnostics();
    private final ScriptLoader loader = new ScriptLoader(WorldDataTestSupport.stubInspector(), diagnostics);

    @Test
    void loadsScriptsRecursively() throws IOException {
        write("scripts/ai/boss.js", script("boss", "AI", "prepare"));
        write("scripts/events/gate.js", script("gate", "eventcondition", "check"));
        write("scripts/readme.txt", "not a script");

        List<ServerScript> scripts = loader.loadScripts(new FileSystemDataStore(root), "/scripts");

        assertEquals(2, scripts.size());
        assertEquals(ScriptType.AI, scripts.get(0).type());
        assertEquals("/scripts/ai/boss.js", scripts.get(0).path());
        assertEquals(ScriptType.EVENT_CONDITION, scripts.get(1).type());
        assertTrue(diagnostics.hasDebug("Loaded script file: /scripts/events/gate.js"));
    }

    @Test
    void sameNameMayBeUsedOnceInEachNameSpace() throws IOException {
        write("scripts/a.js", script("shared", "ai", "prepare"));
        write("scripts/b.js", script("shared", "actioncustom", "run"));
        assertEquals(2, loader.loadScripts(new FileSystemDataStore(root), "/scripts").size());

        write("scripts/c.js", script("shared", "webgame", "start"));
        var ex = assertThrows(DefinitionLoadException.class,
            () -> loader.loadScripts(new FileSystemDataStore(root), "/scripts"));
        assertEquals("Duplicate script encountered: shared", ex.getMessage());
        assertEquals("/scripts/c.js", ex.path().orElseThrow());
    }

    @Test
    void rejectsUnknownTypes() {
        var ex = assertThrows(DefinitionLoadException.class,
            () -> loader.loadScript("/scripts/x.js", script("x", "plugin", "run")));
        assertEquals("Invalid script type encountered: plugin", ex.getMessage());
    }

    @Test
    void requiresTypeFunctions() {
        var ex = assertThrows(DefinitionLoadException.class,
            () -> loader.loadScript("/scripts/t.js", script("t", "actiontransform", "run")));
        assertEquals("Transform script encountered with no 'transform' function: t", ex.getMessage());
    }

    @Test
    void rejectsReservedFunctions() {
        var ex = assertThrows(DefinitionLoadException.class,
            () -> loader.loadScript("/scripts/t.js", script("t", "eventtransform", "transform", "prepare")));
        assertEquals("Transform script encountered with reserved function name 'prepare': t", ex.getMessage());
    }

    @Test
    void wrapsInspectionFailures() {
        var ex = assertThrows(DefinitionLoadException.class,
            () -> loader.loadScript("/scripts/empty.js", "function run() {}"));
        assertEquals("Script is not properly defined: /scripts/empty.js", ex.getMessage());
        assertEquals("/scripts/empty.js", ex.path().orElseThrow());
    }

    @Test
    void resolvesTypeTags() {
        assertEquals(ScriptType.EVENT_BRANCH_LOGIC, ScriptType.fromTag(" EventBranchLogic ").orElseThrow());
        assertTrue(ScriptType.fromTag(null).isEmpty());
        assertTrue(ScriptType.fromTag("unknown").isEmpty());
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static String script(String name, String type, String... functions) {
        var source = new StringBuilder()
            .append("function define(script) {\n")
            .append("    script.name = \"").append(name).append("\";\n")
            .append("    script.type = \"").append(type).append("\";\n")
            .append("    return 0;\n}\n");
        for (String function : functions) {
            source.append("function ").append(function).append("() { return 0; }\n");
        }
        return source.toString();
    }
}
