package work.lcod.worlddata.load;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.worlddata.model.EnchantSetData;
import work.lcod.worlddata.model.event.EventPerformActions;
import work.lcod.worlddata.model.instance.PvPInstanceVariant;
import work.lcod.worlddata.model.instance.PvPMatchType;
import work.lcod.worlddata.schema.DefinitionRegistry;
import work.lcod.worlddata.schema.InMemoryDefinitionRegistry;
import work.lcod.worlddata.schema.ZoneDefinition;
import work.lcod.worlddata.store.DefinitionKind;
import work.lcod.worlddata.store.DefinitionStore;
import work.lcod.worlddata.store.ZoneKey;
import work.lcod.worlddata.support.RecordingDiagnostics;
import work.lcod.worlddata.support.WorldDataTestSupport;

class ServerDataLoaderTest {
    @TempDir
    Path root;

    private RecordingDiagnostics diagnostics;
    private ServerDataLoader loader;

    @BeforeEach
    void setUp() {
        diagnostics = new RecordingDiagnostics();
        loader = new ServerDataLoader(new XmlDocumentLoader(), WorldDataTestSupport.stubInspector(), diagnostics);
    }

    @Test
    void loadsFixtureDataWithRegistry() {
        var registry = WorldDataTestSupport.fixtureRegistry();
        assertTrue(loader.loadAll(fixtureStore(), Optional.of(registry)), () -> diagnostics.errors().toString());

        DefinitionStore store = loader.store().orElseThrow();
        assertTrue(store.isSealed());
        assertEquals(5, store.counts().get(DefinitionKind.ZONE));
        assertTrue(store.zone(99).isEmpty());
        assertTrue(diagnostics.hasWarning("Skipping unknown zone: 99"));
        assertEquals(List.of(new ZoneKey(1, 1), new ZoneKey(1, 2), new ZoneKey(2, 2)), store.fieldZoneIds());

        assertEquals(4, store.counts().get(DefinitionKind.ZONE_PARTIAL));
        assertEquals(List.of(5), List.copyOf(store.autoApplyPartialIds(1)));

        var intro = assertInstanceOf(EventPerformActions.class, store.event("evt_intro").orElseThrow());
        assertEquals(2, intro.actions().size());
        assertTrue(store.event("evt_msg").isPresent());

        assertTrue(store.existsInInstance(1, 1, 1));
        assertInstanceOf(PvPInstanceVariant.class, store.zoneInstanceVariant(2).orElseThrow());
        assertEquals(List.of(2), List.copyOf(store.standardPvPVariantIds(PvPMatchType.FATE)));
        assertEquals(List.of(2), store.compShopIds());
        assertEquals(2, store.giftDropSet(900).orElseThrow().id());
        assertTrue(store.aiScript("zone_boss").isPresent());
        assertTrue(store.script("grant_bonus").isPresent());

        assertTrue(diagnostics.hasWarning("File does not exist or is empty: /data/ailogicgroup.xml"));
        assertTrue(diagnostics.hasDebug("Loaded XML file: /zones/zone_001.xml"));
        assertTrue(diagnostics.warnings().stream().noneMatch(w -> w.contains("before the end of its action list")));
    }

    @Test
    void loadsWithoutRegistry() {
        assertTrue(loader.loadAll(fixtureStore(), Optional.empty()), () -> diagnostics.errors().toString());

        DefinitionStore store = loader.store().orElseThrow();
        assertEquals(6, store.counts().get(DefinitionKind.ZONE));
        assertTrue(store.fieldZoneIds().isEmpty());
        assertEquals(0, store.counts().get(DefinitionKind.DROP_SET));
    }

    @Test
    void failedLoadPublishesNothing() throws IOException {
        write("zones/z.xml", zone("""
            <spawnGroups>
                <spawnGroup><id>1</id><spawnIds><spawnId>5</spawnId></spawnIds></spawnGroup>
            </spawnGroups>
            """));

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(loader.store().isEmpty());
        assertTrue(diagnostics.hasError("Invalid spawn group spawn ID encountered in zone 1: 5"));
        assertTrue(diagnostics.hasError("Failed to load file: /zones/z.xml"));
    }

    @Test
    void rejectsDanglingLocationGroups() throws IOException {
        write("zones/z.xml", zone("""
            <spawnLocationGroups>
                <spawnLocationGroup><id>1</id><groupIds><groupId>8</groupId></groupIds></spawnLocationGroup>
            </spawnLocationGroups>
            """));

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Invalid spawn location group spawn group ID encountered in zone 1: 8"));
    }

    @Test
    void rejectsUnknownEnemiesAndMisplacedBossGroups() throws IOException {
        var registry = new InMemoryDefinitionRegistry().addZone(new ZoneDefinition(1, 2)).addDevil(101);
        write("zones/z.xml", zone("""
            <spawns><spawn><id>1</id><enemyType>999</enemyType></spawn></spawns>
            """));
        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.of(registry)));
        assertTrue(diagnostics.hasError("Invalid spawn enemy type encountered in zone 1: 999"));

        write("zones/z.xml", zone("""
            <spawns><spawn><id>1</id><enemyType>101</enemyType><bossGroup>2</bossGroup></spawn></spawns>
            """));
        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.of(registry)));
        assertTrue(diagnostics.hasError("Invalid spawn boss group encountered in zone 1: 1"));
    }

    @Test
    void rejectsPlayerActionsInAutomatedTriggers() throws IOException {
        write("zones/z.xml", zone("""
            <triggers>
                <trigger>
                    <trigger>ON_SETUP</trigger>
                    <actions>
                        <action type="DISPLAY_MESSAGE"><messageIds><messageId>1</messageId></messageIds></action>
                    </actions>
                </trigger>
            </triggers>
            """));

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Zone 1 trigger: DISPLAY_MESSAGE"));
        assertTrue(diagnostics.hasError("Invalid actions encountered: Zone 1 trigger"));
    }

    @Test
    void rejectsDuplicateZones() throws IOException {
        write("zones/a.xml", zone(""));
        write("zones/b.xml", zone(""));

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Duplicate zone encountered: 1"));
        assertTrue(diagnostics.hasError("Failed to load file: /zones/b.xml"));
    }

    @Test
    void warnsAboutDirectGlobalPartialContent() throws IOException {
        write("zones/partial/global.xml", """
            <objects>
                <object>
                    <id>0</id>
                    <npcs><npc><id>5</id><x>1</x><y>1</y></npc></npcs>
                </object>
            </objects>
            """);

        assertTrue(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasWarning("Direct global partial zone definitions specified but will be ignored"));
        assertTrue(loader.store().orElseThrow().autoApplyPartialIds(0).isEmpty());
    }

    @Test
    void partialsMayReferenceBaseZoneSpawns() throws IOException {
        write("zones/partial/p.xml", """
            <objects>
                <object>
                    <id>3</id>
                    <spawnGroups>
                        <spawnGroup><id>1</id><spawnIds><spawnId>77</spawnId></spawnIds></spawnGroup>
                    </spawnGroups>
                </object>
            </objects>
            """);

        assertTrue(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
    }

    @Test
    void rejectsEventsWithoutId() throws IOException {
        write("events/e.xml", """
            <objects>
                <object type="NPC_MESSAGE"><messageIds><messageId>1</messageId></messageIds></object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Event with no ID encountered"));
        assertTrue(diagnostics.hasError("Failed to load file: /events/e.xml"));
    }

    @Test
    void rejectsMismatchedInstanceZoneLists() throws IOException {
        write("zones/z.xml", zone(""));
        write("data/zoneinstance.xml", """
            <objects>
                <object>
                    <id>4</id>
                    <zoneIds><zoneId>1</zoneId></zoneIds>
                    <dynamicMapIds><dynamicMapId>1</dynamicMapId><dynamicMapId>2</dynamicMapId></dynamicMapIds>
                </object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError(
            "Zone instance encountered with zone and dynamic map counts that do not match: 4"));
        assertTrue(diagnostics.hasError("Failed to load file: /data/zoneinstance.xml"));
    }

    @Test
    void rejectsInstancesWithEmptyZoneIds() throws IOException {
        write("zones/z.xml", zone(""));
        write("data/zoneinstance.xml", """
            <objects>
                <object>
                    <id>4</id>
                    <zoneIds><zoneId/></zoneIds>
                    <dynamicMapIds><dynamicMapId>1</dynamicMapId></dynamicMapIds>
                </object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Zone instance encountered with an empty zone or dynamic map ID: 4"));
        assertTrue(diagnostics.hasError("Failed to load file: /data/zoneinstance.xml"));
        assertTrue(loader.store().isEmpty());
    }

    @Test
    void rejectsVariantsWithEmptyTimePoints() throws IOException {
        write("data/zoneinstancevariant.xml", """
            <objects>
                <object>
                    <id>2</id>
                    <instanceType>TIME_TRIAL</instanceType>
                    <timePoints>
                        <timePoint>1</timePoint><timePoint/><timePoint>3</timePoint><timePoint>4</timePoint>
                    </timePoints>
                </object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Zone instance variant encountered with an empty time point: 2"));
    }

    @Test
    void rejectsInstancesWithUnknownZones() throws IOException {
        write("data/zoneinstance.xml", """
            <objects>
                <object>
                    <id>4</id>
                    <zoneIds><zoneId>1</zoneId></zoneIds>
                    <dynamicMapIds><dynamicMapId>1</dynamicMapId></dynamicMapIds>
                </object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Invalid zone encountered for instance: 1 (1)"));
    }

    @Test
    void skipsInstancesWithUnknownLobby() throws IOException {
        write("data/zoneinstance.xml", """
            <objects>
                <object><id>4</id><lobbyId>55</lobbyId></object>
            </objects>
            """);

        assertTrue(loader.loadAll(new FileSystemDataStore(root), Optional.of(new InMemoryDefinitionRegistry())));
        assertTrue(diagnostics.hasWarning("Skipping zone instance with unknown lobby: 55"));
        assertTrue(loader.store().orElseThrow().zoneInstance(4).isEmpty());
    }

    @Test
    void checksVariantTimePoints() throws IOException {
        write("data/zoneinstancevariant.xml", """
            <objects>
                <object>
                    <id>1</id>
                    <instanceType>TIME_TRIAL</instanceType>
                    <timePoints><timePoint>1</timePoint><timePoint>2</timePoint><timePoint>3</timePoint></timePoints>
                </object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError(
            "TIME_TRIAL zone instance variant encountered without 4 time points specified: 1"));
    }

    @Test
    void checksPentalphaSubId() throws IOException {
        write("data/zoneinstancevariant.xml", """
            <objects>
                <object><id>9</id><instanceType>PENTALPHA</instanceType><subId>5</subId></object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Pentalpha zone instance variant encountered with invalid sub ID: 9"));
    }

    @Test
    void verifiesPvPDefaultInstances() throws IOException {
        var registry = new InMemoryDefinitionRegistry()
            .addZone(new ZoneDefinition(1, ZoneDefinition.FIELD_TYPE))
            .addZone(new ZoneDefinition(10, 1));
        write("zones/z.xml", zone(""));
        write("data/zoneinstance.xml", """
            <objects>
                <object>
                    <id>4</id>
                    <lobbyId>10</lobbyId>
                    <zoneIds><zoneId>1</zoneId></zoneIds>
                    <dynamicMapIds><dynamicMapId>1</dynamicMapId></dynamicMapIds>
                </object>
            </objects>
            """);
        write("data/zoneinstancevariant.xml", """
            <objects>
                <object>
                    <id>2</id>
                    <instanceType>PVP</instanceType>
                    <defaultInstanceId>4</defaultInstanceId>
                    <timePoints><timePoint>60</timePoint><timePoint>600</timePoint></timePoints>
                </object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.of(registry)));
        assertTrue(diagnostics.hasError("Failed to verify PvP instance: 4"));
    }

    @Test
    void rejectsShopsWithTooManyTabs() throws IOException {
        var tabs = new StringBuilder();
        for (int i = 0; i <= 100; i++) {
            tabs.append("<tab><name>T").append(i).append("</name></tab>");
        }
        write("shops/big.xml", "<objects><object><shopId>3</shopId><tabs>" + tabs + "</tabs></object></objects>");

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("Shop with more than 100 tabs encountered: 3"));
    }

    @Test
    void rejectsDuplicateGiftBoxes() throws IOException {
        write("data/dropset.xml", """
            <objects>
                <object><id>1</id><giftBoxId>900</giftBoxId></object>
                <object><id>2</id><giftBoxId>900</giftBoxId></object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.of(new InMemoryDefinitionRegistry())));
        assertTrue(diagnostics.hasError("Duplicate drop set gift box ID encountered: 900"));
        assertTrue(diagnostics.hasError("Failed to load file: /data/dropset.xml"));
    }

    @Test
    void registersServerSideDefinitionsWithTheRegistry() throws IOException {
        var registry = new InMemoryDefinitionRegistry();
        write("data/enchantset/sets.xml", """
            <objects>
                <object><id>1</id><effectIds><effectId>11</effectId></effectIds></object>
                <object><id>2</id></object>
            </objects>
            """);

        assertTrue(loader.loadAll(new FileSystemDataStore(root), Optional.of(registry)));
        assertEquals(2, registry.serverSideDefinitionCount("enchantset"));
        assertEquals(List.of(11), registry.serverSideDefinition("enchantset", 1, EnchantSetData.class)
            .orElseThrow().effectIds());
    }

    @Test
    void rejectsDuplicateServerSideDefinitions() throws IOException {
        DefinitionRegistry registry = new InMemoryDefinitionRegistry();
        write("data/enchantset.xml", """
            <objects>
                <object><id>1</id></object>
                <object><id>1</id></object>
            </objects>
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.of(registry)));
        assertTrue(diagnostics.hasError("Duplicate enchantset definition encountered: 1"));
    }

    @Test
    void rejectsInvalidScripts() throws IOException {
        write("scripts/ai/broken.js", """
            function define(script) {
                script.name = "broken";
                script.type = "ai";
                return 0;
            }
            """);

        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertTrue(diagnostics.hasError("AI script encountered with no 'prepare' function: broken"));
        assertTrue(diagnostics.hasError("Failed to load file: /scripts/ai/broken.js"));
    }

    @Test
    void keepsPreviousStoreAfterFailedReload() throws IOException {
        write("zones/a.xml", zone(""));
        assertTrue(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        DefinitionStore first = loader.store().orElseThrow();

        write("zones/b.xml", zone(""));
        assertFalse(loader.loadAll(new FileSystemDataStore(root), Optional.empty()));
        assertSame(first, loader.store().orElseThrow());
    }

    private FileSystemDataStore fixtureStore() {
        return new FileSystemDataStore(WorldDataTestSupport.fixtureRoot());
    }

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static String zone(String content) {
        return "<objects><object><id>1</id><dynamicMapId>1</dynamicMapId>" + content + "</object></objects>";
    }
}
