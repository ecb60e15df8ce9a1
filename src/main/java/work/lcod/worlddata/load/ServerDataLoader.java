package work.lcod.worlddata.load;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.lcod.worlddata.model.AILogicGroup;
import work.lcod.worlddata.model.DemonPresent;
import work.lcod.worlddata.model.DemonQuestReward;
import work.lcod.worlddata.model.DropSet;
import work.lcod.worlddata.model.EnchantSetData;
import work.lcod.worlddata.model.EnchantSpecialData;
import work.lcod.worlddata.model.ServerShop;
import work.lcod.worlddata.model.ServerSideDefinition;
import work.lcod.worlddata.model.Tokusei;
import work.lcod.worlddata.model.action.Action;
import work.lcod.worlddata.model.event.Event;
import work.lcod.worlddata.model.event.EventPerformActions;
import work.lcod.worlddata.model.instance.InstanceType;
import work.lcod.worlddata.model.instance.PvPInstanceVariant;
import work.lcod.worlddata.model.instance.ServerZoneInstance;
import work.lcod.worlddata.model.instance.ZoneInstanceVariant;
import work.lcod.worlddata.model.zone.ServerZone;
import work.lcod.worlddata.model.zone.ServerZonePartial;
import work.lcod.worlddata.model.zone.Spawn;
import work.lcod.worlddata.model.zone.SpawnCategory;
import work.lcod.worlddata.model.zone.SpawnGroup;
import work.lcod.worlddata.model.zone.SpawnLocationGroup;
import work.lcod.worlddata.model.zone.ZoneContent;
import work.lcod.worlddata.schema.DefinitionRegistry;
import work.lcod.worlddata.schema.ZoneDefinition;
import work.lcod.worlddata.script.GraalScriptInspector;
import work.lcod.worlddata.script.ScriptInspector;
import work.lcod.worlddata.script.ScriptLoader;
import work.lcod.worlddata.script.ServerScript;
import work.lcod.worlddata.store.DefinitionKind;
import work.lcod.worlddata.store.DefinitionStore;
import work.lcod.worlddata.store.DuplicateKeyException;
import work.lcod.worlddata.validation.ActionValidator;
import work.lcod.worlddata.validation.Diagnostics;

/**
 * Loads every server definition kind from a data store into a fresh {@link DefinitionStore}.
 *
 * <p>Kinds load in a fixed order because later kinds validate against earlier ones: registry dependent kinds
 * (skipped without a registry), zones, partials, events, zone instances, variants, shops, then scripts. The first
 * failure aborts the load and nothing is published; on success the sealed store is available from
 * {@link #store()}.</p>
 */
public final class ServerDataLoader {
    public static final String DEFINITION_EXTENSION = ".xml";

    private final DocumentLoader documentLoader;
    private final ScriptLoader scriptLoader;
    private final ActionValidator validator;
    private final Diagnostics diagnostics;
    private volatile DefinitionStore store;

    public ServerDataLoader(Diagnostics diagnostics) {
        this(new XmlDocumentLoader(), new GraalScriptInspector(), diagnostics);
    }

    public ServerDataLoader(DocumentLoader documentLoader, ScriptInspector scriptInspector, Diagnostics diagnostics) {
        this.documentLoader = Objects.requireNonNull(documentLoader, "documentLoader");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.scriptLoader = new ScriptLoader(scriptInspector, diagnostics);
        this.validator = new ActionValidator(diagnostics);
    }

    /**
     * Loads everything. Returns {@code false} on the first fatal problem, after logging it.
     */
    public boolean loadAll(DataStore dataStore, Optional<DefinitionRegistry> registry) {
        var session = new LoadSession(dataStore, registry.orElse(null));
        try {
            for (LoadStep step : session.steps()) {
                diagnostics.debug("Loading " + step.description() + " server definitions...");
                step.action().run();
            }
        } catch (DefinitionLoadException ex) {
            diagnostics.error(ex.getMessage());
            String path = ex.path().orElse(session.currentFile);
            if (path != null) {
                diagnostics.error("Failed to load file: " + path);
            }
            return false;
        } catch (IllegalStateException ex) {
            diagnostics.error("Failed to read server definitions: " + ex.getMessage());
            return false;
        } catch (RuntimeException ex) {
            diagnostics.error("Unexpected failure while loading server definitions: " + ex);
            if (session.currentFile != null) {
                diagnostics.error("Failed to load file: " + session.currentFile);
            }
            return false;
        }
        session.target.seal();
        store = session.target;
        return true;
    }

    /**
     * The store filled by the last successful {@link #loadAll} call.
     */
    public Optional<DefinitionStore> store() {
        return Optional.ofNullable(store);
    }

    public ScriptLoader scriptLoader() {
        return scriptLoader;
    }

    private record LoadStep(String description, Runnable action) {}

    @FunctionalInterface
    private interface ObjectHandler<T> {
        void load(T object);
    }

    /**
     * State of one {@link #loadAll} call.
     */
    private final class LoadSession {
        private final DataStore dataStore;
        private final DefinitionRegistry registry;
        private final DefinitionStore target = new DefinitionStore();
        private String currentFile;

        LoadSession(DataStore dataStore, DefinitionRegistry registry) {
            this.dataStore = Objects.requireNonNull(dataStore, "dataStore");
            this.registry = registry;
        }

        List<LoadStep> steps() {
            List<LoadStep> steps = new ArrayList<>();
            if (registry != null) {
                steps.add(new LoadStep("AI logic group", () -> loadObjects("/data/ailogicgroup", false, true,
                    AILogicGroup.class, target::registerAILogicGroup)));
                steps.add(new LoadStep("demon present", () -> loadObjects("/data/demonpresent", false, true,
                    DemonPresent.class, target::registerDemonPresent)));
                steps.add(new LoadStep("demon quest reward", () -> loadObjects("/data/demonquestreward", false,
                    true, DemonQuestReward.class, target::registerDemonQuestReward)));
                steps.add(new LoadStep("drop set", () -> loadObjects("/data/dropset", false, true,
                    DropSet.class, target::registerDropSet)));
                steps.add(new LoadStep("enchant set", () -> loadObjects("/data/enchantset", false, true,
                    EnchantSetData.class, this::registerServerSide)));
                steps.add(new LoadStep("enchant special", () -> loadObjects("/data/enchantspecial", false, true,
                    EnchantSpecialData.class, this::registerServerSide)));
                steps.add(new LoadStep("tokusei", () -> loadObjects("/data/tokusei", false, true,
                    Tokusei.class, this::registerServerSide)));
            }
            steps.add(new LoadStep("zone", () -> loadObjects("/zones", false, false,
                ServerZone.class, this::loadZone)));
            steps.add(new LoadStep("zone partial", () -> loadObjects("/zones/partial", true, false,
                ServerZonePartial.class, this::loadPartial)));
            steps.add(new LoadStep("event", () -> loadObjects("/events", true, false,
                Event.class, this::loadEvent)));
            steps.add(new LoadStep("zone instance", () -> loadObjects("/data/zoneinstance", false, true,
                ServerZoneInstance.class, this::loadInstance)));
            steps.add(new LoadStep("zone instance variant", () -> loadObjects("/data/zoneinstancevariant", false,
                true, ZoneInstanceVariant.class, this::loadVariant)));
            steps.add(new LoadStep("shop", () -> loadObjects("/shops", true, false,
                ServerShop.class, this::loadShop)));
            steps.add(new LoadStep("script", this::loadScripts));
            return steps;
        }

        /**
         * Loads every definition file under {@code path}. With {@code fileOrPath}, a path without definition
         * files is read as the single file {@code <path>.xml} instead.
         */
        private <T> void loadObjects(String path, boolean recursive, boolean fileOrPath, Class<T> type,
            ObjectHandler<T> handler) {
            boolean loaded = false;
            for (String file : dataStore.listDirectory(path, recursive).files()) {
                if (file.endsWith(DEFINITION_EXTENSION)) {
                    loadFile(file, type, handler);
                    loaded = true;
                }
            }
            if (!loaded && fileOrPath) {
                loadFile(path + DEFINITION_EXTENSION, type, handler);
            }
        }

        private <T> void loadFile(String file, Class<T> type, ObjectHandler<T> handler) {
            currentFile = file;
            byte[] data = dataStore.readFile(file);
            if (data.length == 0) {
                diagnostics.warning("File does not exist or is empty: " + file);
                currentFile = null;
                return;
            }
            for (T object : documentLoader.loadObjects(data, file, type)) {
                handler.load(object);
            }
            diagnostics.debug("Loaded XML file: " + file);
            currentFile = null;
        }

        private void registerServerSide(ServerSideDefinition definition) {
            if (!registry.registerServerSideDefinition(definition)) {
                throw new DefinitionLoadException("Duplicate " + definition.definitionKind()
                    + " definition encountered: " + definition.id());
            }
        }

        private void loadZone(ServerZone zone) {
            String label = zone.label();
            boolean field = false;
            if (registry != null) {
                Optional<ZoneDefinition> definition = registry.zone(zone.id());
                if (definition.isEmpty()) {
                    diagnostics.warning("Skipping unknown zone: " + label);
                    return;
                }
                field = definition.get().isField();
            }
            if (target.containsZone(zone.id(), zone.dynamicMapId())) {
                throw new DuplicateKeyException(DefinitionKind.ZONE, label);
            }

            checkSpawns(zone, "zone " + label);
            for (SpawnGroup group : zone.spawnGroups().values()) {
                for (int spawnId : group.spawnIds()) {
                    if (!zone.spawnsKeyExists(spawnId)) {
                        throw new DefinitionLoadException("Invalid spawn group spawn ID encountered in zone "
                            + label + ": " + spawnId);
                    }
                }
            }
            for (SpawnLocationGroup group : zone.spawnLocationGroups().values()) {
                for (int groupId : group.groupIds()) {
                    if (!zone.spawnGroupsKeyExists(groupId)) {
                        throw new DefinitionLoadException("Invalid spawn location group spawn group ID"
                            + " encountered in zone " + label + ": " + groupId);
                    }
                }
            }

            validateContent(zone, "Zone " + label);
            zone.plasmaSpawns().forEach((id, plasma) -> {
                validate(plasma.successActions(), "Zone " + label + ", Plasma " + id, false);
                validate(plasma.failActions(), "Zone " + label + ", Plasma " + id, false);
            });

            target.registerZone(zone, field);
        }

        private void loadPartial(ServerZonePartial partial) {
            if (target.zonePartial(partial.id()).isPresent()) {
                throw new DuplicateKeyException(DefinitionKind.ZONE_PARTIAL, partial.id());
            }
            if (partial.isGlobal()) {
                if (!partial.dynamicMapIds().isEmpty() || !partial.npcs().isEmpty()
                    || !partial.objects().isEmpty() || !partial.spots().isEmpty()) {
                    diagnostics.warning("Direct global partial zone definitions specified but will be ignored");
                }
            } else {
                // Spawn group references are not checked here: a partial may point at spawns of the zone it
                // is applied to, and composition strips whatever is still missing.
                checkSpawns(partial, "zone partial " + partial.id());
            }
            validateContent(partial, "Partial " + partial.id());
            target.registerZonePartial(partial);
        }

        /**
         * Enemy types must exist in the registry and only boss spawns may carry a boss group.
         */
        private void checkSpawns(ZoneContent content, String owner) {
            if (registry == null) {
                return;
            }
            for (Spawn spawn : content.spawns().values()) {
                if (!registry.hasDevil(spawn.enemyType())) {
                    throw new DefinitionLoadException("Invalid spawn enemy type encountered in " + owner + ": "
                        + spawn.enemyType());
                }
                if (spawn.bossGroup() != 0 && spawn.category() != SpawnCategory.BOSS) {
                    throw new DefinitionLoadException("Invalid spawn boss group encountered in " + owner + ": "
                        + spawn.id());
                }
            }
        }

        private void validateContent(ZoneContent content, String owner) {
            for (SpawnGroup group : content.spawnGroups().values()) {
                validate(group.defeatActions(), owner + ", SG " + group.id() + " Defeat", false);
                validate(group.spawnActions(), owner + ", SG " + group.id() + " Spawn", false);
            }
            content.npcs().forEach(npc -> validate(npc.actions(), owner + ", NPC " + npc.id(), false));
            content.objects().forEach(obj -> validate(obj.actions(), owner + ", Object " + obj.id(), false));
            content.spots().forEach((id, spot) -> {
                validate(spot.actions(), owner + ", Spot " + id, false);
                validate(spot.leaveActions(), owner + ", Spot " + id, false);
            });
            content.triggers().forEach(trigger -> validate(trigger.actions(), owner + " trigger",
                ActionValidator.triggerIsAutoContext(trigger)));
        }

        private void validate(List<Action> actions, String source,
            boolean autoContext) {
            if (!validator.validate(actions, source, autoContext)) {
                throw new DefinitionLoadException("Invalid actions encountered: " + source);
            }
        }

        private void loadEvent(Event event) {
            if (event.id().isEmpty()) {
                throw new DefinitionLoadException("Event with no ID encountered");
            }
            if (target.event(event.id()).isPresent()) {
                throw new DuplicateKeyException(DefinitionKind.EVENT, event.id());
            }
            if (event instanceof EventPerformActions perform
                && !validator.validate(perform.actions(), event.id(), false, true)) {
                throw new DefinitionLoadException("Invalid actions encountered: " + event.id());
            }
            target.registerEvent(event);
        }

        private void loadInstance(ServerZoneInstance instance) {
            if (registry != null && registry.zone(instance.lobbyId()).isEmpty()) {
                diagnostics.warning("Skipping zone instance with unknown lobby: " + instance.lobbyId());
                return;
            }
            List<Integer> zoneIds = instance.zoneIds();
            List<Integer> dynamicMapIds = instance.dynamicMapIds();
            if (hasEmptyEntry(zoneIds) || hasEmptyEntry(dynamicMapIds)) {
                throw new DefinitionLoadException("Zone instance encountered with an empty zone or dynamic map ID: "
                    + instance.id());
            }
            if (zoneIds.size() != dynamicMapIds.size()) {
                throw new DefinitionLoadException("Zone instance encountered with zone and dynamic map counts"
                    + " that do not match: " + instance.id());
            }
            for (int i = 0; i < zoneIds.size(); i++) {
                if (!target.containsZone(zoneIds.get(i), dynamicMapIds.get(i))) {
                    throw new DefinitionLoadException("Invalid zone encountered for instance: " + zoneIds.get(i)
                        + " (" + dynamicMapIds.get(i) + ")");
                }
            }
            target.registerZoneInstance(instance);
        }

        private void loadVariant(ZoneInstanceVariant variant) {
            if (target.zoneInstanceVariant(variant.id()).isPresent()) {
                throw new DuplicateKeyException(DefinitionKind.ZONE_INSTANCE_VARIANT, variant.id());
            }
            if (hasEmptyEntry(variant.timePoints())) {
                throw new DefinitionLoadException("Zone instance variant encountered with an empty time point: "
                    + variant.id());
            }
            InstanceType type = variant.instanceType();
            int[] allowed = type.requiredTimePointCounts();
            if (allowed.length > 0 && !contains(allowed, variant.timePoints().size())) {
                throw new DefinitionLoadException(type + " zone instance variant encountered without "
                    + describeCounts(allowed) + " time points specified: " + variant.id());
            }
            if (type == InstanceType.PENTALPHA && variant.subId() >= 5) {
                throw new DefinitionLoadException("Pentalpha zone instance variant encountered with invalid sub ID: "
                    + variant.id());
            }
            if (variant instanceof PvPInstanceVariant pvp && registry != null && pvp.defaultInstanceId() != 0
                && !target.verifyPvPInstance(pvp.defaultInstanceId(), registry)) {
                throw new DefinitionLoadException("Failed to verify PvP instance: " + pvp.defaultInstanceId());
            }
            target.registerZoneInstanceVariant(variant);
        }

        private void loadShop(ServerShop shop) {
            if (target.shop(shop.shopId()).isPresent()) {
                throw new DuplicateKeyException(DefinitionKind.SHOP, shop.shopId());
            }
            if (shop.tabs().size() > ServerShop.MAX_TABS) {
                throw new DefinitionLoadException("Shop with more than " + ServerShop.MAX_TABS
                    + " tabs encountered: " + shop.shopId());
            }
            target.registerShop(shop);
        }

        private void loadScripts() {
            currentFile = null;
            for (ServerScript script : scriptLoader.loadScripts(dataStore, "/scripts")) {
                currentFile = script.path();
                target.registerScript(script);
            }
            currentFile = null;
        }
    }

    private static boolean hasEmptyEntry(List<Integer> values) {
        for (Integer value : values) {
            if (value == null) {
                return true;
            }
        }
        return false;
    }

    private static boolean contains(int[] values, int value) {
        for (int candidate : values) {
            if (candidate == value) {
                return true;
            }
        }
        return false;
    }

    private static String describeCounts(int[] counts) {
        if (counts.length == 1) {
            return String.valueOf(counts[0]);
        }
        return counts[0] + " or " + counts[1];
    }
}
