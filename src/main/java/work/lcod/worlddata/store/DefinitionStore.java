package work.lcod.worlddata.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import work.lcod.worlddata.model.AILogicGroup;
import work.lcod.worlddata.model.DemonPresent;
import work.lcod.worlddata.model.DemonQuestReward;
import work.lcod.worlddata.model.DropSet;
import work.lcod.worlddata.model.ServerShop;
import work.lcod.worlddata.model.event.Event;
import work.lcod.worlddata.model.instance.PvPInstanceVariant;
import work.lcod.worlddata.model.instance.PvPMatchType;
import work.lcod.worlddata.model.instance.ServerZoneInstance;
import work.lcod.worlddata.model.instance.ZoneInstanceVariant;
import work.lcod.worlddata.model.zone.ServerZone;
import work.lcod.worlddata.model.zone.ServerZonePartial;
import work.lcod.worlddata.schema.DefinitionRegistry;
import work.lcod.worlddata.schema.ZoneDefinition;
import work.lcod.worlddata.script.ServerScript;

/**
 * In-memory index of every loaded server definition.
 *
 * <p>A store is filled by a single loading thread, then {@link #seal() sealed}. After sealing it never changes
 * and may be read from any number of threads without locking, provided it was handed over through a safe
 * publication point (the loader publishes it through a volatile field). Registration methods refuse duplicate
 * keys with {@link DuplicateKeyException}; lookups return {@link Optional} and never throw.</p>
 */
public final class DefinitionStore {
    private final Map<Integer, Map<Integer, ServerZone>> zones = new TreeMap<>();
    private final List<ZoneKey> fieldZones = new ArrayList<>();
    private final KeyedIndex<Integer, ServerZonePartial> partials = new KeyedIndex<>(DefinitionKind.ZONE_PARTIAL);
    private final Map<Integer, Set<Integer>> partialsByDynamicMap = new TreeMap<>();
    private final KeyedIndex<String, Event> events = new KeyedIndex<>(DefinitionKind.EVENT);
    private final KeyedIndex<Integer, ServerZoneInstance> instances = new KeyedIndex<>(DefinitionKind.ZONE_INSTANCE);
    private final KeyedIndex<Integer, ZoneInstanceVariant> variants =
        new KeyedIndex<>(DefinitionKind.ZONE_INSTANCE_VARIANT);
    private final Map<PvPMatchType, Set<Integer>> standardPvPVariants = new EnumMap<>(PvPMatchType.class);
    private final KeyedIndex<Integer, ServerShop> shops = new KeyedIndex<>(DefinitionKind.SHOP);
    private final List<Integer> compShops = new ArrayList<>();
    private final KeyedIndex<Integer, AILogicGroup> aiLogicGroups = new KeyedIndex<>(DefinitionKind.AI_LOGIC_GROUP);
    private final KeyedIndex<Integer, DemonPresent> demonPresents = new KeyedIndex<>(DefinitionKind.DEMON_PRESENT);
    private final KeyedIndex<Integer, DemonQuestReward> demonQuestRewards =
        new KeyedIndex<>(DefinitionKind.DEMON_QUEST_REWARD);
    private final KeyedIndex<Integer, DropSet> dropSets = new KeyedIndex<>(DefinitionKind.DROP_SET);
    private final KeyedIndex<Integer, Integer> giftBoxes = new KeyedIndex<>(DefinitionKind.GIFT_BOX);
    private final KeyedIndex<String, ServerScript> scripts = new KeyedIndex<>(DefinitionKind.SCRIPT);
    private final KeyedIndex<String, ServerScript> aiScripts = new KeyedIndex<>(DefinitionKind.AI_SCRIPT);
    private int zoneCount;

    private volatile boolean sealed;

    public void registerZone(ServerZone zone) {
        registerZone(zone, false);
    }

    /**
     * @param field whether the zone is a field zone per the definition registry
     */
    public void registerZone(ServerZone zone, boolean field) {
        ensureWritable();
        var byDynamicMap = zones.computeIfAbsent(zone.id(), k -> new LinkedHashMap<>());
        if (byDynamicMap.containsKey(zone.dynamicMapId())) {
            throw new DuplicateKeyException(DefinitionKind.ZONE, zone.label());
        }
        byDynamicMap.put(zone.dynamicMapId(), zone);
        zoneCount++;
        if (field) {
            fieldZones.add(new ZoneKey(zone.id(), zone.dynamicMapId()));
        }
    }

    /**
     * Registers a partial and, when it is auto-applied, indexes it under each dynamic map it lists. The global
     * partial is never auto-applied.
     */
    public void registerZonePartial(ServerZonePartial partial) {
        ensureWritable();
        partials.put(partial.id(), partial);
        if (!partial.isGlobal() && partial.autoApply()) {
            for (int dynamicMapId : partial.dynamicMapIds()) {
                partialsByDynamicMap.computeIfAbsent(dynamicMapId, k -> new TreeSet<>()).add(partial.id());
            }
        }
    }

    public void registerEvent(Event event) {
        ensureWritable();
        events.put(event.id(), event);
    }

    public void registerZoneInstance(ServerZoneInstance instance) {
        ensureWritable();
        instances.put(instance.id(), instance);
    }

    /**
     * Registers a variant; PvP variants that are neither special mode nor of the custom match type are also
     * indexed as standard variants of their match type.
     */
    public void registerZoneInstanceVariant(ZoneInstanceVariant variant) {
        ensureWritable();
        variants.put(variant.id(), variant);
        if (variant instanceof PvPInstanceVariant pvp && pvp.isStandard()) {
            standardPvPVariants.computeIfAbsent(pvp.matchType(), k -> new TreeSet<>()).add(variant.id());
        }
    }

    public void registerShop(ServerShop shop) {
        ensureWritable();
        shops.put(shop.shopId(), shop);
        if (shop.type() == ServerShop.Type.COMP_SHOP) {
            compShops.add(shop.shopId());
        }
    }

    public void registerAILogicGroup(AILogicGroup group) {
        ensureWritable();
        aiLogicGroups.put(group.id(), group);
    }

    public void registerDemonPresent(DemonPresent present) {
        ensureWritable();
        demonPresents.put(present.id(), present);
    }

    public void registerDemonQuestReward(DemonQuestReward reward) {
        ensureWritable();
        demonQuestRewards.put(reward.id(), reward);
    }

    /**
     * Registers a drop set. A non-zero gift box ID may be claimed by one drop set only.
     */
    public void registerDropSet(DropSet dropSet) {
        ensureWritable();
        dropSets.ensureAbsent(dropSet.id());
        if (dropSet.giftBoxId() != 0) {
            giftBoxes.put(dropSet.giftBoxId(), dropSet.id());
        }
        dropSets.put(dropSet.id(), dropSet);
    }

    public void registerScript(ServerScript script) {
        ensureWritable();
        (script.isAi() ? aiScripts : scripts).put(script.name(), script);
    }

    /**
     * Freezes the store. Further registrations fail with {@link IllegalStateException}.
     */
    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void ensureWritable() {
        if (sealed) {
            throw new IllegalStateException("Definition store is sealed");
        }
    }

    /**
     * Stored zone definition. A dynamic map ID of 0 returns the first zone registered under the zone ID.
     */
    public Optional<ServerZone> zone(int zoneId, int dynamicMapId) {
        var byDynamicMap = zones.get(zoneId);
        if (byDynamicMap == null || byDynamicMap.isEmpty()) {
            return Optional.empty();
        }
        if (dynamicMapId == 0) {
            return Optional.of(byDynamicMap.values().iterator().next());
        }
        return Optional.ofNullable(byDynamicMap.get(dynamicMapId));
    }

    public Optional<ServerZone> zone(int zoneId) {
        return zone(zoneId, 0);
    }

    public boolean containsZone(int zoneId, int dynamicMapId) {
        var byDynamicMap = zones.get(zoneId);
        return byDynamicMap != null && byDynamicMap.containsKey(dynamicMapId);
    }

    /**
     * Zone IDs mapped to the dynamic map IDs defined for them.
     */
    public Map<Integer, Set<Integer>> allZoneIds() {
        Map<Integer, Set<Integer>> ids = new TreeMap<>();
        zones.forEach((id, byDynamicMap) -> ids.put(id, Collections.unmodifiableSet(new TreeSet<>(byDynamicMap.keySet()))));
        return Collections.unmodifiableMap(ids);
    }

    public List<ZoneKey> fieldZoneIds() {
        return Collections.unmodifiableList(fieldZones);
    }

    public Optional<ServerZonePartial> zonePartial(int partialId) {
        return partials.get(partialId);
    }

    /**
     * Auto-applied partial IDs for a dynamic map, ascending.
     */
    public Set<Integer> autoApplyPartialIds(int dynamicMapId) {
        var ids = partialsByDynamicMap.get(dynamicMapId);
        return ids == null ? Set.of() : Collections.unmodifiableSet(ids);
    }

    public Optional<ServerZoneInstance> zoneInstance(int instanceId) {
        return instances.get(instanceId);
    }

    public Set<Integer> allZoneInstanceIds() {
        return Collections.unmodifiableSet(new TreeSet<>(instances.view().keySet()));
    }

    /**
     * Whether the instance contains the zone; a dynamic map ID of 0 matches any dynamic map.
     */
    public boolean existsInInstance(int instanceId, int zoneId, int dynamicMapId) {
        return instances.get(instanceId).map(i -> i.contains(zoneId, dynamicMapId)).orElse(false);
    }

    public Optional<ZoneInstanceVariant> zoneInstanceVariant(int variantId) {
        return variants.get(variantId);
    }

    public Set<Integer> standardPvPVariantIds(PvPMatchType matchType) {
        var ids = standardPvPVariants.get(matchType);
        return ids == null ? Set.of() : Collections.unmodifiableSet(ids);
    }

    /**
     * Checks that an instance exists and that every zone in it is a PvP zone in the registry.
     */
    public boolean verifyPvPInstance(int instanceId, DefinitionRegistry registry) {
        var instance = instances.get(instanceId);
        if (instance.isEmpty()) {
            return false;
        }
        for (int zoneId : instance.get().zoneIds()) {
            if (!registry.zone(zoneId).map(ZoneDefinition::isPvP).orElse(false)) {
                return false;
            }
        }
        return true;
    }

    public Optional<Event> event(String eventId) {
        return events.get(eventId);
    }

    public Optional<ServerShop> shop(int shopId) {
        return shops.get(shopId);
    }

    public List<Integer> compShopIds() {
        return Collections.unmodifiableList(compShops);
    }

    public Optional<AILogicGroup> aiLogicGroup(int id) {
        return aiLogicGroups.get(id);
    }

    public Optional<DemonPresent> demonPresent(int id) {
        return demonPresents.get(id);
    }

    public Map<Integer, DemonQuestReward> demonQuestRewards() {
        return demonQuestRewards.view();
    }

    public Optional<DropSet> dropSet(int id) {
        return dropSets.get(id);
    }

    public Optional<DropSet> giftDropSet(int giftBoxId) {
        return giftBoxes.get(giftBoxId).flatMap(dropSets::get);
    }

    public Optional<ServerScript> script(String name) {
        return scripts.get(name);
    }

    public Optional<ServerScript> aiScript(String name) {
        return aiScripts.get(name);
    }

    /**
     * Number of registered definitions per kind.
     */
    public Map<DefinitionKind, Integer> counts() {
        Map<DefinitionKind, Integer> counts = new EnumMap<>(DefinitionKind.class);
        counts.put(DefinitionKind.ZONE, zoneCount);
        counts.put(DefinitionKind.ZONE_PARTIAL, partials.size());
        counts.put(DefinitionKind.EVENT, events.size());
        counts.put(DefinitionKind.ZONE_INSTANCE, instances.size());
        counts.put(DefinitionKind.ZONE_INSTANCE_VARIANT, variants.size());
        counts.put(DefinitionKind.SHOP, shops.size());
        counts.put(DefinitionKind.AI_LOGIC_GROUP, aiLogicGroups.size());
        counts.put(DefinitionKind.DEMON_PRESENT, demonPresents.size());
        counts.put(DefinitionKind.DEMON_QUEST_REWARD, demonQuestRewards.size());
        counts.put(DefinitionKind.DROP_SET, dropSets.size());
        counts.put(DefinitionKind.GIFT_BOX, giftBoxes.size());
        counts.put(DefinitionKind.SCRIPT, scripts.size());
        counts.put(DefinitionKind.AI_SCRIPT, aiScripts.size());
        return Collections.unmodifiableMap(counts);
    }
}
