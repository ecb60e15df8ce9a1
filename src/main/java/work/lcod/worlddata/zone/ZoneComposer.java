package work.lcod.worlddata.zone;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.IntPredicate;
import work.lcod.worlddata.model.zone.ServerZone;
import work.lcod.worlddata.model.zone.ServerZonePartial;
import work.lcod.worlddata.model.zone.SpawnGroup;
import work.lcod.worlddata.model.zone.SpawnLocationGroup;
import work.lcod.worlddata.model.zone.ZonePlacement;
import work.lcod.worlddata.store.DefinitionStore;
import work.lcod.worlddata.validation.Diagnostics;

/**
 * Builds zone definitions with partials applied.
 *
 * <p>The composer only reads the store. Whenever partials apply, the stored zone is copied and the copy is
 * returned; the stored definition is never edited. Calls are independent and may run concurrently once the store
 * is sealed.</p>
 */
public final class ZoneComposer {
    /** Maximum X and Y distance at which two unspotted placements are treated as the same position. */
    public static final float POSITION_TOLERANCE = 10.0f;

    private final DefinitionStore store;
    private final Diagnostics diagnostics;

    public ZoneComposer(DefinitionStore store, Diagnostics diagnostics) {
        this.store = Objects.requireNonNull(store, "store");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public Optional<ServerZone> resolve(int zoneId, int dynamicMapId) {
        return resolve(zoneId, dynamicMapId, true, Set.of());
    }

    /**
     * Resolves a zone, applying the auto-apply partials of its dynamic map plus the eligible extra partials in
     * ascending partial ID order.
     *
     * <p>An extra partial ID that does not name a stored partial fails the whole call. IDs that name a partial
     * but are not eligible (the global partial, auto-apply partials, partials scoped to other dynamic maps) are
     * skipped.</p>
     *
     * @return the stored zone itself when no partial applies, a new derived zone otherwise, or empty when the
     *         zone is unknown or an extra partial ID is invalid
     */
    public Optional<ServerZone> resolve(int zoneId, int dynamicMapId, boolean applyPartials,
        Set<Integer> extraPartialIds) {
        Optional<ServerZone> stored = store.zone(zoneId, dynamicMapId);
        if (stored.isEmpty() || !applyPartials) {
            return stored;
        }
        ServerZone base = stored.get();

        Set<Integer> partialIds = new TreeSet<>(store.autoApplyPartialIds(base.dynamicMapId()));
        if (extraPartialIds != null) {
            for (int partialId : new TreeSet<>(extraPartialIds)) {
                Optional<ServerZonePartial> partial = store.zonePartial(partialId);
                if (partial.isEmpty()) {
                    diagnostics.error("Invalid zone partial ID encountered: " + partialId);
                    return Optional.empty();
                }
                if (isEligibleExtra(partial.get(), base)) {
                    partialIds.add(partialId);
                }
            }
        }

        if (partialIds.isEmpty()) {
            return stored;
        }

        ServerZone zone = base.derivedCopy();
        for (int partialId : partialIds) {
            applyPartial(zone, store.zonePartial(partialId).orElseThrow(), true);
        }
        repairSpawnReferences(zone);
        return Optional.of(zone);
    }

    /**
     * Applies one stored partial to a derived zone.
     *
     * @return {@code false} if {@code zone} is the stored definition itself, is not a derived copy, or the
     *         partial ID is 0 or unknown
     */
    public boolean applyPartialTo(ServerZone zone, int partialId) {
        if (zone == null || partialId == ServerZonePartial.GLOBAL_PARTIAL_ID) {
            return false;
        }
        Optional<ServerZone> origin = store.zone(zone.id(), zone.dynamicMapId());
        if (origin.isPresent() && origin.get() == zone) {
            diagnostics.error("Attempted to apply partial definition to original zone definition: " + zone.label());
            return false;
        }
        if (!zone.isDerived()) {
            diagnostics.error("Attempted to apply partial definition to read-only zone definition: " + zone.label());
            return false;
        }
        Optional<ServerZonePartial> partial = store.zonePartial(partialId);
        if (partial.isEmpty()) {
            diagnostics.error("Invalid zone partial ID encountered: " + partialId);
            return false;
        }
        applyPartial(zone, partial.get(), true);
        return true;
    }

    /**
     * Overlays a partial onto a derived zone.
     *
     * @param positionReplace when set, incoming NPCs and objects first remove the entries they conflict with:
     *                        the same non-zero spot ID, or both unspotted and closer than
     *                        {@link #POSITION_TOLERANCE} on both axes. Incoming entries with ID 0 only delete.
     */
    public static void applyPartial(ServerZone zone, ServerZonePartial partial, boolean positionReplace) {
        partial.dropSetIds().forEach(zone::insertDropSetId);
        partial.skillWhitelist().forEach(zone::insertSkillWhitelist);
        partial.skillBlacklist().forEach(zone::insertSkillBlacklist);

        zone.replaceNpcs(mergePlacements(zone.npcs(), partial.npcs(), positionReplace));
        zone.replaceObjects(mergePlacements(zone.objects(), partial.objects(), positionReplace));

        partial.spawns().values().forEach(zone::putSpawn);
        partial.spawnGroups().values().forEach(zone::putSpawnGroup);
        partial.spawnLocationGroups().values().forEach(zone::putSpawnLocationGroup);
        partial.spots().values().forEach(zone::putSpot);

        partial.triggers().forEach(zone::appendTrigger);
    }

    static boolean conflicts(ZonePlacement existing, ZonePlacement incoming) {
        if (incoming.spotId() != 0) {
            return existing.spotId() == incoming.spotId();
        }
        return existing.spotId() == 0
            && Math.abs(existing.x() - incoming.x()) < POSITION_TOLERANCE
            && Math.abs(existing.y() - incoming.y()) < POSITION_TOLERANCE;
    }

    private static <T extends ZonePlacement> List<T> mergePlacements(List<T> current, List<T> incoming,
        boolean positionReplace) {
        List<T> merged = new ArrayList<>(current);
        for (T placement : incoming) {
            if (positionReplace) {
                merged.removeIf(existing -> conflicts(existing, placement));
            }
            if (placement.id() != 0) {
                merged.add(placement);
            }
        }
        return merged;
    }

    private boolean isEligibleExtra(ServerZonePartial partial, ServerZone zone) {
        if (partial.isGlobal()) {
            diagnostics.debug("Skipping global zone partial requested for zone " + zone.label());
            return false;
        }
        if (partial.autoApply()) {
            diagnostics.debug("Skipping auto-applied zone partial " + partial.id() + " requested for zone "
                + zone.label());
            return false;
        }
        if (!partial.appliesTo(zone.dynamicMapId())) {
            diagnostics.debug("Skipping zone partial " + partial.id() + " not scoped to zone " + zone.label());
            return false;
        }
        return true;
    }

    /**
     * Strips spawn groups of spawns the zone no longer defines and location groups of spawn groups that were
     * removed. A group left with no valid reference is removed.
     */
    private void repairSpawnReferences(ServerZone zone) {
        Set<Integer> emptyGroups = new TreeSet<>();
        for (SpawnGroup group : new ArrayList<>(zone.spawnGroups().values())) {
            Set<Integer> missing = missing(group.spawnIds(), zone::spawnsKeyExists);
            if (missing.isEmpty()) {
                continue;
            }
            if (missing.size() < group.spawnIds().size()) {
                zone.putSpawnGroup(group.withoutSpawns(missing));
            } else {
                emptyGroups.add(group.id());
            }
        }
        for (int groupId : emptyGroups) {
            diagnostics.debug("Removing empty spawn group " + groupId + " when generating zone: " + zone.label());
            zone.removeSpawnGroup(groupId);
        }

        Set<Integer> emptyLocations = new TreeSet<>();
        for (SpawnLocationGroup group : new ArrayList<>(zone.spawnLocationGroups().values())) {
            Set<Integer> missing = missing(group.groupIds(), zone::spawnGroupsKeyExists);
            if (missing.isEmpty()) {
                continue;
            }
            if (missing.size() < group.groupIds().size()) {
                zone.putSpawnLocationGroup(group.withoutGroups(missing));
            } else {
                emptyLocations.add(group.id());
            }
        }
        for (int groupId : emptyLocations) {
            diagnostics.debug("Removing empty spawn location group " + groupId + " when generating zone: "
                + zone.label());
            zone.removeSpawnLocationGroup(groupId);
        }
    }

    private static Set<Integer> missing(Collection<Integer> ids, IntPredicate exists) {
        Set<Integer> missing = new TreeSet<>();
        for (int id : ids) {
            if (!exists.test(id)) {
                missing.add(id);
            }
        }
        return missing;
    }
}
