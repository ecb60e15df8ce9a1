package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Content shared by zone definitions and zone partials: keyed spawn data and spots, positioned NPCs and
 * objects, triggers and the scalar ID sets.
 *
 * <p>Keyed collections are bound from lists in documents and indexed by ID; a later entry with the same ID
 * replaces an earlier one.</p>
 */
public abstract class ZoneContent {
    private final Map<Integer, Spawn> spawns = new LinkedHashMap<>();
    private final Map<Integer, SpawnGroup> spawnGroups = new LinkedHashMap<>();
    private final Map<Integer, SpawnLocationGroup> spawnLocationGroups = new LinkedHashMap<>();
    private final Map<Integer, ServerZoneSpot> spots = new LinkedHashMap<>();
    private final List<ServerNpc> npcs = new ArrayList<>();
    private final List<ServerObject> objects = new ArrayList<>();
    private final List<ServerZoneTrigger> triggers = new ArrayList<>();
    private final Set<Integer> dropSetIds = new TreeSet<>();
    private final Set<Integer> skillWhitelist = new TreeSet<>();
    private final Set<Integer> skillBlacklist = new TreeSet<>();

    protected ZoneContent() {}

    protected ZoneContent(ZoneContent source) {
        spawns.putAll(source.spawns);
        spawnGroups.putAll(source.spawnGroups);
        spawnLocationGroups.putAll(source.spawnLocationGroups);
        spots.putAll(source.spots);
        npcs.addAll(source.npcs);
        objects.addAll(source.objects);
        triggers.addAll(source.triggers);
        dropSetIds.addAll(source.dropSetIds);
        skillWhitelist.addAll(source.skillWhitelist);
        skillBlacklist.addAll(source.skillBlacklist);
    }

    public Map<Integer, Spawn> spawns() {
        return Collections.unmodifiableMap(spawns);
    }

    public boolean spawnsKeyExists(int spawnId) {
        return spawns.containsKey(spawnId);
    }

    public Map<Integer, SpawnGroup> spawnGroups() {
        return Collections.unmodifiableMap(spawnGroups);
    }

    public boolean spawnGroupsKeyExists(int groupId) {
        return spawnGroups.containsKey(groupId);
    }

    public Map<Integer, SpawnLocationGroup> spawnLocationGroups() {
        return Collections.unmodifiableMap(spawnLocationGroups);
    }

    public Map<Integer, ServerZoneSpot> spots() {
        return Collections.unmodifiableMap(spots);
    }

    public List<ServerNpc> npcs() {
        return Collections.unmodifiableList(npcs);
    }

    public List<ServerObject> objects() {
        return Collections.unmodifiableList(objects);
    }

    public List<ServerZoneTrigger> triggers() {
        return Collections.unmodifiableList(triggers);
    }

    public Set<Integer> dropSetIds() {
        return Collections.unmodifiableSet(dropSetIds);
    }

    public Set<Integer> skillWhitelist() {
        return Collections.unmodifiableSet(skillWhitelist);
    }

    public Set<Integer> skillBlacklist() {
        return Collections.unmodifiableSet(skillBlacklist);
    }

    protected void putSpawnEntry(Spawn spawn) {
        spawns.put(spawn.id(), spawn);
    }

    protected void putSpawnGroupEntry(SpawnGroup group) {
        spawnGroups.put(group.id(), group);
    }

    protected void removeSpawnGroupEntry(int groupId) {
        spawnGroups.remove(groupId);
    }

    protected void putSpawnLocationGroupEntry(SpawnLocationGroup group) {
        spawnLocationGroups.put(group.id(), group);
    }

    protected void removeSpawnLocationGroupEntry(int groupId) {
        spawnLocationGroups.remove(groupId);
    }

    protected void putSpotEntry(ServerZoneSpot spot) {
        spots.put(spot.id(), spot);
    }

    protected void replaceNpcEntries(List<ServerNpc> values) {
        npcs.clear();
        npcs.addAll(values);
    }

    protected void addNpcEntry(ServerNpc npc) {
        npcs.add(npc);
    }

    protected void replaceObjectEntries(List<ServerObject> values) {
        objects.clear();
        objects.addAll(values);
    }

    protected void addObjectEntry(ServerObject object) {
        objects.add(object);
    }

    protected void addTriggerEntry(ServerZoneTrigger trigger) {
        triggers.add(trigger);
    }

    protected void addDropSetIdEntry(int dropSetId) {
        dropSetIds.add(dropSetId);
    }

    protected void addWhitelistSkillEntry(int skillId) {
        skillWhitelist.add(skillId);
    }

    protected void addBlacklistSkillEntry(int skillId) {
        skillBlacklist.add(skillId);
    }

    @JsonProperty("spawns")
    @JacksonXmlElementWrapper(localName = "spawns")
    private void setSpawns(List<Spawn> values) {
        spawns.clear();
        nonNull(values).forEach(this::putSpawnEntry);
    }

    @JsonProperty("spawnGroups")
    @JacksonXmlElementWrapper(localName = "spawnGroups")
    private void setSpawnGroups(List<SpawnGroup> values) {
        spawnGroups.clear();
        nonNull(values).forEach(this::putSpawnGroupEntry);
    }

    @JsonProperty("spawnLocationGroups")
    @JacksonXmlElementWrapper(localName = "spawnLocationGroups")
    private void setSpawnLocationGroups(List<SpawnLocationGroup> values) {
        spawnLocationGroups.clear();
        nonNull(values).forEach(this::putSpawnLocationGroupEntry);
    }

    @JsonProperty("spots")
    @JacksonXmlElementWrapper(localName = "spots")
    private void setSpots(List<ServerZoneSpot> values) {
        spots.clear();
        nonNull(values).forEach(this::putSpotEntry);
    }

    @JsonProperty("npcs")
    @JacksonXmlElementWrapper(localName = "npcs")
    private void setNpcs(List<ServerNpc> values) {
        replaceNpcEntries(nonNull(values));
    }

    @JsonProperty("objects")
    @JacksonXmlElementWrapper(localName = "objects")
    private void setObjects(List<ServerObject> values) {
        replaceObjectEntries(nonNull(values));
    }

    @JsonProperty("triggers")
    @JacksonXmlElementWrapper(localName = "triggers")
    private void setTriggers(List<ServerZoneTrigger> values) {
        triggers.clear();
        triggers.addAll(nonNull(values));
    }

    @JsonProperty("dropSetIds")
    @JacksonXmlElementWrapper(localName = "dropSetIds")
    private void setDropSetIds(List<Integer> values) {
        dropSetIds.clear();
        dropSetIds.addAll(nonNull(values));
    }

    @JsonProperty("skillWhitelist")
    @JacksonXmlElementWrapper(localName = "skillWhitelist")
    private void setSkillWhitelist(List<Integer> values) {
        skillWhitelist.clear();
        skillWhitelist.addAll(nonNull(values));
    }

    @JsonProperty("skillBlacklist")
    @JacksonXmlElementWrapper(localName = "skillBlacklist")
    private void setSkillBlacklist(List<Integer> values) {
        skillBlacklist.clear();
        skillBlacklist.addAll(nonNull(values));
    }

    protected boolean contentEquals(ZoneContent other) {
        return spawns.equals(other.spawns)
            && spawnGroups.equals(other.spawnGroups)
            && spawnLocationGroups.equals(other.spawnLocationGroups)
            && spots.equals(other.spots)
            && npcs.equals(other.npcs)
            && objects.equals(other.objects)
            && triggers.equals(other.triggers)
            && dropSetIds.equals(other.dropSetIds)
            && skillWhitelist.equals(other.skillWhitelist)
            && skillBlacklist.equals(other.skillBlacklist);
    }

    protected int contentHash() {
        return Objects.hash(spawns.keySet(), spawnGroups.keySet(), spawnLocationGroups.keySet(), spots.keySet(),
            npcs.size(), objects.size(), triggers.size(), dropSetIds);
    }

    private static <T> List<T> nonNull(List<T> values) {
        if (values == null) {
            return List.of();
        }
        List<T> filtered = new ArrayList<>(values.size());
        for (T value : values) {
            if (value != null) {
                filtered.add(value);
            }
        }
        return filtered;
    }

    /**
     * Fluent builder shared by zones and partials.
     */
    public abstract static class Builder<T extends ZoneContent, B extends Builder<T, B>> {
        protected final T target;

        protected Builder(T target) {
            this.target = target;
        }

        protected abstract B self();

        public B spawn(Spawn spawn) {
            target.putSpawnEntry(spawn);
            return self();
        }

        public B spawnGroup(SpawnGroup group) {
            target.putSpawnGroupEntry(group);
            return self();
        }

        public B spawnLocationGroup(SpawnLocationGroup group) {
            target.putSpawnLocationGroupEntry(group);
            return self();
        }

        public B spot(ServerZoneSpot spot) {
            target.putSpotEntry(spot);
            return self();
        }

        public B npc(ServerNpc npc) {
            target.addNpcEntry(npc);
            return self();
        }

        public B object(ServerObject object) {
            target.addObjectEntry(object);
            return self();
        }

        public B trigger(ServerZoneTrigger trigger) {
            target.addTriggerEntry(trigger);
            return self();
        }

        public B dropSetId(int dropSetId) {
            target.addDropSetIdEntry(dropSetId);
            return self();
        }

        public B whitelistSkill(int skillId) {
            target.addWhitelistSkillEntry(skillId);
            return self();
        }

        public B blacklistSkill(int skillId) {
            target.addBlacklistSkillEntry(skillId);
            return self();
        }

        public T build() {
            return target;
        }
    }
}
