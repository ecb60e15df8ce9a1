package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server-side zone definition, unique by zone ID and dynamic map ID.
 *
 * <p>Definitions bound from documents or built with {@link #builder(int, int)} are read-only. The only editable
 * instances are the ones returned by {@link #derivedCopy()}, which zone composition uses to overlay partials.</p>
 */
public final class ServerZone extends ZoneContent {
    @JsonProperty("id")
    private int id;

    @JsonProperty("dynamicMapId")
    private int dynamicMapId;

    @JsonProperty("bazaarMarketCount")
    private int bazaarMarketCount;

    private final Map<Integer, PlasmaSpawn> plasmaSpawns = new LinkedHashMap<>();

    private final boolean derived;

    private ServerZone() {
        this.derived = false;
    }

    private ServerZone(int id, int dynamicMapId) {
        this.id = id;
        this.dynamicMapId = dynamicMapId;
        this.derived = false;
    }

    private ServerZone(ServerZone source) {
        super(source);
        this.id = source.id;
        this.dynamicMapId = source.dynamicMapId;
        this.bazaarMarketCount = source.bazaarMarketCount;
        this.plasmaSpawns.putAll(source.plasmaSpawns);
        this.derived = true;
    }

    public static Builder builder(int id, int dynamicMapId) {
        return new Builder(new ServerZone(id, dynamicMapId));
    }

    /**
     * Shallow value copy whose collections are private to the copy; entries are shared until replaced.
     */
    public ServerZone derivedCopy() {
        return new ServerZone(this);
    }

    public int id() {
        return id;
    }

    public int dynamicMapId() {
        return dynamicMapId;
    }

    public int bazaarMarketCount() {
        return bazaarMarketCount;
    }

    public Map<Integer, PlasmaSpawn> plasmaSpawns() {
        return Collections.unmodifiableMap(plasmaSpawns);
    }

    public boolean isDerived() {
        return derived;
    }

    /**
     * Display form used in diagnostics: {@code "<id>"} or {@code "<id> (<dynamicMapId>)"}.
     */
    public String label() {
        return label(id, dynamicMapId);
    }

    public static String label(int id, int dynamicMapId) {
        return id != dynamicMapId ? id + " (" + dynamicMapId + ")" : String.valueOf(id);
    }

    public void putSpawn(Spawn spawn) {
        ensureDerived();
        putSpawnEntry(spawn);
    }

    public void putSpawnGroup(SpawnGroup group) {
        ensureDerived();
        putSpawnGroupEntry(group);
    }

    public void removeSpawnGroup(int groupId) {
        ensureDerived();
        removeSpawnGroupEntry(groupId);
    }

    public void putSpawnLocationGroup(SpawnLocationGroup group) {
        ensureDerived();
        putSpawnLocationGroupEntry(group);
    }

    public void removeSpawnLocationGroup(int groupId) {
        ensureDerived();
        removeSpawnLocationGroupEntry(groupId);
    }

    public void putSpot(ServerZoneSpot spot) {
        ensureDerived();
        putSpotEntry(spot);
    }

    public void replaceNpcs(List<ServerNpc> values) {
        ensureDerived();
        replaceNpcEntries(values);
    }

    public void replaceObjects(List<ServerObject> values) {
        ensureDerived();
        replaceObjectEntries(values);
    }

    public void appendTrigger(ServerZoneTrigger trigger) {
        ensureDerived();
        addTriggerEntry(trigger);
    }

    public void insertDropSetId(int dropSetId) {
        ensureDerived();
        addDropSetIdEntry(dropSetId);
    }

    public void insertSkillWhitelist(int skillId) {
        ensureDerived();
        addWhitelistSkillEntry(skillId);
    }

    public void insertSkillBlacklist(int skillId) {
        ensureDerived();
        addBlacklistSkillEntry(skillId);
    }

    private void ensureDerived() {
        if (!derived) {
            throw new IllegalStateException("Zone definition " + label() + " is read-only; edit a derived copy instead");
        }
    }

    @JsonProperty("plasmaSpawns")
    @JacksonXmlElementWrapper(localName = "plasmaSpawns")
    private void setPlasmaSpawns(List<PlasmaSpawn> values) {
        plasmaSpawns.clear();
        if (values != null) {
            for (PlasmaSpawn plasma : values) {
                if (plasma != null) {
                    plasmaSpawns.put(plasma.id(), plasma);
                }
            }
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ServerZone zone)) {
            return false;
        }
        return id == zone.id
            && dynamicMapId == zone.dynamicMapId
            && bazaarMarketCount == zone.bazaarMarketCount
            && plasmaSpawns.equals(zone.plasmaSpawns)
            && contentEquals(zone);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * id + dynamicMapId) + contentHash();
    }

    @Override
    public String toString() {
        return "ServerZone[" + label() + (derived ? ", derived" : "") + "]";
    }

    public static final class Builder extends ZoneContent.Builder<ServerZone, Builder> {
        private Builder(ServerZone target) {
            super(target);
        }

        @Override
        protected Builder self() {
            return this;
        }

        public Builder bazaarMarketCount(int count) {
            target.bazaarMarketCount = count;
            return this;
        }

        public Builder plasma(PlasmaSpawn plasma) {
            target.plasmaSpawns.put(plasma.id(), plasma);
            return this;
        }
    }
}
