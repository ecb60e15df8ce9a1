package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import work.lcod.worlddata.model.action.Action;

/**
 * Named set of spawn IDs spawned together, with the actions run when the group spawns and when it is defeated.
 */
public final class SpawnGroup {
    @JsonProperty("id")
    private int id;

    @JsonProperty("restrictionId")
    private int restrictionId;

    private final Set<Integer> spawnIds = new TreeSet<>();

    @JsonProperty("spawnActions")
    @JacksonXmlElementWrapper(localName = "spawnActions")
    private List<Action> spawnActions = new ArrayList<>();

    @JsonProperty("defeatActions")
    @JacksonXmlElementWrapper(localName = "defeatActions")
    private List<Action> defeatActions = new ArrayList<>();

    private SpawnGroup() {}

    public SpawnGroup(int id, Collection<Integer> spawnIds) {
        this(id, spawnIds, List.of(), List.of());
    }

    public SpawnGroup(int id, Collection<Integer> spawnIds, List<Action> spawnActions, List<Action> defeatActions) {
        this.id = id;
        if (spawnIds != null) {
            this.spawnIds.addAll(spawnIds);
        }
        this.spawnActions = new ArrayList<>(spawnActions == null ? List.of() : spawnActions);
        this.defeatActions = new ArrayList<>(defeatActions == null ? List.of() : defeatActions);
    }

    @JsonProperty("spawnIds")
    @JacksonXmlElementWrapper(localName = "spawnIds")
    private void setSpawnIds(List<Integer> values) {
        spawnIds.clear();
        if (values != null) {
            spawnIds.addAll(values);
        }
    }

    public int id() {
        return id;
    }

    public int restrictionId() {
        return restrictionId;
    }

    public Set<Integer> spawnIds() {
        return Collections.unmodifiableSet(spawnIds);
    }

    public List<Action> spawnActions() {
        return spawnActions == null ? List.of() : Collections.unmodifiableList(spawnActions);
    }

    public List<Action> defeatActions() {
        return defeatActions == null ? List.of() : Collections.unmodifiableList(defeatActions);
    }

    /**
     * Copy of this group that no longer references the supplied spawn IDs. The receiver is left untouched.
     */
    public SpawnGroup withoutSpawns(Collection<Integer> removed) {
        var copy = new SpawnGroup(id, spawnIds, spawnActions(), defeatActions());
        copy.restrictionId = restrictionId;
        copy.spawnIds.removeAll(removed);
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SpawnGroup group)) {
            return false;
        }
        return id == group.id
            && restrictionId == group.restrictionId
            && spawnIds.equals(group.spawnIds)
            && spawnActions().equals(group.spawnActions())
            && defeatActions().equals(group.defeatActions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, restrictionId, spawnIds);
    }

    @Override
    public String toString() {
        return "SpawnGroup[" + id + " " + spawnIds + "]";
    }
}
