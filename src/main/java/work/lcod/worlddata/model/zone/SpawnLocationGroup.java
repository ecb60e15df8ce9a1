package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Set of spawn groups tied to a set of map locations.
 */
public final class SpawnLocationGroup {
    @JsonProperty("id")
    private int id;

    @JsonProperty("respawnTime")
    private float respawnTime;

    private final Set<Integer> groupIds = new TreeSet<>();

    private SpawnLocationGroup() {}

    public SpawnLocationGroup(int id, Collection<Integer> groupIds) {
        this.id = id;
        if (groupIds != null) {
            this.groupIds.addAll(groupIds);
        }
    }

    @JsonProperty("groupIds")
    @JacksonXmlElementWrapper(localName = "groupIds")
    private void setGroupIds(List<Integer> values) {
        groupIds.clear();
        if (values != null) {
            groupIds.addAll(values);
        }
    }

    public int id() {
        return id;
    }

    public float respawnTime() {
        return respawnTime;
    }

    public Set<Integer> groupIds() {
        return Collections.unmodifiableSet(groupIds);
    }

    /**
     * Copy of this location group that no longer references the supplied spawn group IDs.
     */
    public SpawnLocationGroup withoutGroups(Collection<Integer> removed) {
        var copy = new SpawnLocationGroup(id, groupIds);
        copy.respawnTime = respawnTime;
        copy.groupIds.removeAll(removed);
        return copy;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SpawnLocationGroup group)) {
            return false;
        }
        return id == group.id
            && Float.compare(respawnTime, group.respawnTime) == 0
            && groupIds.equals(group.groupIds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, groupIds);
    }

    @Override
    public String toString() {
        return "SpawnLocationGroup[" + id + " " + groupIds + "]";
    }
}
