package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared AI behaviour settings referenced by spawns through their logic group ID.
 */
public final class AILogicGroup {
    @JsonProperty("id")
    private int id;

    @JsonProperty("aggroLimit")
    private int aggroLimit;

    @JsonProperty("skillIds")
    @JacksonXmlElementWrapper(localName = "skillIds")
    private List<Integer> skillIds = new ArrayList<>();

    private AILogicGroup() {}

    public AILogicGroup(int id, int aggroLimit) {
        this.id = id;
        this.aggroLimit = aggroLimit;
    }

    public int id() {
        return id;
    }

    public int aggroLimit() {
        return aggroLimit;
    }

    public List<Integer> skillIds() {
        return skillIds == null ? List.of() : Collections.unmodifiableList(skillIds);
    }
}
