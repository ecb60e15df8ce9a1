package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Spawns spawn groups at spawn location groups; the defeat actions run once everything spawned here is defeated.
 */
public final class ActionSpawn extends Action {
    @JsonProperty("spawnGroupIds")
    @JacksonXmlElementWrapper(localName = "spawnGroupIds")
    private List<Integer> spawnGroupIds = new ArrayList<>();

    @JsonProperty("spawnLocationGroupIds")
    @JacksonXmlElementWrapper(localName = "spawnLocationGroupIds")
    private List<Integer> spawnLocationGroupIds = new ArrayList<>();

    @JsonProperty("noStagger")
    private boolean noStagger;

    @JsonProperty("defeatActions")
    @JacksonXmlElementWrapper(localName = "defeatActions")
    private List<Action> defeatActions = new ArrayList<>();

    private ActionSpawn() {}

    public ActionSpawn(SourceContext sourceContext, List<Integer> spawnGroupIds, List<Action> defeatActions) {
        super(sourceContext);
        this.spawnGroupIds = spawnGroupIds == null ? new ArrayList<>() : new ArrayList<>(spawnGroupIds);
        this.defeatActions = defeatActions == null ? new ArrayList<>() : new ArrayList<>(defeatActions);
    }

    @Override
    public ActionType actionType() {
        return ActionType.SPAWN;
    }

    public List<Integer> spawnGroupIds() {
        return spawnGroupIds == null ? List.of() : Collections.unmodifiableList(spawnGroupIds);
    }

    public List<Integer> spawnLocationGroupIds() {
        return spawnLocationGroupIds == null ? List.of() : Collections.unmodifiableList(spawnLocationGroupIds);
    }

    public boolean noStagger() {
        return noStagger;
    }

    public List<Action> defeatActions() {
        return defeatActions == null ? List.of() : Collections.unmodifiableList(defeatActions);
    }
}
