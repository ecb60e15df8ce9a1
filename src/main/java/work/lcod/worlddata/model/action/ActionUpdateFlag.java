package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sets a player-scoped flag value.
 */
public final class ActionUpdateFlag extends Action {
    @JsonProperty("flagId")
    private int flagId;

    @JsonProperty("value")
    private int value;

    private ActionUpdateFlag() {}

    public ActionUpdateFlag(SourceContext sourceContext, int flagId, int value) {
        super(sourceContext);
        this.flagId = flagId;
        this.value = value;
    }

    @Override
    public ActionType actionType() {
        return ActionType.UPDATE_FLAG;
    }

    public int flagId() {
        return flagId;
    }

    public int value() {
        return value;
    }
}
