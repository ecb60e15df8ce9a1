package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Applies or removes a status effect.
 */
public final class ActionAddRemoveStatus extends Action {
    @JsonProperty("statusId")
    private int statusId;

    @JsonProperty("stacks")
    private int stacks;

    @JsonProperty("replace")
    private boolean replace;

    private ActionAddRemoveStatus() {}

    public ActionAddRemoveStatus(SourceContext sourceContext, int statusId, int stacks) {
        super(sourceContext);
        this.statusId = statusId;
        this.stacks = stacks;
    }

    @Override
    public ActionType actionType() {
        return ActionType.ADD_REMOVE_STATUS;
    }

    public int statusId() {
        return statusId;
    }

    public int stacks() {
        return stacks;
    }

    public boolean replace() {
        return replace;
    }
}
