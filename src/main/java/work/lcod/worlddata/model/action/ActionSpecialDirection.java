package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ActionSpecialDirection extends Action {
    @JsonProperty("direction")
    private int direction;

    @JsonProperty("special1")
    private int special1;

    private ActionSpecialDirection() {}

    public ActionSpecialDirection(SourceContext sourceContext, int direction) {
        super(sourceContext);
        this.direction = direction;
    }

    @Override
    public ActionType actionType() {
        return ActionType.SPECIAL_DIRECTION;
    }

    public int direction() {
        return direction;
    }

    public int special1() {
        return special1;
    }
}
