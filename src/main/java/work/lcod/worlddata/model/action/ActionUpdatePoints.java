package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ActionUpdatePoints extends Action {
    @JsonProperty("pointType")
    private int pointType;

    @JsonProperty("value")
    private long value;

    private ActionUpdatePoints() {}

    public ActionUpdatePoints(SourceContext sourceContext, int pointType, long value) {
        super(sourceContext);
        this.pointType = pointType;
        this.value = value;
    }

    @Override
    public ActionType actionType() {
        return ActionType.UPDATE_POINTS;
    }

    public int pointType() {
        return pointType;
    }

    public long value() {
        return value;
    }
}
