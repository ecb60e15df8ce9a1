package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ActionSetHomepoint extends Action {
    @JsonProperty("zoneId")
    private int zoneId;

    @JsonProperty("spotId")
    private int spotId;

    private ActionSetHomepoint() {}

    public ActionSetHomepoint(SourceContext sourceContext, int zoneId, int spotId) {
        super(sourceContext);
        this.zoneId = zoneId;
        this.spotId = spotId;
    }

    @Override
    public ActionType actionType() {
        return ActionType.SET_HOMEPOINT;
    }

    public int zoneId() {
        return zoneId;
    }

    public int spotId() {
        return spotId;
    }
}
