package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sets a zone-scoped flag value.
 */
public final class ActionUpdateZoneFlags extends Action {
    @JsonProperty("flagId")
    private int flagId;

    @JsonProperty("value")
    private int value;

    private ActionUpdateZoneFlags() {}

    public ActionUpdateZoneFlags(SourceContext sourceContext, int flagId, int value) {
        super(sourceContext);
        this.flagId = flagId;
        this.value = value;
    }

    @Override
    public ActionType actionType() {
        return ActionType.UPDATE_ZONE_FLAGS;
    }

    public int flagId() {
        return flagId;
    }

    public int value() {
        return value;
    }
}
