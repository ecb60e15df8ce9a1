package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Creates, joins or times a zone instance.
 */
public final class ActionZoneInstance extends Action {
    @JsonProperty("instanceId")
    private int instanceId;

    @JsonProperty("variantId")
    private int variantId;

    @JsonProperty("mode")
    private ZoneInstanceMode mode = ZoneInstanceMode.JOIN;

    private ActionZoneInstance() {}

    public ActionZoneInstance(SourceContext sourceContext, int instanceId, ZoneInstanceMode mode) {
        super(sourceContext);
        this.instanceId = instanceId;
        this.mode = mode;
    }

    @Override
    public ActionType actionType() {
        return ActionType.ZONE_INSTANCE;
    }

    public int instanceId() {
        return instanceId;
    }

    public int variantId() {
        return variantId;
    }

    public ZoneInstanceMode mode() {
        return mode == null ? ZoneInstanceMode.JOIN : mode;
    }
}
