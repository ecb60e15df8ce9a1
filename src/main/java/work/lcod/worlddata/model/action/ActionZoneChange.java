package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Moves the source to another zone (or another point of the current one when {@code zoneId} is 0).
 */
public final class ActionZoneChange extends Action {
    @JsonProperty("zoneId")
    private int zoneId;

    @JsonProperty("dynamicMapId")
    private int dynamicMapId;

    @JsonProperty("spotId")
    private int spotId;

    @JsonProperty("destinationX")
    private float destinationX;

    @JsonProperty("destinationY")
    private float destinationY;

    private ActionZoneChange() {}

    public ActionZoneChange(SourceContext sourceContext, int zoneId, int dynamicMapId, int spotId) {
        super(sourceContext);
        this.zoneId = zoneId;
        this.dynamicMapId = dynamicMapId;
        this.spotId = spotId;
    }

    @Override
    public ActionType actionType() {
        return ActionType.ZONE_CHANGE;
    }

    public int zoneId() {
        return zoneId;
    }

    public int dynamicMapId() {
        return dynamicMapId;
    }

    public int spotId() {
        return spotId;
    }

    public float destinationX() {
        return destinationX;
    }

    public float destinationY() {
        return destinationY;
    }
}
