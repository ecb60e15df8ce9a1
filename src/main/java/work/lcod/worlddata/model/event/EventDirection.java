package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class EventDirection extends Event {
    @JsonProperty("direction")
    private int direction;

    private EventDirection() {}

    public EventDirection(String id, int direction) {
        super(id);
        this.direction = direction;
    }

    @Override
    public EventType eventType() {
        return EventType.DIRECTION;
    }

    public int direction() {
        return direction;
    }
}
