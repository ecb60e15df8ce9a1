package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Starts an event sequence for the source.
 */
public final class ActionStartEvent extends Action {
    @JsonProperty("eventId")
    private String eventId;

    @JsonProperty("allowInterrupt")
    private boolean allowInterrupt;

    private ActionStartEvent() {}

    public ActionStartEvent(SourceContext sourceContext, String eventId) {
        super(sourceContext);
        this.eventId = eventId;
    }

    @Override
    public ActionType actionType() {
        return ActionType.START_EVENT;
    }

    public String eventId() {
        return eventId;
    }

    public boolean allowInterrupt() {
        return allowInterrupt;
    }
}
