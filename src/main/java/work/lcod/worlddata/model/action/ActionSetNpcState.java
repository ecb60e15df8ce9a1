package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Changes the state of an NPC or object in the zone.
 */
public final class ActionSetNpcState extends Action {
    @JsonProperty("actorId")
    private int actorId;

    @JsonProperty("state")
    private int state;

    @JsonProperty("sourceClientOnly")
    private boolean sourceClientOnly;

    private ActionSetNpcState() {}

    public ActionSetNpcState(SourceContext sourceContext, int actorId, int state) {
        super(sourceContext);
        this.actorId = actorId;
        this.state = state;
    }

    @Override
    public ActionType actionType() {
        return ActionType.SET_NPC_STATE;
    }

    public int actorId() {
        return actorId;
    }

    public int state() {
        return state;
    }

    public boolean sourceClientOnly() {
        return sourceClientOnly;
    }
}
