package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Grants experience to the source.
 */
public final class ActionGrantXp extends Action {
    @JsonProperty("xp")
    private long xp;

    @JsonProperty("adjustable")
    private boolean adjustable;

    private ActionGrantXp() {}

    public ActionGrantXp(SourceContext sourceContext, long xp) {
        super(sourceContext);
        this.xp = xp;
    }

    @Override
    public ActionType actionType() {
        return ActionType.GRANT_XP;
    }

    public long xp() {
        return xp;
    }

    public boolean adjustable() {
        return adjustable;
    }
}
