package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Adds demon box slots or unsummons the active demon.
 */
public final class ActionUpdateComp extends Action {
    @JsonProperty("addSlots")
    private int addSlots;

    @JsonProperty("unsummon")
    private boolean unsummon;

    private ActionUpdateComp() {}

    public ActionUpdateComp(SourceContext sourceContext, int addSlots) {
        super(sourceContext);
        this.addSlots = addSlots;
    }

    @Override
    public ActionType actionType() {
        return ActionType.UPDATE_COMP;
    }

    public int addSlots() {
        return addSlots;
    }

    public boolean unsummon() {
        return unsummon;
    }
}
