package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Shifts the source's law/neutral/chaos value.
 */
public final class ActionUpdateLnc extends Action {
    @JsonProperty("value")
    private int value;

    @JsonProperty("absolute")
    private boolean absolute;

    private ActionUpdateLnc() {}

    public ActionUpdateLnc(SourceContext sourceContext, int value) {
        super(sourceContext);
        this.value = value;
    }

    @Override
    public ActionType actionType() {
        return ActionType.UPDATE_LNC;
    }

    public int value() {
        return value;
    }

    public boolean absolute() {
        return absolute;
    }
}
