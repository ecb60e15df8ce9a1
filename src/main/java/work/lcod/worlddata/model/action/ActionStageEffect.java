package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ActionStageEffect extends Action {
    @JsonProperty("messageId")
    private int messageId;

    @JsonProperty("effectType")
    private int effectType;

    private ActionStageEffect() {}

    public ActionStageEffect(SourceContext sourceContext, int messageId) {
        super(sourceContext);
        this.messageId = messageId;
    }

    @Override
    public ActionType actionType() {
        return ActionType.STAGE_EFFECT;
    }

    public int messageId() {
        return messageId;
    }

    public int effectType() {
        return effectType;
    }
}
