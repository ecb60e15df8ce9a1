package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Advances or resets a quest phase.
 */
public final class ActionUpdateQuest extends Action {
    @JsonProperty("questId")
    private int questId;

    @JsonProperty("phase")
    private int phase;

    private ActionUpdateQuest() {}

    public ActionUpdateQuest(SourceContext sourceContext, int questId, int phase) {
        super(sourceContext);
        this.questId = questId;
        this.phase = phase;
    }

    @Override
    public ActionType actionType() {
        return ActionType.UPDATE_QUEST;
    }

    public int questId() {
        return questId;
    }

    public int phase() {
        return phase;
    }
}
