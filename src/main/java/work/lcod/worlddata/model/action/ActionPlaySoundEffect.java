package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ActionPlaySoundEffect extends Action {
    @JsonProperty("soundId")
    private int soundId;

    @JsonProperty("delay")
    private int delay;

    private ActionPlaySoundEffect() {}

    public ActionPlaySoundEffect(SourceContext sourceContext, int soundId) {
        super(sourceContext);
        this.soundId = soundId;
    }

    @Override
    public ActionType actionType() {
        return ActionType.PLAY_SOUND_EFFECT;
    }

    public int soundId() {
        return soundId;
    }

    public int delay() {
        return delay;
    }
}
