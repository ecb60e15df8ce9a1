package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class ActionPlayBgm extends Action {
    @JsonProperty("musicId")
    private int musicId;

    @JsonProperty("stop")
    private boolean stop;

    private ActionPlayBgm() {}

    public ActionPlayBgm(SourceContext sourceContext, int musicId) {
        super(sourceContext);
        this.musicId = musicId;
    }

    @Override
    public ActionType actionType() {
        return ActionType.PLAY_BGM;
    }

    public int musicId() {
        return musicId;
    }

    public boolean stop() {
        return stop;
    }
}
