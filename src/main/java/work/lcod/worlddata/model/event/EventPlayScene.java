package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;

public final class EventPlayScene extends Event {
    @JsonProperty("sceneId")
    private int sceneId;

    private EventPlayScene() {}

    public EventPlayScene(String id, int sceneId) {
        super(id);
        this.sceneId = sceneId;
    }

    @Override
    public EventType eventType() {
        return EventType.PLAY_SCENE;
    }

    public int sceneId() {
        return sceneId;
    }
}
