package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Scripted event keyed by a string ID. Events chain through {@link #next()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = EventPerformActions.class, name = "PERFORM_ACTIONS"),
    @JsonSubTypes.Type(value = EventNpcMessage.class, name = "NPC_MESSAGE"),
    @JsonSubTypes.Type(value = EventPrompt.class, name = "PROMPT"),
    @JsonSubTypes.Type(value = EventPlayScene.class, name = "PLAY_SCENE"),
    @JsonSubTypes.Type(value = EventOpenMenu.class, name = "OPEN_MENU"),
    @JsonSubTypes.Type(value = EventDirection.class, name = "DIRECTION")
})
public abstract class Event {
    @JsonProperty("id")
    private String id;

    @JsonProperty("next")
    private String next;

    @JsonProperty("conditionScript")
    private String conditionScript;

    protected Event() {}

    protected Event(String id) {
        this.id = id;
    }

    public abstract EventType eventType();

    public String id() {
        return id == null ? "" : id;
    }

    public String next() {
        return next;
    }

    public String conditionScript() {
        return conditionScript;
    }

    @Override
    public String toString() {
        return eventType() + "[" + id() + "]";
    }
}
