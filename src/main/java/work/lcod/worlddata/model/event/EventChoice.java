package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One selectable answer of a prompt.
 */
public final class EventChoice {
    @JsonProperty("messageId")
    private int messageId;

    @JsonProperty("next")
    private String next;

    private EventChoice() {}

    public EventChoice(int messageId, String next) {
        this.messageId = messageId;
        this.next = next;
    }

    public int messageId() {
        return messageId;
    }

    public String next() {
        return next;
    }
}
