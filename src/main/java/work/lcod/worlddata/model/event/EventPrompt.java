package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class EventPrompt extends Event {
    @JsonProperty("messageId")
    private int messageId;

    @JsonProperty("choices")
    @JacksonXmlElementWrapper(localName = "choices")
    private List<EventChoice> choices = new ArrayList<>();

    private EventPrompt() {}

    public EventPrompt(String id, int messageId, List<EventChoice> choices) {
        super(id);
        this.messageId = messageId;
        this.choices = new ArrayList<>(choices);
    }

    @Override
    public EventType eventType() {
        return EventType.PROMPT;
    }

    public int messageId() {
        return messageId;
    }

    public List<EventChoice> choices() {
        return choices == null ? List.of() : Collections.unmodifiableList(choices);
    }
}
