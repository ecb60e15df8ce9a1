package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class EventNpcMessage extends Event {
    @JsonProperty("messageIds")
    @JacksonXmlElementWrapper(localName = "messageIds")
    private List<Integer> messageIds = new ArrayList<>();

    private EventNpcMessage() {}

    public EventNpcMessage(String id, List<Integer> messageIds) {
        super(id);
        this.messageIds = new ArrayList<>(messageIds);
    }

    @Override
    public EventType eventType() {
        return EventType.NPC_MESSAGE;
    }

    public List<Integer> messageIds() {
        return messageIds == null ? List.of() : Collections.unmodifiableList(messageIds);
    }
}
