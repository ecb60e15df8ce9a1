package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shows one or more system messages to the source.
 */
public final class ActionDisplayMessage extends Action {
    @JsonProperty("messageIds")
    @JacksonXmlElementWrapper(localName = "messageIds")
    private List<Integer> messageIds = new ArrayList<>();

    private ActionDisplayMessage() {}

    public ActionDisplayMessage(SourceContext sourceContext, List<Integer> messageIds) {
        super(sourceContext);
        this.messageIds = messageIds == null ? new ArrayList<>() : new ArrayList<>(messageIds);
    }

    @Override
    public ActionType actionType() {
        return ActionType.DISPLAY_MESSAGE;
    }

    public List<Integer> messageIds() {
        return messageIds == null ? List.of() : Collections.unmodifiableList(messageIds);
    }
}
