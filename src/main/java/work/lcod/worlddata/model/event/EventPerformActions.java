package work.lcod.worlddata.model.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.worlddata.model.action.Action;

public final class EventPerformActions extends Event {
    @JsonProperty("actions")
    @JacksonXmlElementWrapper(localName = "actions")
    private List<Action> actions = new ArrayList<>();

    private EventPerformActions() {}

    public EventPerformActions(String id, List<Action> actions) {
        super(id);
        this.actions = new ArrayList<>(actions);
    }

    @Override
    public EventType eventType() {
        return EventType.PERFORM_ACTIONS;
    }

    public List<Action> actions() {
        return actions == null ? List.of() : Collections.unmodifiableList(actions);
    }
}
