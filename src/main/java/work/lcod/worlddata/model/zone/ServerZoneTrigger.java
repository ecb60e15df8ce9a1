package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.worlddata.model.action.Action;

public final class ServerZoneTrigger {
    @JsonProperty("trigger")
    private TriggerType trigger = TriggerType.ON_SETUP;

    @JsonProperty("value")
    private int value;

    @JsonProperty("actions")
    @JacksonXmlElementWrapper(localName = "actions")
    private List<Action> actions = new ArrayList<>();

    private ServerZoneTrigger() {}

    public ServerZoneTrigger(TriggerType trigger, List<Action> actions) {
        this.trigger = trigger;
        this.actions = actions == null ? new ArrayList<>() : new ArrayList<>(actions);
    }

    public TriggerType trigger() {
        return trigger == null ? TriggerType.ON_SETUP : trigger;
    }

    public int value() {
        return value;
    }

    public List<Action> actions() {
        return actions == null ? List.of() : Collections.unmodifiableList(actions);
    }
}
