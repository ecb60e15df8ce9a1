package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs a nested action list after a delay (in seconds).
 */
public final class ActionDelay extends Action {
    @JsonProperty("delayId")
    private int delayId;

    @JsonProperty("duration")
    private int duration;

    @JsonProperty("actions")
    @JacksonXmlElementWrapper(localName = "actions")
    private List<Action> actions = new ArrayList<>();

    private ActionDelay() {}

    public ActionDelay(SourceContext sourceContext, int duration, List<Action> actions) {
        super(sourceContext);
        this.duration = duration;
        this.actions = actions == null ? new ArrayList<>() : new ArrayList<>(actions);
    }

    @Override
    public ActionType actionType() {
        return ActionType.DELAY;
    }

    public int delayId() {
        return delayId;
    }

    public int duration() {
        return duration;
    }

    public List<Action> actions() {
        return actions == null ? List.of() : Collections.unmodifiableList(actions);
    }
}
