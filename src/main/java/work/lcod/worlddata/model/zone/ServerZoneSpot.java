package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.worlddata.model.action.Action;

/**
 * Region of a zone with the actions run when a player enters or leaves it.
 */
public final class ServerZoneSpot {
    @JsonProperty("id")
    private int id;

    @JsonProperty("actions")
    @JacksonXmlElementWrapper(localName = "actions")
    private List<Action> actions = new ArrayList<>();

    @JsonProperty("leaveActions")
    @JacksonXmlElementWrapper(localName = "leaveActions")
    private List<Action> leaveActions = new ArrayList<>();

    private ServerZoneSpot() {}

    public ServerZoneSpot(int id, List<Action> actions, List<Action> leaveActions) {
        this.id = id;
        this.actions = actions == null ? new ArrayList<>() : new ArrayList<>(actions);
        this.leaveActions = leaveActions == null ? new ArrayList<>() : new ArrayList<>(leaveActions);
    }

    public int id() {
        return id;
    }

    public List<Action> actions() {
        return actions == null ? List.of() : Collections.unmodifiableList(actions);
    }

    public List<Action> leaveActions() {
        return leaveActions == null ? List.of() : Collections.unmodifiableList(leaveActions);
    }
}
