package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.worlddata.model.action.Action;

/**
 * Plasma harvesting point; success and failure actions run after a pick attempt.
 */
public final class PlasmaSpawn {
    @JsonProperty("id")
    private int id;

    @JsonProperty("successActions")
    @JacksonXmlElementWrapper(localName = "successActions")
    private List<Action> successActions = new ArrayList<>();

    @JsonProperty("failActions")
    @JacksonXmlElementWrapper(localName = "failActions")
    private List<Action> failActions = new ArrayList<>();

    private PlasmaSpawn() {}

    public PlasmaSpawn(int id, List<Action> successActions, List<Action> failActions) {
        this.id = id;
        this.successActions = successActions == null ? new ArrayList<>() : new ArrayList<>(successActions);
        this.failActions = failActions == null ? new ArrayList<>() : new ArrayList<>(failActions);
    }

    public int id() {
        return id;
    }

    public List<Action> successActions() {
        return successActions == null ? List.of() : Collections.unmodifiableList(successActions);
    }

    public List<Action> failActions() {
        return failActions == null ? List.of() : Collections.unmodifiableList(failActions);
    }
}
