package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import work.lcod.worlddata.model.action.Action;

/**
 * Positioned NPC or object placement inside a zone. An ID of 0 only appears in partials and marks a deletion.
 */
public abstract class ZonePlacement {
    @JsonProperty("id")
    private int id;

    @JsonProperty("x")
    private float x;

    @JsonProperty("y")
    private float y;

    @JsonProperty("rotation")
    private float rotation;

    @JsonProperty("spotId")
    private int spotId;

    @JsonProperty("actions")
    @JacksonXmlElementWrapper(localName = "actions")
    private List<Action> actions = new ArrayList<>();

    protected ZonePlacement() {}

    protected ZonePlacement(int id, float x, float y, int spotId, List<Action> actions) {
        this.id = id;
        this.x = x;
        this.y = y;
        this.spotId = spotId;
        this.actions = actions == null ? new ArrayList<>() : new ArrayList<>(actions);
    }

    public int id() {
        return id;
    }

    public float x() {
        return x;
    }

    public float y() {
        return y;
    }

    public float rotation() {
        return rotation;
    }

    public int spotId() {
        return spotId;
    }

    public List<Action> actions() {
        return actions == null ? List.of() : Collections.unmodifiableList(actions);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + " @" + x + "," + y + " spot=" + spotId + "]";
    }
}
