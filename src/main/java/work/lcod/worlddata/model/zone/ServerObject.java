package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import work.lcod.worlddata.model.action.Action;

public final class ServerObject extends ZonePlacement {
    @JsonProperty("state")
    private int state;

    private ServerObject() {}

    public ServerObject(int id, float x, float y, int spotId) {
        this(id, x, y, spotId, List.of());
    }

    public ServerObject(int id, float x, float y, int spotId, List<Action> actions) {
        super(id, x, y, spotId, actions);
    }

    public int state() {
        return state;
    }
}
