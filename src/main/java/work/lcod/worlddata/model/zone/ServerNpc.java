package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import work.lcod.worlddata.model.action.Action;

public final class ServerNpc extends ZonePlacement {
    @JsonProperty("state")
    private int state = 1;

    private ServerNpc() {}

    public ServerNpc(int id, float x, float y, int spotId) {
        this(id, x, y, spotId, List.of());
    }

    public ServerNpc(int id, float x, float y, int spotId, List<Action> actions) {
        super(id, x, y, spotId, actions);
    }

    public int state() {
        return state;
    }
}
