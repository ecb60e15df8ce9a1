package work.lcod.worlddata.model.instance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Multi-zone instance: index-aligned zone and dynamic map ID sequences plus the lobby the instance is entered from.
 */
public final class ServerZoneInstance {
    @JsonProperty("id")
    private int id;

    @JsonProperty("lobbyId")
    private int lobbyId;

    @JsonProperty("zoneIds")
    @JacksonXmlElementWrapper(localName = "zoneIds")
    private List<Integer> zoneIds = new ArrayList<>();

    @JsonProperty("dynamicMapIds")
    @JacksonXmlElementWrapper(localName = "dynamicMapIds")
    private List<Integer> dynamicMapIds = new ArrayList<>();

    @JsonProperty("timerId")
    private int timerId;

    private ServerZoneInstance() {}

    public ServerZoneInstance(int id, int lobbyId, List<Integer> zoneIds, List<Integer> dynamicMapIds) {
        this.id = id;
        this.lobbyId = lobbyId;
        this.zoneIds = new ArrayList<>(zoneIds);
        this.dynamicMapIds = new ArrayList<>(dynamicMapIds);
    }

    public int id() {
        return id;
    }

    public int lobbyId() {
        return lobbyId;
    }

    public List<Integer> zoneIds() {
        return zoneIds == null ? List.of() : Collections.unmodifiableList(zoneIds);
    }

    public List<Integer> dynamicMapIds() {
        return dynamicMapIds == null ? List.of() : Collections.unmodifiableList(dynamicMapIds);
    }

    public int timerId() {
        return timerId;
    }

    public boolean contains(int zoneId, int dynamicMapId) {
        var zones = zoneIds();
        var dynamicMaps = dynamicMapIds();
        for (int i = 0; i < zones.size(); i++) {
            boolean dynamicMapMatches = dynamicMapId == 0
                || (i < dynamicMaps.size() && Objects.equals(dynamicMaps.get(i), dynamicMapId));
            if (Objects.equals(zones.get(i), zoneId) && dynamicMapMatches) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ServerZoneInstance[" + id + " lobby=" + lobbyId + " zones=" + zoneIds + "]";
    }
}
