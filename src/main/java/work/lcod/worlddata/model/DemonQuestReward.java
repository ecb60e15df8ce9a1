package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class DemonQuestReward {
    @JsonProperty("id")
    private int id;

    @JsonProperty("groupId")
    private int groupId;

    @JsonProperty("dropSetIds")
    @JacksonXmlElementWrapper(localName = "dropSetIds")
    private List<Integer> dropSetIds = new ArrayList<>();

    private DemonQuestReward() {}

    public DemonQuestReward(int id, int groupId, List<Integer> dropSetIds) {
        this.id = id;
        this.groupId = groupId;
        this.dropSetIds = new ArrayList<>(dropSetIds);
    }

    public int id() {
        return id;
    }

    public int groupId() {
        return groupId;
    }

    public List<Integer> dropSetIds() {
        return dropSetIds == null ? List.of() : Collections.unmodifiableList(dropSetIds);
    }
}
