package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Drops a loot box filled from drop sets.
 */
public final class ActionCreateLoot extends Action {
    @JsonProperty("dropSetIds")
    @JacksonXmlElementWrapper(localName = "dropSetIds")
    private List<Integer> dropSetIds = new ArrayList<>();

    @JsonProperty("expirationTime")
    private int expirationTime;

    private ActionCreateLoot() {}

    public ActionCreateLoot(SourceContext sourceContext, List<Integer> dropSetIds) {
        super(sourceContext);
        this.dropSetIds = dropSetIds == null ? new ArrayList<>() : new ArrayList<>(dropSetIds);
    }

    @Override
    public ActionType actionType() {
        return ActionType.CREATE_LOOT;
    }

    public List<Integer> dropSetIds() {
        return dropSetIds == null ? List.of() : Collections.unmodifiableList(dropSetIds);
    }

    public int expirationTime() {
        return expirationTime;
    }
}
