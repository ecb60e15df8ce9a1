package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Loot table. A non-zero gift box ID makes the set the unique content of that gift box.
 */
public final class DropSet {
    @JsonProperty("id")
    private int id;

    @JsonProperty("giftBoxId")
    private int giftBoxId;

    @JsonProperty("drops")
    @JacksonXmlElementWrapper(localName = "drops")
    private List<ItemDrop> drops = new ArrayList<>();

    private DropSet() {}

    public DropSet(int id, int giftBoxId, List<ItemDrop> drops) {
        this.id = id;
        this.giftBoxId = giftBoxId;
        this.drops = new ArrayList<>(drops);
    }

    public int id() {
        return id;
    }

    public int giftBoxId() {
        return giftBoxId;
    }

    public List<ItemDrop> drops() {
        return drops == null ? List.of() : Collections.unmodifiableList(drops);
    }
}
