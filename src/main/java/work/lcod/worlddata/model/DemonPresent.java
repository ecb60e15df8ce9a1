package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Items a demon of the given type may hand to its owner.
 */
public final class DemonPresent {
    @JsonProperty("id")
    private int id;

    @JsonProperty("commonItems")
    @JacksonXmlElementWrapper(localName = "commonItems")
    private List<Integer> commonItems = new ArrayList<>();

    @JsonProperty("rareItems")
    @JacksonXmlElementWrapper(localName = "rareItems")
    private List<Integer> rareItems = new ArrayList<>();

    private DemonPresent() {}

    public DemonPresent(int id, List<Integer> commonItems, List<Integer> rareItems) {
        this.id = id;
        this.commonItems = new ArrayList<>(commonItems);
        this.rareItems = new ArrayList<>(rareItems);
    }

    public int id() {
        return id;
    }

    public List<Integer> commonItems() {
        return commonItems == null ? List.of() : Collections.unmodifiableList(commonItems);
    }

    public List<Integer> rareItems() {
        return rareItems == null ? List.of() : Collections.unmodifiableList(rareItems);
    }
}
