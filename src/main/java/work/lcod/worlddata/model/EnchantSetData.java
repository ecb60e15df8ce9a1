package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class EnchantSetData implements ServerSideDefinition {
    @JsonProperty("id")
    private int id;

    @JsonProperty("effectIds")
    @JacksonXmlElementWrapper(localName = "effectIds")
    private List<Integer> effectIds = new ArrayList<>();

    private EnchantSetData() {}

    public EnchantSetData(int id, List<Integer> effectIds) {
        this.id = id;
        this.effectIds = new ArrayList<>(effectIds);
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public String definitionKind() {
        return "enchantset";
    }

    public List<Integer> effectIds() {
        return effectIds == null ? List.of() : Collections.unmodifiableList(effectIds);
    }
}
