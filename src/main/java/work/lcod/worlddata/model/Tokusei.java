package work.lcod.worlddata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Passive effect definition.
 */
public final class Tokusei implements ServerSideDefinition {
    @JsonProperty("id")
    private int id;

    @JsonProperty("skillOverride")
    private boolean skillOverride;

    @JsonProperty("aspects")
    @JacksonXmlElementWrapper(localName = "aspects")
    private List<Integer> aspects = new ArrayList<>();

    private Tokusei() {}

    public Tokusei(int id) {
        this.id = id;
    }

    @Override
    public int id() {
        return id;
    }

    @Override
    public String definitionKind() {
        return "tokusei";
    }

    public boolean skillOverride() {
        return skillOverride;
    }

    public List<Integer> aspects() {
        return aspects == null ? List.of() : Collections.unmodifiableList(aspects);
    }
}
