package work.lcod.worlddata.model.instance;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Variant rules layered on a zone instance. PvP variants bind to {@link PvPInstanceVariant}; every other kind
 * uses this class directly.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "instanceType",
    visible = true, defaultImpl = ZoneInstanceVariant.class)
@JsonSubTypes({
    @JsonSubTypes.Type(value = ZoneInstanceVariant.class,
        names = {"DEFAULT", "TIME_TRIAL", "DEMON_ONLY", "DIASPORA", "MISSION", "PENTALPHA", "DIGITALIZE"}),
    @JsonSubTypes.Type(value = PvPInstanceVariant.class, name = "PVP")
})
public class ZoneInstanceVariant {
    @JsonProperty("id")
    private int id;

    @JsonProperty("instanceType")
    private InstanceType instanceType = InstanceType.DEFAULT;

    @JsonProperty("subId")
    private int subId;

    @JsonProperty("timePoints")
    @JacksonXmlElementWrapper(localName = "timePoints")
    private List<Integer> timePoints = new ArrayList<>();

    protected ZoneInstanceVariant() {}

    public ZoneInstanceVariant(int id, InstanceType instanceType, int subId, List<Integer> timePoints) {
        this.id = id;
        this.instanceType = instanceType;
        this.subId = subId;
        this.timePoints = new ArrayList<>(timePoints);
    }

    public int id() {
        return id;
    }

    public InstanceType instanceType() {
        return instanceType == null ? InstanceType.DEFAULT : instanceType;
    }

    public int subId() {
        return subId;
    }

    public List<Integer> timePoints() {
        return timePoints == null ? List.of() : Collections.unmodifiableList(timePoints);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + id + " " + instanceType() + "]";
    }
}
