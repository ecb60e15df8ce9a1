package work.lcod.worlddata.model.instance;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public final class PvPInstanceVariant extends ZoneInstanceVariant {
    @JsonProperty("matchType")
    private PvPMatchType matchType = PvPMatchType.FATE;

    @JsonProperty("specialMode")
    private boolean specialMode;

    @JsonProperty("defaultInstanceId")
    private int defaultInstanceId;

    private PvPInstanceVariant() {}

    public PvPInstanceVariant(int id, List<Integer> timePoints, PvPMatchType matchType, boolean specialMode,
        int defaultInstanceId) {
        super(id, InstanceType.PVP, 0, timePoints);
        this.matchType = matchType;
        this.specialMode = specialMode;
        this.defaultInstanceId = defaultInstanceId;
    }

    public PvPMatchType matchType() {
        return matchType == null ? PvPMatchType.FATE : matchType;
    }

    public boolean specialMode() {
        return specialMode;
    }

    /**
     * Instance used when a match is started without naming one; 0 when there is none.
     */
    public int defaultInstanceId() {
        return defaultInstanceId;
    }

    /**
     * Standard variants are matched automatically by match type.
     */
    public boolean isStandard() {
        return !specialMode && matchType() != PvPMatchType.CUSTOM;
    }
}
