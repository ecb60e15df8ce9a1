package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Teaches skills or grants skill points.
 */
public final class ActionGrantSkills extends Action {
    @JsonProperty("skillIds")
    @JacksonXmlElementWrapper(localName = "skillIds")
    private List<Integer> skillIds = new ArrayList<>();

    @JsonProperty("skillPoints")
    private int skillPoints;

    private ActionGrantSkills() {}

    public ActionGrantSkills(SourceContext sourceContext, List<Integer> skillIds) {
        super(sourceContext);
        this.skillIds = skillIds == null ? new ArrayList<>() : new ArrayList<>(skillIds);
    }

    @Override
    public ActionType actionType() {
        return ActionType.GRANT_SKILLS;
    }

    public List<Integer> skillIds() {
        return skillIds == null ? List.of() : Collections.unmodifiableList(skillIds);
    }

    public int skillPoints() {
        return skillPoints;
    }
}
