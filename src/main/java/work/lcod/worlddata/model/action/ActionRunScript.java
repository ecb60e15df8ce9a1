package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs a custom action script by name.
 */
public final class ActionRunScript extends Action {
    @JsonProperty("scriptId")
    private String scriptId;

    @JsonProperty("params")
    @JacksonXmlElementWrapper(localName = "params")
    private List<String> params = new ArrayList<>();

    private ActionRunScript() {}

    public ActionRunScript(SourceContext sourceContext, String scriptId) {
        super(sourceContext);
        this.scriptId = scriptId;
    }

    @Override
    public ActionType actionType() {
        return ActionType.RUN_SCRIPT;
    }

    public String scriptId() {
        return scriptId;
    }

    public List<String> params() {
        return params == null ? List.of() : Collections.unmodifiableList(params);
    }
}
