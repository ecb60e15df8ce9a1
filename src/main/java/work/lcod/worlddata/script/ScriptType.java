package work.lcod.worlddata.script;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Supported script type tags and the top-level functions each one must (or must not) define.
 */
public enum ScriptType {
    AI("ai", Set.of("prepare"), Set.of()),
    EVENT_CONDITION("eventcondition", Set.of("check"), Set.of()),
    EVENT_BRANCH_LOGIC("eventbranchlogic", Set.of("check"), Set.of()),
    ACTION_TRANSFORM("actiontransform", Set.of("transform"), Set.of("prepare")),
    EVENT_TRANSFORM("eventtransform", Set.of("transform"), Set.of("prepare")),
    ACTION_CUSTOM("actioncustom", Set.of("run"), Set.of()),
    WEBGAME("webgame", Set.of("start"), Set.of());

    private final String tag;
    private final Set<String> requiredFunctions;
    private final Set<String> reservedFunctions;

    ScriptType(String tag, Set<String> requiredFunctions, Set<String> reservedFunctions) {
        this.tag = tag;
        this.requiredFunctions = requiredFunctions;
        this.reservedFunctions = reservedFunctions;
    }

    public String tag() {
        return tag;
    }

    public Set<String> requiredFunctions() {
        return requiredFunctions;
    }

    public Set<String> reservedFunctions() {
        return reservedFunctions;
    }

    public boolean isAi() {
        return this == AI;
    }

    public static Optional<ScriptType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ScriptType type : values()) {
            if (type.tag.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
