package work.lcod.worlddata.validation;

import java.util.List;
import java.util.Objects;
import work.lcod.worlddata.model.action.Action;
import work.lcod.worlddata.model.action.ActionDelay;
import work.lcod.worlddata.model.action.ActionSpawn;
import work.lcod.worlddata.model.action.ActionType;
import work.lcod.worlddata.model.action.ActionZoneChange;
import work.lcod.worlddata.model.action.ActionZoneInstance;
import work.lcod.worlddata.model.action.SourceContext;
import work.lcod.worlddata.model.zone.ServerZoneTrigger;
import work.lcod.worlddata.model.zone.TriggerType;

/**
 * Structural checks over action lists attached to zone content and events.
 *
 * <p>Two rules are enforced. Actions that end multi-channel routing (a zone change with a target or a zone
 * instance join) should be the last entry of their list; anything else is only a warning. Actions that need a
 * player to act on may not run in an automated context; that is fatal and {@link #validate} returns
 * {@code false}.</p>
 */
public final class ActionValidator {
    private final Diagnostics diagnostics;

    public ActionValidator(Diagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public boolean validate(List<Action> actions, String source, boolean autoContext) {
        return validate(actions, source, autoContext, false);
    }

    /**
     * @param actions     list to check, may be empty
     * @param source      label prefixed to every message
     * @param autoContext whether the owner of the list runs without a player actor
     * @param inEventList whether the list belongs directly to an event; suppresses the ordering warning and is not
     *                    passed on to nested lists
     * @return {@code false} when a fatal violation was found
     */
    public boolean validate(List<Action> actions, String source, boolean autoContext, boolean inEventList) {
        if (actions == null) {
            return true;
        }
        int count = actions.size();
        for (int i = 0; i < count; i++) {
            Action action = actions.get(i);
            if (action == null) {
                continue;
            }
            boolean last = i == count - 1;
            if (!last && !inEventList && endsRouting(action)) {
                diagnostics.warning(source + ": " + action.actionType()
                    + " action encountered before the end of its action list; later actions will not run");
            }

            boolean autoCtx = autoContext && isAutomated(action.sourceContext());
            if (autoCtx && requiresPlayer(action.actionType())) {
                diagnostics.error(source + ": " + action.actionType()
                    + " action requires a player context but is used in an automated context");
                return false;
            }

            if (action instanceof ActionDelay delay) {
                if (!validate(delay.actions(), source + " => Delay Actions", autoCtx, false)) {
                    return false;
                }
            } else if (action instanceof ActionSpawn spawn) {
                if (!validate(spawn.defeatActions(), source + " => Defeat Actions", autoCtx, false)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Whether a trigger's actions run without a player actor.
     */
    public static boolean triggerIsAutoContext(ServerZoneTrigger trigger) {
        return triggerIsAutoContext(trigger.trigger());
    }

    public static boolean triggerIsAutoContext(TriggerType type) {
        return switch (type) {
            case ON_DEATH, ON_DIASPORA_BASE_CAPTURE, ON_FLAG_SET, ON_PVP_BASE_CAPTURE, ON_PVP_COMPLETE,
                ON_REVIVAL, ON_ZONE_IN, ON_ZONE_OUT -> false;
            case ON_SETUP, ON_TIME, ON_SYSTEMTIME, ON_MOONPHASE, ON_TIMER_EXPIRE, ON_PVP_START,
                ON_DIASPORA_BASE_RESET -> true;
        };
    }

    static boolean requiresPlayer(ActionType type) {
        return switch (type) {
            case ADD_REMOVE_ITEMS, DISPLAY_MESSAGE, GRANT_SKILLS, GRANT_XP, PLAY_BGM, PLAY_SOUND_EFFECT,
                SET_HOMEPOINT, SPECIAL_DIRECTION, STAGE_EFFECT, UPDATE_COMP, UPDATE_FLAG, UPDATE_LNC,
                UPDATE_QUEST, ZONE_CHANGE, ZONE_INSTANCE -> true;
            case ADD_REMOVE_STATUS, CREATE_LOOT, DELAY, RUN_SCRIPT, SET_NPC_STATE, SPAWN, START_EVENT,
                UPDATE_POINTS, UPDATE_ZONE_FLAGS -> false;
        };
    }

    private static boolean isAutomated(SourceContext context) {
        return context == SourceContext.ENEMIES || context == SourceContext.SOURCE;
    }

    private static boolean endsRouting(Action action) {
        if (action instanceof ActionZoneChange change) {
            return change.zoneId() != 0;
        }
        if (action instanceof ActionZoneInstance instance) {
            return switch (instance.mode()) {
                case JOIN, CLAN_JOIN, TEAM_JOIN, TEAM_PVP -> true;
                case CREATE, START_TIMER, STOP_TIMER, TIMER_EXTEND -> false;
            };
        }
        return false;
    }
}
