package work.lcod.worlddata.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.worlddata.model.action.Action;
import work.lcod.worlddata.model.action.ActionDelay;
import work.lcod.worlddata.model.action.ActionDisplayMessage;
import work.lcod.worlddata.model.action.ActionGrantXp;
import work.lcod.worlddata.model.action.ActionPlayBgm;
import work.lcod.worlddata.model.action.ActionSpawn;
import work.lcod.worlddata.model.action.ActionType;
import work.lcod.worlddata.model.action.ActionUpdateZoneFlags;
import work.lcod.worlddata.model.action.ActionZoneChange;
import work.lcod.worlddata.model.action.ActionZoneInstance;
import work.lcod.worlddata.model.action.SourceContext;
import work.lcod.worlddata.model.action.ZoneInstanceMode;
import work.lcod.worlddata.model.zone.TriggerType;
import work.lcod.worlddata.support.RecordingDiagnostics;

class ActionValidatorTest {
    private final RecordingDiagnostics diagnostics = new RecordingDiagnostics();
    private final ActionValidator validator = new ActionValidator(diagnostics);

    @Test
    void acceptsEmptyAndMissingLists() {
        assertTrue(validator.validate(List.of(), "Empty", true));
        assertTrue(validator.validate(null, "Missing", true));
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    void zoneChangeAsLastActionIsQuiet() {
        List<Action> actions = List.of(bgm(SourceContext.SOURCE), zoneChange(2));
        assertTrue(validator.validate(actions, "Zone 1, Spot 3", false));
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    void warnsWhenZoneChangeIsNotLast() {
        List<Action> actions = List.of(zoneChange(2), bgm(SourceContext.SOURCE));
        assertTrue(validator.validate(actions, "Zone 1, Spot 3", false));
        assertEquals(1, diagnostics.warnings().size());
        assertTrue(diagnostics.warnings().get(0).startsWith("Zone 1, Spot 3: ZONE_CHANGE"));
    }

    @Test
    void zoneChangeWithoutTargetZoneDoesNotEndTheList() {
        List<Action> actions = List.of(zoneChange(0), bgm(SourceContext.SOURCE));
        assertTrue(validator.validate(actions, "NPC", false));
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    void onlyJoiningInstanceModesEndTheList() {
        List<Action> create = List.of(instance(ZoneInstanceMode.CREATE), bgm(SourceContext.SOURCE));
        assertTrue(validator.validate(create, "Create", false));
        assertTrue(diagnostics.warnings().isEmpty());

        for (ZoneInstanceMode mode : List.of(ZoneInstanceMode.JOIN, ZoneInstanceMode.CLAN_JOIN,
            ZoneInstanceMode.TEAM_JOIN, ZoneInstanceMode.TEAM_PVP)) {
            List<Action> join = List.of(instance(mode), bgm(SourceContext.SOURCE));
            assertTrue(validator.validate(join, "Join " + mode, false));
        }
        assertEquals(4, diagnostics.warnings().size());
    }

    @Test
    void eventListsDoNotWarnAboutOrdering() {
        List<Action> actions = List.of(zoneChange(2), bgm(SourceContext.SOURCE));
        assertTrue(validator.validate(actions, "evt_intro", false, true));
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    void eventListFlagDoesNotReachNestedLists() {
        Action delay = new ActionDelay(SourceContext.SOURCE, 5, List.of(zoneChange(2), bgm(SourceContext.SOURCE)));
        assertTrue(validator.validate(List.of(delay), "evt_delay", false, true));
        assertEquals(1, diagnostics.warnings().size());
        assertTrue(diagnostics.warnings().get(0).startsWith("evt_delay => Delay Actions: "));
    }

    @Test
    void rejectsPlayerActionsInAutomatedContext() {
        List<Action> actions = List.of(new ActionDisplayMessage(SourceContext.SOURCE, List.of(1)));
        assertFalse(validator.validate(actions, "Zone 1 trigger", true));
        assertEquals(1, diagnostics.errors().size());
        assertTrue(diagnostics.hasError("DISPLAY_MESSAGE"));
    }

    @Test
    void playerActionsTargetingAllPlayersAreAllowedInAutomatedContext() {
        List<Action> actions = List.of(new ActionDisplayMessage(SourceContext.ALL, List.of(1)), bgm(SourceContext.ZONE));
        assertFalse(validator.validate(List.of(bgm(SourceContext.ENEMIES)), "Enemies", true));
        assertTrue(validator.validate(actions, "Zone 1 trigger", true));
    }

    @Test
    void playerActionsAreFineOutsideAutomatedContext() {
        List<Action> actions = List.of(new ActionDisplayMessage(SourceContext.SOURCE, List.of(1)));
        assertTrue(validator.validate(actions, "NPC 500", false));
        assertTrue(diagnostics.errors().isEmpty());
    }

    @Test
    void nestedDelayInheritsAutomatedContext() {
        Action delay = new ActionDelay(SourceContext.SOURCE, 10, List.of(bgm(SourceContext.SOURCE)));
        assertFalse(validator.validate(List.of(delay), "Zone 1 trigger", true));
        assertTrue(diagnostics.errors().get(0).startsWith("Zone 1 trigger => Delay Actions: PLAY_BGM"));
    }

    @Test
    void delayTargetingAllPlayersClearsAutomatedContext() {
        Action delay = new ActionDelay(SourceContext.ALL, 10, List.of(bgm(SourceContext.SOURCE)));
        assertTrue(validator.validate(List.of(delay), "Zone 1 trigger", true));
    }

    @Test
    void spawnDefeatActionsAreChecked() {
        Action spawn = new ActionSpawn(SourceContext.SOURCE, List.of(10),
            List.of(new ActionUpdateZoneFlags(SourceContext.SOURCE, 4, 1), bgm(SourceContext.SOURCE)));
        assertFalse(validator.validate(List.of(spawn), "Zone 1, SG 10 Spawn", true));
        assertTrue(diagnostics.hasError("Zone 1, SG 10 Spawn => Defeat Actions: PLAY_BGM"));
    }

    @Test
    void fatalActionStopsBeforeLaterChecks() {
        List<Action> actions = List.of(new ActionGrantXp(SourceContext.SOURCE, 100), zoneChange(5));
        assertFalse(validator.validate(actions, "Trigger", true));
        assertTrue(diagnostics.hasError("GRANT_XP"));
        assertTrue(diagnostics.warnings().isEmpty());
    }

    @Test
    void stopsAtFirstFatalAction() {
        List<Action> actions = List.of(bgm(SourceContext.SOURCE), new ActionDisplayMessage(SourceContext.SOURCE,
            List.of(2)));
        assertFalse(validator.validate(actions, "Trigger", true));
        assertEquals(1, diagnostics.errors().size());
    }

    @Test
    void classifiesTriggers() {
        assertTrue(ActionValidator.triggerIsAutoContext(TriggerType.ON_SETUP));
        assertTrue(ActionValidator.triggerIsAutoContext(TriggerType.ON_TIME));
        assertTrue(ActionValidator.triggerIsAutoContext(TriggerType.ON_PVP_START));
        assertFalse(ActionValidator.triggerIsAutoContext(TriggerType.ON_ZONE_IN));
        assertFalse(ActionValidator.triggerIsAutoContext(TriggerType.ON_DEATH));
    }

    @Test
    void classifiesPlayerActions() {
        assertTrue(ActionValidator.requiresPlayer(ActionType.ZONE_CHANGE));
        assertTrue(ActionValidator.requiresPlayer(ActionType.GRANT_XP));
        assertFalse(ActionValidator.requiresPlayer(ActionType.SPAWN));
        assertFalse(ActionValidator.requiresPlayer(ActionType.DELAY));
        assertFalse(ActionValidator.requiresPlayer(ActionType.UPDATE_ZONE_FLAGS));
    }

    private static Action zoneChange(int zoneId) {
        return new ActionZoneChange(SourceContext.SOURCE, zoneId, zoneId, 0);
    }

    private static Action instance(ZoneInstanceMode mode) {
        return new ActionZoneInstance(SourceContext.SOURCE, 1, mode);
    }

    private static Action bgm(SourceContext context) {
        return new ActionPlayBgm(context, 12);
    }
}
