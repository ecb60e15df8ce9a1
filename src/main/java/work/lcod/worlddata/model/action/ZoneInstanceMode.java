package work.lcod.worlddata.model.action;

/**
 * Operation performed by {@link ActionZoneInstance}.
 */
public enum ZoneInstanceMode {
    CREATE,
    JOIN,
    CLAN_JOIN,
    TEAM_JOIN,
    TEAM_PVP,
    START_TIMER,
    STOP_TIMER,
    TIMER_EXTEND
}
