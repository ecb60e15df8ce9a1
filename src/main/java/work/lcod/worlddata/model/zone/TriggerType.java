package work.lcod.worlddata.model.zone;

/**
 * Zone events that can start a trigger's action list.
 */
public enum TriggerType {
    ON_SETUP,
    ON_ZONE_IN,
    ON_ZONE_OUT,
    ON_DEATH,
    ON_REVIVAL,
    ON_FLAG_SET,
    ON_TIME,
    ON_SYSTEMTIME,
    ON_MOONPHASE,
    ON_TIMER_EXPIRE,
    ON_PVP_START,
    ON_PVP_BASE_CAPTURE,
    ON_PVP_COMPLETE,
    ON_DIASPORA_BASE_CAPTURE,
    ON_DIASPORA_BASE_RESET
}
