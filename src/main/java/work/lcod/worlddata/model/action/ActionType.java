package work.lcod.worlddata.model.action;

/**
 * Discriminator for the closed set of {@link Action} variants.
 */
public enum ActionType {
    ADD_REMOVE_ITEMS,
    ADD_REMOVE_STATUS,
    CREATE_LOOT,
    DELAY,
    DISPLAY_MESSAGE,
    GRANT_SKILLS,
    GRANT_XP,
    PLAY_BGM,
    PLAY_SOUND_EFFECT,
    RUN_SCRIPT,
    SET_HOMEPOINT,
    SET_NPC_STATE,
    SPAWN,
    SPECIAL_DIRECTION,
    STAGE_EFFECT,
    START_EVENT,
    UPDATE_COMP,
    UPDATE_FLAG,
    UPDATE_LNC,
    UPDATE_POINTS,
    UPDATE_QUEST,
    UPDATE_ZONE_FLAGS,
    ZONE_CHANGE,
    ZONE_INSTANCE
}
