package work.lcod.worlddata.model.event;

public enum EventType {
    PERFORM_ACTIONS,
    NPC_MESSAGE,
    PROMPT,
    PLAY_SCENE,
    OPEN_MENU,
    DIRECTION
}
