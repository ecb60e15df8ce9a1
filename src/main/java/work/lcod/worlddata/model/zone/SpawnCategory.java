package work.lcod.worlddata.model.zone;

public enum SpawnCategory {
    ENEMY,
    BOSS,
    ALLY
}
