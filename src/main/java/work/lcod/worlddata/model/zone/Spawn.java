package work.lcod.worlddata.model.zone;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Enemy (or ally) template placed by spawn groups.
 */
public final class Spawn {
    @JsonProperty("id")
    private int id;

    @JsonProperty("enemyType")
    private int enemyType;

    @JsonProperty("category")
    private SpawnCategory category = SpawnCategory.ENEMY;

    @JsonProperty("bossGroup")
    private int bossGroup;

    @JsonProperty("level")
    private int level;

    @JsonProperty("aiScriptId")
    private String aiScriptId;

    @JsonProperty("logicGroupId")
    private int logicGroupId;

    private Spawn() {}

    public Spawn(int id, int enemyType, SpawnCategory category) {
        this(id, enemyType, category, 0);
    }

    public Spawn(int id, int enemyType, SpawnCategory category, int bossGroup) {
        this.id = id;
        this.enemyType = enemyType;
        this.category = category;
        this.bossGroup = bossGroup;
    }

    public int id() {
        return id;
    }

    public int enemyType() {
        return enemyType;
    }

    public SpawnCategory category() {
        return category == null ? SpawnCategory.ENEMY : category;
    }

    public int bossGroup() {
        return bossGroup;
    }

    public int level() {
        return level;
    }

    public String aiScriptId() {
        return aiScriptId;
    }

    public int logicGroupId() {
        return logicGroupId;
    }
}
