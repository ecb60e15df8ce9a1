package work.lcod.worlddata.model.action;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One step of a scripted action sequence attached to NPCs, objects, spots, triggers, spawn groups or events.
 *
 * <p>The set of subclasses is closed; each one carries only the fields that matter for its {@link ActionType}.
 * Documents select the subclass through the {@code type} discriminator.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ActionAddRemoveItems.class, name = "ADD_REMOVE_ITEMS"),
    @JsonSubTypes.Type(value = ActionAddRemoveStatus.class, name = "ADD_REMOVE_STATUS"),
    @JsonSubTypes.Type(value = ActionCreateLoot.class, name = "CREATE_LOOT"),
    @JsonSubTypes.Type(value = ActionDelay.class, name = "DELAY"),
    @JsonSubTypes.Type(value = ActionDisplayMessage.class, name = "DISPLAY_MESSAGE"),
    @JsonSubTypes.Type(value = ActionGrantSkills.class, name = "GRANT_SKILLS"),
    @JsonSubTypes.Type(value = ActionGrantXp.class, name = "GRANT_XP"),
    @JsonSubTypes.Type(value = ActionPlayBgm.class, name = "PLAY_BGM"),
    @JsonSubTypes.Type(value = ActionPlaySoundEffect.class, name = "PLAY_SOUND_EFFECT"),
    @JsonSubTypes.Type(value = ActionRunScript.class, name = "RUN_SCRIPT"),
    @JsonSubTypes.Type(value = ActionSetHomepoint.class, name = "SET_HOMEPOINT"),
    @JsonSubTypes.Type(value = ActionSetNpcState.class, name = "SET_NPC_STATE"),
    @JsonSubTypes.Type(value = ActionSpawn.class, name = "SPAWN"),
    @JsonSubTypes.Type(value = ActionSpecialDirection.class, name = "SPECIAL_DIRECTION"),
    @JsonSubTypes.Type(value = ActionStageEffect.class, name = "STAGE_EFFECT"),
    @JsonSubTypes.Type(value = ActionStartEvent.class, name = "START_EVENT"),
    @JsonSubTypes.Type(value = ActionUpdateComp.class, name = "UPDATE_COMP"),
    @JsonSubTypes.Type(value = ActionUpdateFlag.class, name = "UPDATE_FLAG"),
    @JsonSubTypes.Type(value = ActionUpdateLnc.class, name = "UPDATE_LNC"),
    @JsonSubTypes.Type(value = ActionUpdatePoints.class, name = "UPDATE_POINTS"),
    @JsonSubTypes.Type(value = ActionUpdateQuest.class, name = "UPDATE_QUEST"),
    @JsonSubTypes.Type(value = ActionUpdateZoneFlags.class, name = "UPDATE_ZONE_FLAGS"),
    @JsonSubTypes.Type(value = ActionZoneChange.class, name = "ZONE_CHANGE"),
    @JsonSubTypes.Type(value = ActionZoneInstance.class, name = "ZONE_INSTANCE")
})
public abstract class Action {
    @JsonProperty("sourceContext")
    private SourceContext sourceContext = SourceContext.SOURCE;

    protected Action() {}

    protected Action(SourceContext sourceContext) {
        this.sourceContext = sourceContext == null ? SourceContext.SOURCE : sourceContext;
    }

    public abstract ActionType actionType();

    public SourceContext sourceContext() {
        return sourceContext == null ? SourceContext.SOURCE : sourceContext;
    }

    @Override
    public String toString() {
        return actionType() + "[" + sourceContext() + "]";
    }
}
