package work.lcod.worlddata.model.action;

/**
 * Entity (or entities) an action executes against.
 */
public enum SourceContext {
    /** The entity that started the action set. */
    SOURCE,
    /** Every player in the zone. */
    ALL,
    /** The source's party. */
    PARTY,
    /** Enemies attached to the source (spawn groups, defeated enemies). */
    ENEMIES,
    /** The zone itself, with no entity attached. */
    ZONE
}
