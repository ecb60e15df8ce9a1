package work.lcod.worlddata.store;

/**
 * Key spaces of the definition store.
 */
public enum DefinitionKind {
    ZONE("zone"),
    ZONE_PARTIAL("zone partial"),
    EVENT("event"),
    ZONE_INSTANCE("zone instance"),
    ZONE_INSTANCE_VARIANT("zone instance variant"),
    SHOP("shop"),
    AI_LOGIC_GROUP("AI logic group entry"),
    DEMON_PRESENT("demon present entry"),
    DEMON_QUEST_REWARD("demon quest reward entry"),
    DROP_SET("drop set"),
    GIFT_BOX("drop set gift box ID"),
    SCRIPT("script"),
    AI_SCRIPT("AI script");

    private final String label;

    DefinitionKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
