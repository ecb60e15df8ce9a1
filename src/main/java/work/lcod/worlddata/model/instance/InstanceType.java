package work.lcod.worlddata.model.instance;

/**
 * Instance kinds a zone instance variant can describe.
 */
public enum InstanceType {
    DEFAULT,
    TIME_TRIAL,
    PVP,
    DEMON_ONLY,
    DIASPORA,
    MISSION,
    PENTALPHA,
    DIGITALIZE;

    /**
     * Allowed time point counts for this kind, empty when the kind does not constrain them.
     */
    public int[] requiredTimePointCounts() {
        return switch (this) {
            case TIME_TRIAL -> new int[] {4};
            case PVP -> new int[] {2, 3};
            case DEMON_ONLY -> new int[] {3, 4};
            case DIASPORA -> new int[] {2};
            case MISSION -> new int[] {1};
            case DEFAULT, PENTALPHA, DIGITALIZE -> new int[0];
        };
    }
}
