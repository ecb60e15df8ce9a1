package work.lcod.worlddata.schema;

/**
 * Client-side zone definition as seen by the server data loader: only the basic zone type matters here.
 */
public record ZoneDefinition(int id, int type) {
    public static final int FIELD_TYPE = 2;
    public static final int PVP_TYPE = 7;

    public boolean isField() {
        return type == FIELD_TYPE;
    }

    public boolean isPvP() {
        return type == PVP_TYPE;
    }
}
