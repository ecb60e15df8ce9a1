package work.lcod.worlddata.model;

/**
 * Definition that ships with the server rather than the client and is handed to the definition registry.
 */
public interface ServerSideDefinition {
    int id();

    /**
     * Registry namespace; IDs are unique within one kind.
     */
    String definitionKind();
}
