package work.lcod.worlddata.schema;

import java.util.Optional;
import work.lcod.worlddata.model.ServerSideDefinition;

/**
 * Binary schema definitions the server data is validated against.
 */
public interface DefinitionRegistry {
    Optional<ZoneDefinition> zone(int zoneId);

    /**
     * Whether an enemy (devil) type exists.
     */
    boolean hasDevil(int devilId);

    /**
     * Registers a server-side definition.
     *
     * @return {@code false} when a definition of the same kind and ID is already registered
     */
    boolean registerServerSideDefinition(ServerSideDefinition definition);
}
