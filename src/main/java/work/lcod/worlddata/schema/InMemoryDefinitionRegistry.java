package work.lcod.worlddata.schema;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import work.lcod.worlddata.model.ServerSideDefinition;

/**
 * Registry holding zone and devil definitions in memory, plus the server-side definitions registered at load.
 */
public final class InMemoryDefinitionRegistry implements DefinitionRegistry {
    private final Map<Integer, ZoneDefinition> zones = new ConcurrentHashMap<>();
    private final Set<Integer> devils = ConcurrentHashMap.newKeySet();
    private final Map<String, Map<Integer, ServerSideDefinition>> serverSide = new ConcurrentHashMap<>();

    public InMemoryDefinitionRegistry() {}

    public InMemoryDefinitionRegistry(Collection<ZoneDefinition> zones, Collection<Integer> devils) {
        zones.forEach(this::addZone);
        this.devils.addAll(devils);
    }

    public InMemoryDefinitionRegistry addZone(ZoneDefinition zone) {
        zones.put(zone.id(), zone);
        return this;
    }

    public InMemoryDefinitionRegistry addDevil(int devilId) {
        devils.add(devilId);
        return this;
    }

    @Override
    public Optional<ZoneDefinition> zone(int zoneId) {
        return Optional.ofNullable(zones.get(zoneId));
    }

    @Override
    public boolean hasDevil(int devilId) {
        return devils.contains(devilId);
    }

    @Override
    public boolean registerServerSideDefinition(ServerSideDefinition definition) {
        var byId = serverSide.computeIfAbsent(definition.definitionKind(), k -> new ConcurrentHashMap<>());
        return byId.putIfAbsent(definition.id(), definition) == null;
    }

    public <T extends ServerSideDefinition> Optional<T> serverSideDefinition(String kind, int id, Class<T> type) {
        var byId = serverSide.get(kind);
        if (byId == null) {
            return Optional.empty();
        }
        var definition = byId.get(id);
        return type.isInstance(definition) ? Optional.of(type.cast(definition)) : Optional.empty();
    }

    public int serverSideDefinitionCount(String kind) {
        var byId = serverSide.get(kind);
        return byId == null ? 0 : byId.size();
    }
}
