package work.lcod.worlddata.store;

import work.lcod.worlddata.model.zone.ServerZone;

/**
 * Zone ID and dynamic map ID pair identifying one zone definition.
 */
public record ZoneKey(int zoneId, int dynamicMapId) {
    @Override
    public String toString() {
        return ServerZone.label(zoneId, dynamicMapId);
    }
}
