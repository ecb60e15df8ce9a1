package work.lcod.worlddata.model;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.worlddata.model.instance.ServerZoneInstance;

class ServerZoneInstanceTest {
    @Test
    void matchesZonesByIndexAlignedDynamicMap() {
        var instance = new ServerZoneInstance(1, 10, List.of(20, 21), List.of(20, 30));

        assertTrue(instance.contains(21, 30));
        assertTrue(instance.contains(21, 0));
        assertFalse(instance.contains(21, 20));
    }

    @Test
    void skipsEmptyEntries() {
        var instance = new ServerZoneInstance(1, 10, Arrays.asList(null, 21), Arrays.asList(20, null));

        assertFalse(instance.contains(20, 20));
        assertFalse(instance.contains(21, 21));
        assertTrue(instance.contains(21, 0));
    }
}
