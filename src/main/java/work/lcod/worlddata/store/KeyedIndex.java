package work.lcod.worlddata.store;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Sorted key to definition map that refuses duplicate keys.
 */
final class KeyedIndex<K extends Comparable<K>, V> {
    private final DefinitionKind kind;
    private final Map<K, V> entries = new TreeMap<>();

    KeyedIndex(DefinitionKind kind) {
        this.kind = kind;
    }

    void ensureAbsent(K key) {
        if (entries.containsKey(key)) {
            throw new DuplicateKeyException(kind, key);
        }
    }

    void put(K key, V value) {
        ensureAbsent(key);
        entries.put(key, value);
    }

    Optional<V> get(K key) {
        return key == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
    }

    boolean contains(K key) {
        return entries.containsKey(key);
    }

    Map<K, V> view() {
        return Collections.unmodifiableMap(entries);
    }

    int size() {
        return entries.size();
    }
}
