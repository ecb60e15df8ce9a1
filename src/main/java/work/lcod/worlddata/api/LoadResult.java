package work.lcod.worlddata.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import work.lcod.worlddata.store.DefinitionStore;

/**
 * Outcome of a {@link WorldDataService} load (usable by the CLI and embedding servers).
 */
public record LoadResult(
    Status status,
    Map<String, Object> metadata,
    Instant startedAt,
    Instant finishedAt,
    Optional<DefinitionStore> store
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public LoadResult {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static LoadResult success(DefinitionStore store, Map<String, Object> metadata, Instant startedAt) {
        return new LoadResult(Status.SUCCESS, metadata, startedAt, Instant.now(), Optional.of(store));
    }

    public static LoadResult failure(String message, Map<String, Object> metadata, Instant startedAt) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.putIfAbsent("error", message == null ? "Load failed" : message);
        return new LoadResult(Status.FAILURE, meta, startedAt, Instant.now(), Optional.empty());
    }

    public LoadResult withMetadata(String key, Object value) {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put(key, value);
        return new LoadResult(status, meta, startedAt, finishedAt, store);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        serializable.put("metadata", metadata);
        serializable.put("startedAt", startedAt.toString());
        serializable.put("finishedAt", finishedAt.toString());
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
