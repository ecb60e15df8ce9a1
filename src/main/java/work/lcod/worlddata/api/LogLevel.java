package work.lcod.worlddata.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the configuration file and the command line. Lookups ignore case and also accept
 * {@code warning} for {@link #WARN}.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL;

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("WARNING")) {
            return WARN;
        }
        for (LogLevel level : values()) {
            if (level.name().equals(normalized)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unsupported log level: " + value);
    }

    /**
     * Level name understood by the slf4j simple binding. FATAL only keeps errors.
     */
    public String simpleLoggerName() {
        return this == FATAL ? "error" : name().toLowerCase(Locale.ROOT);
    }
}
