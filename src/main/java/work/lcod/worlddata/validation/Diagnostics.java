package work.lcod.worlddata.validation;

import org.slf4j.LoggerFactory;

/**
 * Leveled sink for load and validation messages.
 */
public interface Diagnostics {
    void debug(String message);

    void warning(String message);

    void error(String message);

    static Diagnostics slf4j(Class<?> owner) {
        return new Slf4jDiagnostics(LoggerFactory.getLogger(owner));
    }
}
