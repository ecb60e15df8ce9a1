package work.lcod.worlddata.validation;

import java.util.Objects;
import org.slf4j.Logger;

public final class Slf4jDiagnostics implements Diagnostics {
    private final Logger logger;

    public Slf4jDiagnostics(Logger logger) {
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    @Override
    public void debug(String message) {
        logger.debug(message);
    }

    @Override
    public void warning(String message) {
        logger.warn(message);
    }

    @Override
    public void error(String message) {
        logger.error(message);
    }
}
