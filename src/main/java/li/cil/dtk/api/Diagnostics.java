package li.cil.dtk.api;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Receives non-fatal findings, such as optional binding keys that are missing or
 * required properties absent from a node. Processing continues after a warning.
 */
@FunctionalInterface
public interface Diagnostics {
    /**
     * Forwards all warnings to the log.
     */
    Diagnostics LOGGER = new Diagnostics() {
        private final Logger logger = LogManager.getLogger(Diagnostics.class);

        @Override
        public void warn(final String message) {
            logger.warn(message);
        }
    };

    void warn(final String message);
}
