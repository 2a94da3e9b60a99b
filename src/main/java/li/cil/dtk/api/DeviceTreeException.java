package li.cil.dtk.api;

/**
 * Base class for all errors raised while parsing device tree sources, loading bindings or
 * building the device graph.
 * <p>
 * All of these are fatal to the operation that raised them. Results of a failed operation
 * must be discarded, there is no partial result.
 */
public abstract class DeviceTreeException extends Exception {
    protected DeviceTreeException(final String message) {
        super(message);
    }

    protected DeviceTreeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
