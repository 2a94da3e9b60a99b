package li.cil.dtk.exception;

import li.cil.dtk.api.DeviceTreeException;

/**
 * Raised for structurally valid input that does not make sense: unresolved references,
 * duplicate phandles or labels, malformed cell counts, failed nexus lookups and the like.
 * <p>
 * Messages name the node path and, where applicable, the property involved.
 */
public final class SemanticException extends DeviceTreeException {
    public SemanticException(final String message) {
        super(message);
    }

    public SemanticException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
