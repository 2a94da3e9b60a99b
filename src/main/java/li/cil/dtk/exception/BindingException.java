package li.cil.dtk.exception;

import li.cil.dtk.api.DeviceTreeException;

import javax.annotation.Nullable;
import java.nio.file.Path;

/**
 * Raised for malformed binding files, unresolvable {@code !include}s and conflicting merges.
 */
public final class BindingException extends DeviceTreeException {
    @Nullable private final Path bindingPath;

    public BindingException(final String message) {
        super(message);
        this.bindingPath = null;
    }

    public BindingException(final Path bindingPath, final String message) {
        super(String.format("%s: %s", bindingPath, message));
        this.bindingPath = bindingPath;
    }

    public BindingException(final Path bindingPath, final String message, final Throwable cause) {
        super(String.format("%s: %s", bindingPath, message), cause);
        this.bindingPath = bindingPath;
    }

    @Nullable
    public Path getBindingPath() {
        return bindingPath;
    }
}
