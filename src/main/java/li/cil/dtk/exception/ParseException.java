package li.cil.dtk.exception;

import li.cil.dtk.api.DeviceTreeException;

/**
 * Raised for lexical and grammatical errors in device tree sources, including failures
 * to locate {@code /include/}d and {@code /incbin/}'d files.
 */
public final class ParseException extends DeviceTreeException {
    private final String fileName;
    private final int line;
    private final int column;
    private final String reason;

    public ParseException(final String fileName, final int line, final int column, final String reason) {
        super(String.format("%s:%d (column %d): parse error: %s", fileName, line, column, reason));
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.reason = reason;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * The error description without the location prefix.
     */
    public String getReason() {
        return reason;
    }
}
