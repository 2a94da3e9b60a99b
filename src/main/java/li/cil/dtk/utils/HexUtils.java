package li.cil.dtk.utils;

import java.util.HexFormat;

public final class HexUtils {
    private static final HexFormat UPPER_CASE = HexFormat.of().withUpperCase();

    /**
     * Appends {@code data[from..to)} as space separated two digit upper case hex bytes,
     * each preceded by a single space, e.g. {@code " 0A FF"}.
     */
    public static void appendBytes(final StringBuilder out, final byte[] data, final int from, final int to) {
        for (int i = from; i < to; i++) {
            out.append(' ');
            UPPER_CASE.toHexDigits(out, data[i]);
        }
    }

    /**
     * Formats a byte array the way it would appear in a byte string, e.g. {@code [ 41 00 ]}.
     */
    public static String toByteString(final byte[] data) {
        final StringBuilder sb = new StringBuilder("[");
        appendBytes(sb, data, 0, data.length);
        return sb.append(" ]").toString();
    }
}
