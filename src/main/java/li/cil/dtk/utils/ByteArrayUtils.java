package li.cil.dtk.utils;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Bitwise helpers on big-endian byte strings of possibly differing lengths. Shorter operands
 * are padded on the left, so the least significant bytes line up.
 */
public final class ByteArrayUtils {
    public static byte[] and(final byte[] a, final byte[] b) {
        final int length = Math.max(a.length, b.length);
        final byte[] lhs = padLeft(a, length, (byte) 0xFF);
        final byte[] rhs = padLeft(b, length, (byte) 0xFF);
        final byte[] result = new byte[length];
        for (int i = 0; i < length; i++) {
            result[i] = (byte) (lhs[i] & rhs[i]);
        }
        return result;
    }

    public static byte[] or(final byte[] a, final byte[] b) {
        final int length = Math.max(a.length, b.length);
        final byte[] lhs = padLeft(a, length, (byte) 0);
        final byte[] rhs = padLeft(b, length, (byte) 0);
        final byte[] result = new byte[length];
        for (int i = 0; i < length; i++) {
            result[i] = (byte) (lhs[i] | rhs[i]);
        }
        return result;
    }

    public static byte[] not(final byte[] a) {
        final byte[] result = new byte[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = (byte) ~a[i];
        }
        return result;
    }

    /**
     * Returns the trailing {@code length} bytes of {@code data}.
     */
    public static byte[] tail(final byte[] data, final int length) {
        return Arrays.copyOfRange(data, data.length - length, data.length);
    }

    public static byte[] concat(final byte[] a, final byte[] b) {
        final byte[] result = Arrays.copyOf(a, a.length + b.length);
        System.arraycopy(b, 0, result, a.length, b.length);
        return result;
    }

    public static BigInteger toUnsigned(final byte[] data, final int from, final int to) {
        return new BigInteger(1, Arrays.copyOfRange(data, from, to));
    }

    /**
     * Encodes a non-negative value as a big-endian byte string of exactly {@code length} bytes.
     *
     * @throws IllegalArgumentException if the value does not fit.
     */
    public static byte[] toBigEndian(final BigInteger value, final int length) {
        if (value.signum() < 0 || value.bitLength() > length * 8) {
            throw new IllegalArgumentException(String.format("%s does not fit in %d bytes", value, length));
        }
        final byte[] raw = value.toByteArray();
        final byte[] result = new byte[length];
        final int count = Math.min(raw.length, length);
        System.arraycopy(raw, raw.length - count, result, length - count, count);
        return result;
    }

    private static byte[] padLeft(final byte[] data, final int length, final byte fill) {
        if (data.length == length) {
            return data;
        }
        final byte[] result = new byte[length];
        Arrays.fill(result, 0, length - data.length, fill);
        System.arraycopy(data, 0, result, length - data.length, data.length);
        return result;
    }
}
