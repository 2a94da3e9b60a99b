package li.cil.dtk.devicetree;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import li.cil.dtk.exception.SemanticException;
import li.cil.dtk.utils.HexUtils;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Decoders for raw property values. Numbers are big-endian, strings NUL-terminated.
 */
public final class Values {
    public static final int CELL_SIZE = 4;
    /**
     * Upper bound for {@code #address-cells}, {@code #size-cells} and {@code #...-cells} values.
     */
    public static final int MAX_CELL_COUNT = 16;

    public static BigInteger toNumber(final byte[] data, final boolean signed) {
        if (data.length == 0) {
            return BigInteger.ZERO;
        }
        return signed ? new BigInteger(data) : new BigInteger(1, data);
    }

    public static BigInteger toNumber(final byte[] data, final int length, final boolean signed) throws SemanticException {
        checkLength(length);
        if (data.length != length) {
            throw new SemanticException(String.format("%s is %d bytes long, expected %d",
                    HexUtils.toByteString(data), data.length, length));
        }
        return toNumber(data, signed);
    }

    /**
     * Interprets a single unsigned cell.
     */
    public static long toCell(final byte[] data) throws SemanticException {
        return toNumber(data, CELL_SIZE, false).longValue();
    }

    public static List<BigInteger> toNumbers(final byte[] data, final int length, final boolean signed) throws SemanticException {
        checkLength(length);
        if (data.length % length != 0) {
            throw new SemanticException(String.format("%s is %d bytes long, expected a length that's a multiple of %d",
                    HexUtils.toByteString(data), data.length, length));
        }

        final List<BigInteger> result = new ArrayList<>(data.length / length);
        for (int i = 0; i < data.length; i += length) {
            result.add(toNumber(Arrays.copyOfRange(data, i, i + length), signed));
        }
        return result;
    }

    /**
     * Interprets the value as a list of unsigned cells.
     */
    public static LongList toCells(final byte[] data) throws SemanticException {
        final LongList result = new LongArrayList();
        for (final BigInteger value : toNumbers(data, CELL_SIZE, false)) {
            result.add(value.longValue());
        }
        return result;
    }

    public static String toText(final byte[] data) throws SemanticException {
        final List<String> strings = toStrings(data);
        if (strings.size() != 1) {
            throw new SemanticException(String.format("%s contains more than one string", HexUtils.toByteString(data)));
        }
        return strings.get(0);
    }

    public static List<String> toStrings(final byte[] data) throws SemanticException {
        final String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data))
                    .toString();
        } catch (final CharacterCodingException e) {
            throw new SemanticException(String.format("%s is not valid UTF-8", HexUtils.toByteString(data)), e);
        }

        if (!text.endsWith("\0")) {
            throw new SemanticException(String.format("%s is not null-terminated", HexUtils.toByteString(data)));
        }

        return Arrays.asList(text.substring(0, text.length() - 1).split("\0", -1));
    }

    private static void checkLength(final int length) {
        if (length < 1) {
            throw new IllegalArgumentException("'length' must be greater than zero, was " + length);
        }
    }
}
