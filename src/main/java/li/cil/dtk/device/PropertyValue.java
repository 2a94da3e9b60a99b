package li.cil.dtk.device;

import li.cil.dtk.binding.PropertyType;
import li.cil.dtk.utils.HexUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The value of a device property, interpreted according to the type its binding declares.
 * <p>
 * The set of subclasses is closed, there is one per {@link PropertyType}. Use a
 * {@link Visitor} to handle all of them.
 */
public abstract class PropertyValue {
    public interface Visitor<T> {
        T visitBoolean(boolean value);

        T visitInt(BigInteger value);

        T visitArray(List<BigInteger> value);

        T visitUint8Array(byte[] value);

        T visitString(String value);

        T visitStringArray(List<String> value);
    }

    private PropertyValue() {
    }

    public abstract PropertyType getType();

    public abstract <T> T accept(final Visitor<T> visitor);

    /**
     * The value in a form comparable to values loaded from binding files: integers are
     * {@link BigInteger}s, arrays are lists.
     */
    abstract Object toComparable();

    public static PropertyValue of(final boolean value) {
        return new BooleanValue(value);
    }

    public static PropertyValue of(final BigInteger value) {
        return new IntValue(value);
    }

    public static PropertyValue ofArray(final List<BigInteger> value) {
        return new ArrayValue(value);
    }

    public static PropertyValue of(final byte[] value) {
        return new Uint8ArrayValue(value);
    }

    public static PropertyValue of(final String value) {
        return new StringValue(value);
    }

    public static PropertyValue ofStrings(final List<String> value) {
        return new StringArrayValue(value);
    }

    // --------------------------------------------------------------------- //

    public static final class BooleanValue extends PropertyValue {
        public final boolean value;

        private BooleanValue(final boolean value) {
            this.value = value;
        }

        @Override
        public PropertyType getType() {
            return PropertyType.BOOLEAN;
        }

        @Override
        public <T> T accept(final Visitor<T> visitor) {
            return visitor.visitBoolean(value);
        }

        @Override
        Object toComparable() {
            return value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    public static final class IntValue extends PropertyValue {
        public final BigInteger value;

        private IntValue(final BigInteger value) {
            this.value = value;
        }

        @Override
        public PropertyType getType() {
            return PropertyType.INT;
        }

        @Override
        public <T> T accept(final Visitor<T> visitor) {
            return visitor.visitInt(value);
        }

        @Override
        Object toComparable() {
            return value;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class ArrayValue extends PropertyValue {
        public final List<BigInteger> value;

        private ArrayValue(final List<BigInteger> value) {
            this.value = List.copyOf(value);
        }

        @Override
        public PropertyType getType() {
            return PropertyType.ARRAY;
        }

        @Override
        public <T> T accept(final Visitor<T> visitor) {
            return visitor.visitArray(value);
        }

        @Override
        Object toComparable() {
            return value;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }

    public static final class Uint8ArrayValue extends PropertyValue {
        private final byte[] value;

        private Uint8ArrayValue(final byte[] value) {
            this.value = value.clone();
        }

        public byte[] getValue() {
            return value.clone();
        }

        @Override
        public PropertyType getType() {
            return PropertyType.UINT8_ARRAY;
        }

        @Override
        public <T> T accept(final Visitor<T> visitor) {
            return visitor.visitUint8Array(getValue());
        }

        @Override
        Object toComparable() {
            final List<BigInteger> result = new ArrayList<>(value.length);
            for (final byte b : value) {
                result.add(BigInteger.valueOf(b & 0xFF));
            }
            return result;
        }

        @Override
        public boolean equals(final Object o) {
            return o instanceof Uint8ArrayValue && Arrays.equals(value, ((Uint8ArrayValue) o).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return HexUtils.toByteString(value);
        }
    }

    public static final class StringValue extends PropertyValue {
        public final String value;

        private StringValue(final String value) {
            this.value = value;
        }

        @Override
        public PropertyType getType() {
            return PropertyType.STRING;
        }

        @Override
        public <T> T accept(final Visitor<T> visitor) {
            return visitor.visitString(value);
        }

        @Override
        Object toComparable() {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    public static final class StringArrayValue extends PropertyValue {
        public final List<String> value;

        private StringArrayValue(final List<String> value) {
            this.value = List.copyOf(value);
        }

        @Override
        public PropertyType getType() {
            return PropertyType.STRING_ARRAY;
        }

        @Override
        public <T> T accept(final Visitor<T> visitor) {
            return visitor.visitStringArray(value);
        }

        @Override
        Object toComparable() {
            return value;
        }

        @Override
        public String toString() {
            return value.toString();
        }
    }
}
