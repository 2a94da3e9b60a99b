package li.cil.dtk.devicetree;

import java.util.Objects;

/**
 * Target of a label placed inside a property value, e.g. {@code x = < 0 label: 1 >;}.
 */
public final class PropertyOffset {
    public final Property property;
    public final int offset;

    public PropertyOffset(final Property property, final int offset) {
        this.property = property;
        this.offset = offset;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final PropertyOffset that = (PropertyOffset) o;
        return offset == that.offset && property == that.property;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(property), offset);
    }

    @Override
    public String toString() {
        return String.format("%s+%d", property, offset);
    }
}
