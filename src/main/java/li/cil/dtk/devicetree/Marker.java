package li.cil.dtk.devicetree;

import java.util.Objects;

/**
 * A reference or label inside a property value that can only be resolved once the whole
 * tree has been parsed.
 */
public final class Marker {
    public enum Type {
        /**
         * Replaced by the NUL-terminated path of the referenced node.
         */
        PATH,
        /**
         * Replaces a four byte placeholder with the phandle of the referenced node.
         */
        PHANDLE,
        /**
         * A label pointing into the value. Consumes no bytes.
         */
        LABEL,
    }

    /**
     * Byte offset into the unresolved property value.
     */
    public final int offset;

    /**
     * Label name, or {@code {/path}} for path references.
     */
    public final String reference;

    public final Type type;

    public Marker(final int offset, final String reference, final Type type) {
        this.offset = offset;
        this.reference = reference;
        this.type = type;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        final Marker marker = (Marker) o;
        return offset == marker.offset && reference.equals(marker.reference) && type == marker.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, reference, type);
    }

    @Override
    public String toString() {
        return String.format("%s(%s)@%d", type, reference, offset);
    }
}
