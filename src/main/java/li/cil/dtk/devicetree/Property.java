package li.cil.dtk.devicetree;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import li.cil.dtk.exception.SemanticException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A property ({@code name = value;} or {@code name;}) on a {@link Node}.
 * <p>
 * The value is kept as raw bytes. Several comma separated values in one assignment are
 * concatenated, e.g. {@code x = "foo", < 0x12345678 >, [ 9A ];} yields
 * {@code 66 6F 6F 00 12 34 56 78 9A}.
 */
public final class Property {
    private final Node node;
    private final String name;
    private final ByteArrayList value = new ByteArrayList();
    private final List<String> labels = new ArrayList<>();
    private final List<Marker> markers = new ArrayList<>();
    private final Object2IntLinkedOpenHashMap<String> offsetLabels = new Object2IntLinkedOpenHashMap<>();

    Property(final Node node, final String name) {
        this.node = node;
        this.name = name;
    }

    public Node getNode() {
        return node;
    }

    public String getName() {
        return name;
    }

    public byte[] getValue() {
        return value.toByteArray();
    }

    public int length() {
        return value.size();
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    public List<String> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    /**
     * Labels inside the value mapped to their byte offset, in order of appearance.
     * Only populated once the tree has been post-processed.
     */
    public Object2IntMap<String> getOffsetLabels() {
        return Object2IntMaps.unmodifiable(offsetLabels);
    }

    /**
     * References and in-value labels still waiting for resolution. Empty after post-processing.
     */
    public List<Marker> getMarkers() {
        return Collections.unmodifiableList(markers);
    }

    // --------------------------------------------------------------------- //
    // Mutation, only legal while the owning tree is being parsed.

    public void addLabel(final String label) {
        node.getTree().checkMutable();
        if (!labels.contains(label)) {
            labels.add(label);
        }
    }

    public void append(final byte[] data) {
        node.getTree().checkMutable();
        value.addElements(value.size(), data);
    }

    public void append(final byte data) {
        node.getTree().checkMutable();
        value.add(data);
    }

    /**
     * Records a reference or label at the current end of the value. Phandle references
     * reserve four zero bytes that get patched during post-processing.
     */
    public void addMarker(final String reference, final Marker.Type type) {
        node.getTree().checkMutable();
        markers.add(new Marker(value.size(), reference, type));
        if (type == Marker.Type.PHANDLE) {
            value.addElements(value.size(), new byte[Values.CELL_SIZE]);
        }
    }

    /**
     * Drops the value and all pending markers, for reassignment.
     */
    public void clearValue() {
        node.getTree().checkMutable();
        value.clear();
        markers.clear();
    }

    void setResolvedValue(final byte[] data, final List<Marker> offsetLabelMarkers) {
        value.clear();
        value.addElements(0, data);
        markers.clear();
        offsetLabels.clear();
        for (final Marker marker : offsetLabelMarkers) {
            offsetLabels.putIfAbsent(marker.reference, marker.offset);
        }
    }

    void setRawValue(final byte[] data) {
        value.clear();
        value.addElements(0, data);
    }

    // --------------------------------------------------------------------- //
    // Decoding

    public BigInteger toNumber(final int length, final boolean signed) throws SemanticException {
        try {
            return Values.toNumber(getValue(), length, signed);
        } catch (final SemanticException e) {
            throw withContext(e);
        }
    }

    /**
     * Interprets the value as one unsigned 32-bit cell.
     */
    public long toCell() throws SemanticException {
        return toNumber(Values.CELL_SIZE, false).longValue();
    }

    /**
     * Interprets the value as a {@code #...-cells} count, which must not exceed
     * {@link Values#MAX_CELL_COUNT}.
     */
    public int toCellCount() throws SemanticException {
        final long cells = toCell();
        if (cells > Values.MAX_CELL_COUNT) {
            throw withContext(new SemanticException(String.format("malformed #cells: %d exceeds %d", cells, Values.MAX_CELL_COUNT)));
        }
        return (int) cells;
    }

    public List<BigInteger> toNumbers(final int length, final boolean signed) throws SemanticException {
        try {
            return Values.toNumbers(getValue(), length, signed);
        } catch (final SemanticException e) {
            throw withContext(e);
        }
    }

    public LongList toCells() throws SemanticException {
        try {
            return Values.toCells(getValue());
        } catch (final SemanticException e) {
            throw withContext(e);
        }
    }

    public String toText() throws SemanticException {
        try {
            return Values.toText(getValue());
        } catch (final SemanticException e) {
            throw withContext(e);
        }
    }

    public List<String> toStrings() throws SemanticException {
        try {
            return Values.toStrings(getValue());
        } catch (final SemanticException e) {
            throw withContext(e);
        }
    }

    /**
     * Interprets the value as a phandle and returns the node it identifies.
     */
    public Node toNode() throws SemanticException {
        final long phandle = toCell();
        final Node target = node.getTree().getNodeByPhandle((int) phandle);
        if (target == null) {
            throw withContext(new SemanticException("non-existent phandle " + phandle));
        }
        return target;
    }

    private SemanticException withContext(final SemanticException e) {
        return new SemanticException(String.format("%s (for property '%s' on %s)", e.getMessage(), name, node.getPath()), e);
    }

    @Override
    public String toString() {
        return String.format("<Property '%s' at '%s'>", name, node.getPath());
    }
}
