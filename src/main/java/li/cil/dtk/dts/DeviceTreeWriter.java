package li.cil.dtk.dts;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.devicetree.MemoryReservation;
import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.utils.HexUtils;

/**
 * Renders a finished {@link DeviceTree} back to source text.
 * <p>
 * All property values are written as byte strings, so type information of the original
 * source is lost, but parsing the output yields an equal tree. Labels are kept, including
 * labels inside property values.
 */
public final class DeviceTreeWriter {
    public static String write(final DeviceTree tree) {
        final StringBuilder sb = new StringBuilder("/dts-v1/;\n\n");

        if (!tree.getMemoryReservations().isEmpty()) {
            for (final MemoryReservation reservation : tree.getMemoryReservations()) {
                appendLabels(sb, reservation.labels);
                sb.append(String.format("/memreserve/ 0x%016x 0x%016x;\n", reservation.address, reservation.length));
            }
            sb.append('\n');
        }

        writeNode(sb, tree.getRoot(), 0, false);
        sb.append('\n');

        // Labels on the root cannot precede '/', so each goes into a block reopening it.
        for (final String label : tree.getRoot().getLabels()) {
            sb.append('\n').append(label).append(": &{/} {\n};\n");
        }

        return sb.toString();
    }

    public static String write(final Node node) {
        final StringBuilder sb = new StringBuilder();
        writeNode(sb, node, 0, true);
        return sb.toString();
    }

    public static String write(final Property property) {
        final StringBuilder sb = new StringBuilder();
        writeProperty(sb, property);
        return sb.toString();
    }

    private static void writeNode(final StringBuilder sb, final Node node, final int depth, final boolean withLabels) {
        indent(sb, depth);
        if (withLabels) {
            appendLabels(sb, node.getLabels());
        }
        sb.append(node.getName()).append(" {\n");

        for (final Property property : node.getProperties()) {
            indent(sb, depth + 1);
            writeProperty(sb, property);
            sb.append('\n');
        }

        for (final Node child : node.getChildren()) {
            writeNode(sb, child, depth + 1, true);
            sb.append('\n');
        }

        indent(sb, depth);
        sb.append("};");
    }

    private static void writeProperty(final StringBuilder sb, final Property property) {
        appendLabels(sb, property.getLabels());
        sb.append(property.getName());

        if (property.isEmpty() && property.getOffsetLabels().isEmpty()) {
            sb.append(';');
            return;
        }

        final byte[] value = property.getValue();
        sb.append(" = [");

        int offset = 0;
        int labelOffset = 0;
        for (final Object2IntMap.Entry<String> entry : property.getOffsetLabels().object2IntEntrySet()) {
            labelOffset = entry.getIntValue();
            if (labelOffset > offset) {
                HexUtils.appendBytes(sb, value, offset, labelOffset);
            }
            sb.append(' ').append(entry.getKey()).append(':');
            offset = labelOffset;
        }
        HexUtils.appendBytes(sb, value, labelOffset, value.length);

        sb.append(" ];");
    }

    private static void appendLabels(final StringBuilder sb, final Iterable<String> labels) {
        for (final String label : labels) {
            sb.append(label).append(": ");
        }
    }

    private static void indent(final StringBuilder sb, final int depth) {
        sb.append("\t".repeat(depth));
    }
}
