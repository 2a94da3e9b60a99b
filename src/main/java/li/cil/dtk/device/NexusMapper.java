package li.cil.dtk.device;

import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.devicetree.Values;
import li.cil.dtk.exception.SemanticException;
import li.cil.dtk.utils.ByteArrayUtils;
import li.cil.dtk.utils.HexUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves {@code (phandle, specifier)} lists to the controllers that finally receive them.
 * <p>
 * A phandle may point at a nexus node instead of a controller. Nexus nodes translate
 * specifiers through a {@code <prefix>-map} table, e.g. {@code interrupt-map}, whose rows
 * are {@code (child specifier, phandle, parent specifier)}. The child specifier is masked
 * with {@code <prefix>-map-mask} before looking for a matching row, bits selected by
 * {@code <prefix>-map-pass-thru} are carried over from the child specifier unchanged, and
 * lookup continues at the node the row points to until a node without map is reached.
 */
public final class NexusMapper {
    /**
     * A resolved link: the receiving controller and the specifier in its terms.
     */
    public static final class Link {
        public final Node controller;
        private final byte[] specifier;

        public Link(final Node controller, final byte[] specifier) {
            this.controller = controller;
            this.specifier = specifier.clone();
        }

        public byte[] getSpecifier() {
            return specifier.clone();
        }

        @Override
        public String toString() {
            return String.format("%s %s", controller.getPath(), HexUtils.toByteString(specifier));
        }
    }

    @FunctionalInterface
    private interface SpecifierLength {
        int of(final Node node) throws SemanticException;
    }

    /**
     * Resolves the interrupts of a node, from {@code interrupts-extended} if present, or
     * else from {@code interrupts} and the nearest {@code interrupt-parent}.
     */
    public static List<Link> resolveInterrupts(final Node node) throws SemanticException {
        final Property extended = node.getProperty("interrupts-extended");
        if (extended != null) {
            return resolve(extended, SpecifierKind.INTERRUPT);
        }

        final Property interrupts = node.getProperty("interrupts");
        if (interrupts == null) {
            return new ArrayList<>();
        }

        final Node parent = findInterruptParent(node);
        final int cells = SpecifierKind.INTERRUPT.cells(parent);
        final List<Link> result = new ArrayList<>();
        for (final byte[] specifier : AddressTranslator.slice(interrupts, Values.CELL_SIZE * cells)) {
            result.add(map(SpecifierKind.INTERRUPT, node, parent, specifier));
        }
        return result;
    }

    /**
     * Resolves a {@code (phandle, specifier)*} property such as {@code clocks} or
     * {@code foo-gpios}. The number of cells in each specifier is given by the node the
     * preceding phandle refers to.
     */
    public static List<Link> resolve(final Property property, final SpecifierKind kind) throws SemanticException {
        final List<Link> result = new ArrayList<>();
        final byte[] value = property.getValue();

        int offset = 0;
        while (offset < value.length) {
            if (value.length - offset < Values.CELL_SIZE) {
                throw new SemanticException("bad value for " + property);
            }
            final long phandle = ByteArrayUtils.toUnsigned(value, offset, offset + Values.CELL_SIZE).longValue();
            offset += Values.CELL_SIZE;

            final Node target = property.getNode().getTree().getNodeByPhandle((int) phandle);
            if (target == null) {
                throw new SemanticException("bad phandle in " + property);
            }

            final int length = Values.CELL_SIZE * kind.cells(target);
            if (value.length - offset < length) {
                throw new SemanticException("missing data after phandle in " + property);
            }

            result.add(map(kind, property.getNode(), target, Arrays.copyOfRange(value, offset, offset + length)));
            offset += length;
        }

        return result;
    }

    /**
     * Maps a specifier sent by {@code child} to {@code target} to the final receiver.
     */
    public static Link map(final SpecifierKind kind, final Node child, final Node target, final byte[] specifier) throws SemanticException {
        if (kind.isController(target)) {
            return new Link(target, specifier);
        }

        if (kind == SpecifierKind.INTERRUPT) {
            final Link link = map(kind, child, target, ByteArrayUtils.concat(rawUnitAddress(child), specifier),
                    node -> Values.CELL_SIZE * (ownAddressCells(node) + kind.cells(node)));

            // Strip the unit address of the receiving controller.
            final byte[] mapped = link.specifier;
            final int addressLength = Values.CELL_SIZE * ownAddressCells(link.controller);
            return new Link(link.controller, Arrays.copyOfRange(mapped, Math.min(addressLength, mapped.length), mapped.length));
        }

        return map(kind, child, target, specifier, node -> Values.CELL_SIZE * kind.cells(node));
    }

    private static Link map(final SpecifierKind kind, final Node child, final Node parent, final byte[] childSpecifier,
                            final SpecifierLength parentSpecifierLength) throws SemanticException {
        final Property map = parent.getProperty(kind.mapProperty());
        if (map == null) {
            return new Link(parent, childSpecifier);
        }

        final byte[] maskedChildSpecifier = mask(kind, child, parent, childSpecifier);

        final byte[] value = map.getValue();
        int offset = 0;
        while (offset < value.length) {
            if (value.length - offset < childSpecifier.length) {
                throw new SemanticException(String.format("bad value for %s, missing/truncated child specifier", map));
            }
            final byte[] entryChildSpecifier = Arrays.copyOfRange(value, offset, offset + childSpecifier.length);
            offset += childSpecifier.length;

            if (value.length - offset < Values.CELL_SIZE) {
                throw new SemanticException(String.format("bad value for %s, missing/truncated phandle", map));
            }
            final long phandle = ByteArrayUtils.toUnsigned(value, offset, offset + Values.CELL_SIZE).longValue();
            offset += Values.CELL_SIZE;

            final Node mapParent = parent.getTree().getNodeByPhandle((int) phandle);
            if (mapParent == null) {
                throw new SemanticException("bad phandle in " + map);
            }

            final int length = parentSpecifierLength.of(mapParent);
            if (value.length - offset < length) {
                throw new SemanticException(String.format("bad value for %s, missing/truncated parent specifier", map));
            }
            byte[] parentSpecifier = Arrays.copyOfRange(value, offset, offset + length);
            offset += length;

            if (Arrays.equals(entryChildSpecifier, maskedChildSpecifier)) {
                parentSpecifier = passThrough(kind, child, parent, childSpecifier, parentSpecifier);
                return map(kind, parent, mapParent, parentSpecifier, parentSpecifierLength);
            }
        }

        throw new SemanticException(String.format("child specifier for %s (%s) does not appear in %s",
                child, HexUtils.toByteString(childSpecifier), map));
    }

    private static byte[] mask(final SpecifierKind kind, final Node child, final Node parent, final byte[] childSpecifier) throws SemanticException {
        final Property mask = parent.getProperty(kind.maskProperty());
        if (mask == null) {
            return childSpecifier;
        }

        if (mask.length() != childSpecifier.length) {
            throw new SemanticException(String.format("%s: expected '%s' in %s to be %d bytes, is %d bytes",
                    child, kind.maskProperty(), parent, childSpecifier.length, mask.length()));
        }

        return ByteArrayUtils.and(childSpecifier, mask.getValue());
    }

    /**
     * Computes {@code (child & passThru) | (parent & ~passThru)}, truncated to the length of
     * the parent specifier.
     */
    private static byte[] passThrough(final SpecifierKind kind, final Node child, final Node parent,
                                      final byte[] childSpecifier, final byte[] parentSpecifier) throws SemanticException {
        final Property passThrough = parent.getProperty(kind.passThroughProperty());
        if (passThrough == null) {
            return parentSpecifier;
        }

        final byte[] bits = passThrough.getValue();
        if (bits.length != childSpecifier.length) {
            throw new SemanticException(String.format("%s: expected '%s' in %s to be %d bytes, is %d bytes",
                    child, kind.passThroughProperty(), parent, childSpecifier.length, bits.length));
        }

        final byte[] result = ByteArrayUtils.or(
                ByteArrayUtils.and(childSpecifier, bits),
                ByteArrayUtils.and(parentSpecifier, ByteArrayUtils.not(bits)));
        return ByteArrayUtils.tail(result, Math.min(parentSpecifier.length, result.length));
    }

    private static Node findInterruptParent(final Node node) throws SemanticException {
        for (Node current = node; current != null; current = current.getParent()) {
            final Property parent = current.getProperty("interrupt-parent");
            if (parent != null) {
                return parent.toNode();
            }
        }
        throw new SemanticException(String.format("%s has interrupts but no interrupt-parent", node));
    }

    /**
     * The {@code #address-cells} of the node itself, as opposed to the cells of its parent
     * that {@link AddressTranslator#addressCells(Node)} returns.
     */
    private static int ownAddressCells(final Node node) throws SemanticException {
        final Property property = node.getProperty("#address-cells");
        if (property == null) {
            throw new SemanticException(String.format("missing #address-cells on %s (while handling interrupt-map)", node));
        }
        return property.toCellCount();
    }

    private static byte[] rawUnitAddress(final Node node) throws SemanticException {
        final String unitAddress = node.getUnitAddress();
        if (unitAddress.isEmpty()) {
            return new byte[0];
        }

        final BigInteger address;
        try {
            address = new BigInteger(unitAddress, 16);
        } catch (final NumberFormatException e) {
            throw new SemanticException(node + " has non-numeric unit address", e);
        }

        try {
            return ByteArrayUtils.toBigEndian(address, Values.CELL_SIZE * AddressTranslator.addressCells(node));
        } catch (final IllegalArgumentException e) {
            throw new SemanticException(String.format("unit address of %s does not fit in its #address-cells", node), e);
        }
    }
}
