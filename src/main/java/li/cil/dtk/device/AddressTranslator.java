package li.cil.dtk.device;

import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.devicetree.Values;
import li.cil.dtk.exception.SemanticException;
import li.cil.dtk.utils.ByteArrayUtils;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Address related helpers: cell counts and translation of bus addresses into the root
 * address space through {@code ranges}.
 */
public final class AddressTranslator {
    private static final int DEFAULT_ADDRESS_CELLS = 2;
    private static final int DEFAULT_SIZE_CELLS = 1;

    /**
     * The number of cells used for addresses in the {@code reg} property of the given node,
     * i.e. the {@code #address-cells} of its parent.
     */
    public static int addressCells(final Node node) throws SemanticException {
        return parentCells(node, "#address-cells", DEFAULT_ADDRESS_CELLS);
    }

    public static int sizeCells(final Node node) throws SemanticException {
        return parentCells(node, "#size-cells", DEFAULT_SIZE_CELLS);
    }

    /**
     * Translates an address on the bus the given node sits on into the root address space.
     * <p>
     * Without a {@code ranges} property on the parent the address is not translated. An empty
     * {@code ranges} maps addresses one to one. Otherwise the entry whose child window
     * {@code [child, child + length)} contains the address is applied and translation
     * continues with the parent. Addresses outside all windows are returned as they are.
     */
    public static BigInteger translate(final BigInteger address, final Node node) throws SemanticException {
        final Node parent = node.getParent();
        if (parent == null) {
            return address;
        }

        final Property ranges = parent.getProperty("ranges");
        if (ranges == null) {
            return address;
        }

        if (ranges.isEmpty()) {
            return translate(address, parent);
        }

        final int childAddressCells = addressCells(node);
        final int parentAddressCells = addressCells(parent);
        final int childSizeCells = sizeCells(node);
        final int childAddressLength = Values.CELL_SIZE * childAddressCells;
        final int parentAddressLength = Values.CELL_SIZE * parentAddressCells;

        for (final byte[] entry : slice(ranges, Values.CELL_SIZE * (childAddressCells + parentAddressCells + childSizeCells))) {
            final BigInteger childAddress = ByteArrayUtils.toUnsigned(entry, 0, childAddressLength);
            final BigInteger parentAddress = ByteArrayUtils.toUnsigned(entry, childAddressLength, childAddressLength + parentAddressLength);
            final BigInteger length = ByteArrayUtils.toUnsigned(entry, childAddressLength + parentAddressLength, entry.length);

            if (address.compareTo(childAddress) >= 0 && address.compareTo(childAddress.add(length)) < 0) {
                return translate(parentAddress.add(address.subtract(childAddress)), parent);
            }
        }

        return address;
    }

    /**
     * Splits a property value into chunks of {@code size} bytes.
     */
    public static List<byte[]> slice(final Property property, final int size) throws SemanticException {
        final byte[] value = property.getValue();
        if (size <= 0 || value.length % size != 0) {
            throw new SemanticException(String.format("'%s' property in %s has length %d, which is not evenly divisible by %d",
                    property.getName(), property.getNode().getPath(), value.length, size));
        }

        final List<byte[]> result = new ArrayList<>(value.length / size);
        for (int i = 0; i < value.length; i += size) {
            result.add(Arrays.copyOfRange(value, i, i + size));
        }
        return result;
    }

    private static int parentCells(final Node node, final String name, final int defaultValue) throws SemanticException {
        final Node parent = node.getParent();
        if (parent == null) {
            return defaultValue;
        }
        final Property property = parent.getProperty(name);
        return property != null ? property.toCellCount() : defaultValue;
    }
}
