package li.cil.dtk.devicetree;

import java.util.List;

/**
 * A {@code /memreserve/ <address> <length>;} statement.
 */
public final class MemoryReservation {
    public final List<String> labels;
    public final long address;
    public final long length;

    public MemoryReservation(final List<String> labels, final long address, final long length) {
        this.labels = List.copyOf(labels);
        this.address = address;
        this.length = length;
    }

    @Override
    public String toString() {
        return String.format("/memreserve/ 0x%016x 0x%016x", address, length);
    }
}
