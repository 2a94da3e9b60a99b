package li.cil.dtk.device;

import javax.annotation.Nullable;
import java.math.BigInteger;

/**
 * One entry of a device's {@code reg} property, with the address translated into the
 * root address space.
 */
public final class Register {
    public final Device device;
    @Nullable public final String name;
    public final BigInteger address;
    /**
     * The size of the register block, {@code null} if {@code #size-cells} is zero.
     */
    @Nullable public final BigInteger size;

    public Register(final Device device, @Nullable final String name, final BigInteger address, @Nullable final BigInteger size) {
        this.device = device;
        this.name = name;
        this.address = address;
        this.size = size;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("<Register, ");
        if (name != null) {
            sb.append("name: ").append(name).append(", ");
        }
        sb.append("addr: 0x").append(address.toString(16));
        if (size != null && size.signum() != 0) {
            sb.append(", size: 0x").append(size.toString(16));
        }
        return sb.append('>').toString();
    }
}
