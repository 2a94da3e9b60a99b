package li.cil.dtk.device;

import it.unimi.dsi.fastutil.objects.Object2LongMap;

import javax.annotation.Nullable;

/**
 * A GPIO used by a device. The name is the {@code <prefix>} of the {@code <prefix>-gpios}
 * property it came from, empty for a plain {@code gpios} property.
 */
public final class Gpio extends ControllerReference {
    public Gpio(final Device device, @Nullable final String name, final Device controller, final Object2LongMap<String> specifier) {
        super(device, name, controller, specifier);
    }

    @Override
    protected String getKindName() {
        return "GPIO";
    }
}
