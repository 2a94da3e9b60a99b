package li.cil.dtk.device;

import it.unimi.dsi.fastutil.objects.Object2LongMap;

import javax.annotation.Nullable;

/**
 * An interrupt generated by a device, from {@code interrupts} or {@code interrupts-extended}.
 */
public final class Interrupt extends ControllerReference {
    public Interrupt(final Device device, @Nullable final String name, final Device controller, final Object2LongMap<String> specifier) {
        super(device, name, controller, specifier);
    }

    @Override
    protected String getKindName() {
        return "Interrupt";
    }
}
