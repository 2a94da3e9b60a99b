package li.cil.dtk.device;

import it.unimi.dsi.fastutil.objects.Object2LongMap;

import javax.annotation.Nullable;

public final class Clock extends ControllerReference {
    public Clock(final Device device, @Nullable final String name, final Device controller, final Object2LongMap<String> specifier) {
        super(device, name, controller, specifier);
    }

    @Override
    protected String getKindName() {
        return "Clock";
    }
}
