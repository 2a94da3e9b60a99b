package li.cil.dtk.device;

import it.unimi.dsi.fastutil.objects.Object2LongMap;
import it.unimi.dsi.fastutil.objects.Object2LongMaps;

import javax.annotation.Nullable;

/**
 * A link from a device to the controller serving it, e.g. an interrupt line or a GPIO pin.
 * <p>
 * The controller is the final one after following any nexus maps. The specifier holds the
 * cells the controller needs to identify the resource, keyed by the names its binding
 * gives them, in declaration order.
 */
public abstract class ControllerReference {
    public final Device device;
    @Nullable public final String name;
    public final Device controller;
    public final Object2LongMap<String> specifier;

    protected ControllerReference(final Device device, @Nullable final String name, final Device controller,
                                  final Object2LongMap<String> specifier) {
        this.device = device;
        this.name = name;
        this.controller = controller;
        this.specifier = Object2LongMaps.unmodifiable(specifier);
    }

    protected abstract String getKindName();

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder("<").append(getKindName()).append(", ");
        if (name != null) {
            sb.append("name: ").append(name).append(", ");
        }
        return sb.append("target: ").append(controller)
                .append(", specifier: ").append(specifier)
                .append('>').toString();
    }
}
