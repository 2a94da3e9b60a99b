package li.cil.dtk.device;

import javax.annotation.Nullable;

/**
 * A property of a device that its binding describes, with its typed value.
 */
public final class DeviceProperty {
    public final Device device;
    public final String name;
    public final PropertyValue value;
    /**
     * Position of the value in the binding's {@code enum:} list, {@code null} if the binding
     * does not restrict the values.
     */
    @Nullable public final Integer enumIndex;

    public DeviceProperty(final Device device, final String name, final PropertyValue value, @Nullable final Integer enumIndex) {
        this.device = device;
        this.name = name;
        this.value = value;
        this.enumIndex = enumIndex;
    }

    @Override
    public String toString() {
        return String.format("<Property, name: %s, value: %s%s>", name, value,
                enumIndex != null ? ", enum index: " + enumIndex : "");
    }
}
