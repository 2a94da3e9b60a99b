package li.cil.dtk.binding;

import javax.annotation.Nullable;
import java.util.List;

/**
 * One entry of a binding's {@code properties:} section.
 */
public final class PropertySpec {
    public final String name;
    public final PropertyType type;
    public final boolean isOptional;
    @Nullable public final String description;
    /**
     * Allowed values from {@code enum:}, or {@code null} if any value is allowed. Integers
     * are {@link Long}s, everything else is kept as loaded.
     */
    @Nullable public final List<Object> enumValues;

    public PropertySpec(final String name, final PropertyType type, final boolean isOptional,
                        @Nullable final String description, @Nullable final List<Object> enumValues) {
        this.name = name;
        this.type = type;
        this.isOptional = isOptional;
        this.description = description;
        this.enumValues = enumValues != null ? List.copyOf(enumValues) : null;
    }

    @Override
    public String toString() {
        return String.format("%s (%s%s)", name, type.getTypeName(), isOptional ? ", optional" : "");
    }
}
