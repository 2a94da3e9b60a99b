package li.cil.dtk.binding;

import javax.annotation.Nullable;

/**
 * How a property listed in a binding's {@code properties:} section is interpreted.
 */
public enum PropertyType {
    BOOLEAN("boolean"),
    INT("int"),
    ARRAY("array"),
    UINT8_ARRAY("uint8-array"),
    STRING("string"),
    STRING_ARRAY("string-array"),
    ;

    private final String typeName;

    PropertyType(final String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    @Nullable
    public static PropertyType fromTypeName(final String typeName) {
        for (final PropertyType type : values()) {
            if (type.typeName.equals(typeName)) {
                return type;
            }
        }
        return null;
    }
}
