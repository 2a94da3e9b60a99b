package li.cil.dtk.binding;

import li.cil.dtk.api.Diagnostics;
import li.cil.dtk.exception.BindingException;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.util.*;

/**
 * A fully merged binding describing how nodes with a particular compatible string are to
 * be interpreted.
 * <p>
 * The raw merged document is available through {@link #getRaw()}, the parts the device
 * graph relies on are validated up front and exposed through typed accessors.
 */
public final class Binding {
    private final Path path;
    private final Map<String, Object> raw;
    private final Map<String, PropertySpec> properties;
    private final List<String> cells;
    @Nullable private final Binding subNode;

    private Binding(final Path path, final Map<String, Object> raw, final Map<String, PropertySpec> properties,
                    final List<String> cells, @Nullable final Binding subNode) {
        this.path = path;
        this.raw = raw;
        this.properties = properties;
        this.cells = cells;
        this.subNode = subNode;
    }

    static Binding create(final Path path, final Map<String, Object> raw, final Diagnostics diagnostics) throws BindingException {
        final Map<String, PropertySpec> properties = new LinkedHashMap<>();
        final Object rawProperties = raw.get("properties");
        if (rawProperties != null) {
            for (final Map.Entry<String, Object> entry : asMap(path, "properties", rawProperties).entrySet()) {
                final PropertySpec spec = createPropertySpec(path, entry.getKey(), entry.getValue(), diagnostics);
                if (spec != null) {
                    properties.put(spec.name, spec);
                }
            }
        }

        final List<String> cells = new ArrayList<>();
        final Object rawCells = raw.get("#cells");
        if (rawCells != null) {
            if (!(rawCells instanceof List)) {
                throw new BindingException(path, "malformed #cells array");
            }
            for (final Object cell : (List<?>) rawCells) {
                if (cell instanceof Map || cell instanceof List || cell == null) {
                    throw new BindingException(path, "malformed #cells array");
                }
                cells.add(cell.toString());
            }
        }

        Binding subNode = null;
        final Object rawSubNode = raw.get("sub-node");
        if (rawSubNode != null) {
            subNode = create(path, asMap(path, "sub-node", rawSubNode), diagnostics);
        }

        return new Binding(path, Collections.unmodifiableMap(raw), Collections.unmodifiableMap(properties),
                Collections.unmodifiableList(cells), subNode);
    }

    @Nullable
    private static PropertySpec createPropertySpec(final Path path, final String name, final Object value,
                                                   final Diagnostics diagnostics) throws BindingException {
        final Map<String, Object> options = asMap(path, "properties/" + name, value);

        final Object typeName = options.get("type");
        if (typeName == null) {
            throw new BindingException(path, String.format("%s lacks 'type'", name));
        }

        final PropertyType type = PropertyType.fromTypeName(typeName.toString());
        if (type == null) {
            diagnostics.warn(String.format("%s: unknown type '%s' for property '%s', ignoring it", path, typeName, name));
            return null;
        }

        final Object description = options.get("description");
        final Object enumValues = options.get("enum");
        if (enumValues != null && !(enumValues instanceof List)) {
            throw new BindingException(path, String.format("'enum' of property '%s' is not a list", name));
        }

        @SuppressWarnings("unchecked") final List<Object> enumList = (List<Object>) enumValues;
        return new PropertySpec(name, type, "optional".equals(options.get("category")),
                description != null ? description.toString().trim() : null, enumList);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(final Path path, final String key, final Object value) throws BindingException {
        if (!(value instanceof Map)) {
            throw new BindingException(path, String.format("'%s' is not a mapping", key));
        }
        return (Map<String, Object>) value;
    }

    /**
     * The top-level binding file this binding was loaded from.
     */
    public Path getPath() {
        return path;
    }

    public Map<String, Object> getRaw() {
        return raw;
    }

    @Nullable
    public String getTitle() {
        return getString(raw, "title");
    }

    @Nullable
    public String getDescription() {
        return getString(raw, "description");
    }

    @Nullable
    public String getVersion() {
        return getString(raw, "version");
    }

    /**
     * The bus devices using this binding sit on ({@code parent: bus:}), e.g. {@code i2c}.
     */
    @Nullable
    public String getBus() {
        return getNestedString("parent", "bus");
    }

    /**
     * The bus children of devices using this binding sit on ({@code child: bus:}).
     */
    @Nullable
    public String getChildBus() {
        return getNestedString("child", "bus");
    }

    public Map<String, PropertySpec> getProperties() {
        return properties;
    }

    /**
     * Names for the cells of specifiers pointing at devices with this binding.
     */
    public List<String> getCells() {
        return cells;
    }

    /**
     * The binding for child nodes without a compatible, from {@code sub-node:}.
     */
    @Nullable
    public Binding getSubNode() {
        return subNode;
    }

    @Nullable
    private String getNestedString(final String outer, final String inner) {
        final Object value = raw.get(outer);
        if (value instanceof Map) {
            return getString((Map<?, ?>) value, inner);
        }
        return null;
    }

    @Nullable
    private static String getString(final Map<?, ?> map, final String key) {
        final Object value = map.get(key);
        return value != null ? value.toString() : null;
    }

    @Override
    public String toString() {
        return String.format("Binding(path='%s', title='%s')", path, getTitle());
    }
}
