package li.cil.dtk.device;

import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntMaps;
import it.unimi.dsi.fastutil.objects.Object2LongLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2LongMap;
import li.cil.dtk.api.Diagnostics;
import li.cil.dtk.binding.Binding;
import li.cil.dtk.binding.BindingResolver;
import li.cil.dtk.binding.PropertySpec;
import li.cil.dtk.binding.PropertyType;
import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.devicetree.Values;
import li.cil.dtk.exception.SemanticException;
import li.cil.dtk.utils.ByteArrayUtils;

import javax.annotation.Nullable;
import java.math.BigInteger;
import java.util.*;

/**
 * A node of the device tree interpreted through its binding.
 * <p>
 * Devices are created by {@link DeviceGraph} in two passes. The first pass, in tree order,
 * determines the binding of each device, which may depend on the binding of its parent.
 * The second pass resolves everything that may refer to other devices, such as interrupt
 * controllers and GPIO controllers.
 */
public final class Device {
    private static final String GPIOS_SUFFIX = "-gpios";

    private final DeviceGraph graph;
    private final Node node;
    @Nullable private final Device parent;
    private final List<String> compats;
    private final boolean enabled;

    @Nullable private String matchingCompat;
    @Nullable private Binding binding;
    private final Object2IntMap<String> instanceNumbers = new Object2IntLinkedOpenHashMap<>();

    private final Map<String, DeviceProperty> properties = new LinkedHashMap<>();
    private final List<Register> registers = new ArrayList<>();
    private final List<Interrupt> interrupts = new ArrayList<>();
    private final Map<String, List<Gpio>> gpios = new LinkedHashMap<>();
    private final List<Clock> clocks = new ArrayList<>();
    private final List<Pwm> pwms = new ArrayList<>();

    private boolean isUnitAddressResolved;
    @Nullable private BigInteger unitAddress;

    Device(final DeviceGraph graph, final Node node, @Nullable final Device parent) throws SemanticException {
        this.graph = graph;
        this.node = node;
        this.parent = parent;

        final Property compatible = node.getProperty("compatible");
        this.compats = compatible != null ? compatible.toStrings() : Collections.emptyList();

        final Property status = node.getProperty("status");
        this.enabled = status == null || !"disabled".equals(status.toText());
    }

    // --------------------------------------------------------------------- //
    // Construction

    /**
     * Picks the binding for the first compatible string that has one on the bus this device
     * sits on. Nodes without {@code compatible} use the {@code sub-node} binding of their
     * parent, if any.
     */
    void initBinding(final BindingResolver resolver) {
        if (!compats.isEmpty()) {
            final String bus = parent != null && parent.binding != null ? parent.binding.getChildBus() : null;
            for (final String compat : compats) {
                final Binding candidate = resolver.find(compat, bus);
                if (candidate != null) {
                    matchingCompat = compat;
                    binding = candidate;
                    return;
                }
            }
        } else if (parent != null && parent.binding != null && parent.binding.getSubNode() != null) {
            matchingCompat = parent.matchingCompat;
            binding = parent.binding.getSubNode();
        }
    }

    void setInstanceNumber(final String compat, final int number) {
        instanceNumbers.put(compat, number);
    }

    void resolve(final Diagnostics diagnostics) throws SemanticException {
        initProperties(diagnostics);
        initRegisters();
        initInterrupts();
        initGpios();
        initClocks();
        initPwms();
    }

    private void initProperties(final Diagnostics diagnostics) throws SemanticException {
        if (binding == null) {
            return;
        }

        for (final PropertySpec spec : binding.getProperties().values()) {
            final PropertyValue value = readProperty(spec, diagnostics);
            if (value == null) {
                continue;
            }

            Integer enumIndex = null;
            if (spec.enumValues != null) {
                final int index = indexOfEnumValue(spec.enumValues, value.toComparable());
                if (index < 0) {
                    throw new SemanticException(String.format("value (%s) for property (%s) is not in enumerated list %s for node %s",
                            value, spec.name, spec.enumValues, getName()));
                }
                enumIndex = index;
            }

            properties.put(spec.name, new DeviceProperty(this, spec.name, value, enumIndex));
        }
    }

    @Nullable
    private PropertyValue readProperty(final PropertySpec spec, final Diagnostics diagnostics) throws SemanticException {
        final Property property = node.getProperty(spec.name);
        if (spec.type == PropertyType.BOOLEAN) {
            return PropertyValue.of(property != null);
        }

        if (property == null) {
            if (!spec.isOptional && enabled) {
                diagnostics.warn(String.format("REQUIRED PROP:'%s' appears in 'properties' in binding for %s, but not in its device tree node",
                        spec.name, node.getPath()));
            }
            return null;
        }

        return switch (spec.type) {
            case INT -> PropertyValue.of(property.toNumber(Values.CELL_SIZE, false));
            case ARRAY -> PropertyValue.ofArray(property.toNumbers(Values.CELL_SIZE, false));
            case UINT8_ARRAY -> PropertyValue.of(property.getValue());
            case STRING -> PropertyValue.of(property.toText());
            case STRING_ARRAY -> PropertyValue.ofStrings(property.toStrings());
            default -> throw new IllegalStateException("unhandled property type " + spec.type);
        };
    }

    private void initRegisters() throws SemanticException {
        final Property reg = node.getProperty("reg");
        if (reg == null) {
            return;
        }

        final int addressLength = Values.CELL_SIZE * AddressTranslator.addressCells(node);
        final int sizeLength = Values.CELL_SIZE * AddressTranslator.sizeCells(node);

        final List<byte[]> entries = AddressTranslator.slice(reg, addressLength + sizeLength);
        final List<String> names = getNames("reg-names", entries.size());
        for (int i = 0; i < entries.size(); i++) {
            final byte[] entry = entries.get(i);
            final BigInteger address = AddressTranslator.translate(ByteArrayUtils.toUnsigned(entry, 0, addressLength), node);
            final BigInteger size = sizeLength != 0 ? ByteArrayUtils.toUnsigned(entry, addressLength, entry.length) : null;
            registers.add(new Register(this, names.get(i), address, size));
        }
    }

    private void initInterrupts() throws SemanticException {
        final List<NexusMapper.Link> links = NexusMapper.resolveInterrupts(node);
        final List<String> names = getNames("interrupt-names", links.size());
        for (int i = 0; i < links.size(); i++) {
            final NexusMapper.Link link = links.get(i);
            final Device controller = graph.getDevice(link.controller);
            interrupts.add(new Interrupt(this, names.get(i), controller, namedCells(controller, link, "interrupt")));
        }
    }

    private void initGpios() throws SemanticException {
        for (final Property property : node.getProperties()) {
            final String prefix;
            if ("gpios".equals(property.getName())) {
                prefix = "";
            } else if (property.getName().endsWith(GPIOS_SUFFIX)) {
                prefix = property.getName().substring(0, property.getName().length() - GPIOS_SUFFIX.length());
            } else {
                continue;
            }

            final List<Gpio> result = new ArrayList<>();
            for (final NexusMapper.Link link : NexusMapper.resolve(property, SpecifierKind.GPIO)) {
                final Device controller = graph.getDevice(link.controller);
                result.add(new Gpio(this, prefix, controller, namedCells(controller, link, "GPIO")));
            }
            gpios.put(prefix, result);
        }
    }

    private void initClocks() throws SemanticException {
        final Property property = node.getProperty("clocks");
        if (property == null) {
            return;
        }

        final List<NexusMapper.Link> links = NexusMapper.resolve(property, SpecifierKind.CLOCK);
        final List<String> names = getNames("clock-names", links.size());
        for (int i = 0; i < links.size(); i++) {
            final NexusMapper.Link link = links.get(i);
            final Device controller = graph.getDevice(link.controller);
            clocks.add(new Clock(this, names.get(i), controller, namedCells(controller, link, "clock")));
        }
    }

    private void initPwms() throws SemanticException {
        final Property property = node.getProperty("pwms");
        if (property == null) {
            return;
        }

        final List<NexusMapper.Link> links = NexusMapper.resolve(property, SpecifierKind.PWM);
        final List<String> names = getNames("pwm-names", links.size());
        for (int i = 0; i < links.size(); i++) {
            final NexusMapper.Link link = links.get(i);
            final Device controller = graph.getDevice(link.controller);
            pwms.add(new Pwm(this, names.get(i), controller, namedCells(controller, link, "PWM")));
        }
    }

    /**
     * Names for objects created from a list property, from the matching {@code *-names}
     * property. Returns a list of {@code null}s if there is no such property.
     */
    private List<String> getNames(final String propertyName, final int count) throws SemanticException {
        final Property property = node.getProperty(propertyName);
        if (property == null) {
            return Collections.nCopies(count, null);
        }

        final List<String> names = property.toStrings();
        if (names.size() != count) {
            throw new SemanticException(String.format("%s property in %s has %d strings, expected %d strings",
                    propertyName, node.getPath(), names.size(), count));
        }
        return names;
    }

    private Object2LongMap<String> namedCells(final Device controller, final NexusMapper.Link link, final String kind) throws SemanticException {
        if (controller.binding == null) {
            throw new SemanticException(String.format("%s controller %s for %s lacks binding",
                    kind, controller.getPath(), node.getPath()));
        }

        final List<String> cellNames = controller.binding.getCells();
        final LongList cells = Values.toCells(link.getSpecifier());
        if (cellNames.size() != cells.size()) {
            throw new SemanticException(String.format("unexpected #cells length in binding for %s - %d instead of %d",
                    controller.getPath(), cellNames.size(), cells.size()));
        }

        final Object2LongMap<String> result = new Object2LongLinkedOpenHashMap<>();
        for (int i = 0; i < cellNames.size(); i++) {
            result.put(cellNames.get(i), cells.getLong(i));
        }
        return result;
    }

    private static int indexOfEnumValue(final List<Object> enumValues, final Object value) {
        for (int i = 0; i < enumValues.size(); i++) {
            if (Objects.equals(normalize(enumValues.get(i)), value)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Brings numbers loaded from YAML into the representation used by property values.
     */
    @Nullable
    private static Object normalize(@Nullable final Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof List) {
            final List<Object> result = new ArrayList<>();
            for (final Object item : (List<?>) value) {
                result.add(normalize(item));
            }
            return result;
        }
        return value;
    }

    // --------------------------------------------------------------------- //
    // Accessors

    public String getName() {
        return node.getName();
    }

    public String getPath() {
        return node.getPath();
    }

    public Node getNode() {
        return node;
    }

    @Nullable
    public Device getParent() {
        return parent;
    }

    public List<Device> getChildren() {
        final List<Device> result = new ArrayList<>();
        for (final Node child : node.getChildren()) {
            result.add(graph.getDevice(child));
        }
        return result;
    }

    /**
     * The unit address translated into the root address space, {@code null} if the node
     * name has none.
     */
    @Nullable
    public BigInteger getUnitAddress(final Diagnostics diagnostics) throws SemanticException {
        if (isUnitAddressResolved) {
            return unitAddress;
        }

        final String text = node.getUnitAddress();
        if (!text.isEmpty()) {
            final BigInteger address;
            try {
                address = new BigInteger(text, 16);
            } catch (final NumberFormatException e) {
                throw new SemanticException(node.getPath() + " has non-hex unit address", e);
            }

            unitAddress = AddressTranslator.translate(address, node);
            if (!registers.isEmpty() && !registers.get(0).address.equals(unitAddress)) {
                diagnostics.warn(String.format("unit-address and first reg (0x%x) don't match for %s",
                        registers.get(0).address, getName()));
            }
        }

        isUnitAddressResolved = true;
        return unitAddress;
    }

    @Nullable
    public BigInteger getUnitAddress() throws SemanticException {
        return getUnitAddress(graph.getDiagnostics());
    }

    /**
     * The text of the {@code label} property, not to be confused with DTS labels.
     */
    @Nullable
    public String getLabel() throws SemanticException {
        final Property label = node.getProperty("label");
        return label != null ? label.toText() : null;
    }

    public List<String> getAliases() {
        final List<String> result = new ArrayList<>();
        for (final Map.Entry<String, Node> entry : node.getTree().getAliases().entrySet()) {
            if (entry.getValue() == node) {
                result.add(entry.getKey());
            }
        }
        return result;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isReadOnly() {
        return node.hasProperty("read-only");
    }

    /**
     * The bus this device sits on, from its binding's {@code parent: bus:}.
     */
    @Nullable
    public String getBus() {
        return binding != null ? binding.getBus() : null;
    }

    public List<String> getCompats() {
        return compats;
    }

    @Nullable
    public String getMatchingCompat() {
        return matchingCompat;
    }

    @Nullable
    public Binding getBinding() {
        return binding;
    }

    /**
     * Per compatible string, the number of enabled devices with that compatible string
     * created before this one.
     */
    public Object2IntMap<String> getInstanceNumbers() {
        return Object2IntMaps.unmodifiable(instanceNumbers);
    }

    public Map<String, DeviceProperty> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    public List<Register> getRegisters() {
        return Collections.unmodifiableList(registers);
    }

    public List<Interrupt> getInterrupts() {
        return Collections.unmodifiableList(interrupts);
    }

    /**
     * GPIOs grouped by the prefix of the property they came from, so {@code cs-gpios} ends
     * up under {@code cs} and {@code gpios} under the empty string.
     */
    public Map<String, List<Gpio>> getGpios() {
        return Collections.unmodifiableMap(gpios);
    }

    public List<Clock> getClocks() {
        return Collections.unmodifiableList(clocks);
    }

    public List<Pwm> getPwms() {
        return Collections.unmodifiableList(pwms);
    }

    /**
     * For flash partitions, the flash controller: the grandparent, or the great-grandparent
     * if the grandparent is a {@code soc-nv-flash} node.
     */
    @Nullable
    public Device getFlashController() throws SemanticException {
        if (parent == null || parent.parent == null) {
            throw new SemanticException(String.format("flash partition %s lacks parent or grandparent node", getPath()));
        }

        final Device controller = parent.parent;
        if (controller.compats.contains("soc-nv-flash")) {
            return controller.parent;
        }
        return controller;
    }

    /**
     * For devices on an SPI bus, the chip select GPIO the controller uses for them, as
     * selected by the first register address. {@code null} if the controller does not use
     * GPIOs for chip select.
     */
    @Nullable
    public Gpio getSpiChipSelectGpio() throws SemanticException {
        if (parent == null || parent.binding == null || !"spi".equals(parent.binding.getChildBus())) {
            return null;
        }

        final List<Gpio> chipSelects = parent.gpios.get("cs");
        if (chipSelects == null) {
            return null;
        }

        if (registers.isEmpty()) {
            throw new SemanticException(String.format("%s needs a 'reg' property, to look up the chip select index for SPI", getPath()));
        }

        final BigInteger index = registers.get(0).address;
        if (index.compareTo(BigInteger.valueOf(chipSelects.size())) >= 0) {
            throw new SemanticException(String.format("index from 'regs' in %s (%s) is >= number of cs-gpios in %s (%d)",
                    getPath(), index, parent.getPath(), chipSelects.size()));
        }
        return chipSelects.get(index.intValue());
    }

    @Override
    public String toString() {
        return String.format("<Device %s in '%s', %s>", getPath(), node.getTree().getFileName(),
                binding != null ? "binding " + binding.getPath() : "no binding");
    }
}
