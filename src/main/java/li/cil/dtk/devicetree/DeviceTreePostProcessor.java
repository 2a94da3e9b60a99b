package li.cil.dtk.devicetree;

import it.unimi.dsi.fastutil.bytes.ByteArrayList;
import li.cil.dtk.exception.SemanticException;
import li.cil.dtk.utils.ByteArrayUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns a freshly parsed {@link DeviceTree} into its final form.
 * <p>
 * The passes run in a fixed order: explicit phandles are registered, references inside
 * property values are patched in, aliases are registered, unreferenced
 * {@code /omit-if-no-ref/} nodes are dropped and finally labels are indexed and checked
 * for uniqueness. Afterwards the tree is marked read-only.
 */
public final class DeviceTreePostProcessor {
    private static final Logger LOGGER = LogManager.getLogger();

    private static final String PHANDLE_PROPERTY = "phandle";
    private static final String ALIASES_NODE = "aliases";
    private static final Pattern ALIAS_NAME_PATTERN = Pattern.compile("[0-9a-z-]+");
    private static final byte[] PHANDLE_PLACEHOLDER = new byte[Values.CELL_SIZE];

    private final DeviceTree tree;
    private final Map<Property, List<Marker>> valueLabels = new IdentityHashMap<>();

    private DeviceTreePostProcessor(final DeviceTree tree) {
        this.tree = tree;
    }

    public static void process(final DeviceTree tree) throws SemanticException {
        if (tree.isFinished()) {
            throw new IllegalStateException("Device tree has already been finished.");
        }

        final DeviceTreePostProcessor processor = new DeviceTreePostProcessor(tree);
        processor.registerPhandles();
        processor.fixupProperties();
        processor.registerAliases();
        processor.removeUnreferenced();
        processor.registerLabels();

        tree.markFinished();

        LOGGER.debug("Finished device tree [{}] with [{}] phandle(s).", tree.getFileName(), tree.phandleToNode.size());
    }

    // --------------------------------------------------------------------- //

    private void registerPhandles() throws SemanticException {
        tree.phandleToNode.clear();
        for (final Node node : tree.nodes()) {
            final Property phandle = node.getProperty(PHANDLE_PROPERTY);
            if (phandle == null) {
                continue;
            }

            if (phandle.length() != Values.CELL_SIZE) {
                throw new SemanticException(String.format("%s: bad phandle length (%d), expected 4 bytes",
                        node.getPath(), phandle.length()));
            }

            boolean isSelfReferential = false;
            for (final Marker marker : phandle.getMarkers()) {
                if (marker.type != Marker.Type.PHANDLE) {
                    continue;
                }

                // Setting a node's phandle to itself forces allocation of a new phandle.
                if (tree.resolveReference(marker.reference) != node) {
                    throw new SemanticException(String.format("%s: %s refers to another node",
                            node.getPath(), phandle.getName()));
                }
                isSelfReferential = true;
                break;
            }

            if (isSelfReferential) {
                continue;
            }

            final long value = Values.toCell(phandle.getValue());
            if (value == 0 || value == 0xFFFFFFFFL) {
                throw new SemanticException(String.format("%s: bad value 0x%08x for %s",
                        node.getPath(), value, phandle.getName()));
            }

            final Node existing = tree.phandleToNode.get((int) value);
            if (existing != null) {
                throw new SemanticException(String.format("%s: duplicated phandle 0x%x (seen before at %s)",
                        node.getPath(), value, existing.getPath()));
            }
            tree.phandleToNode.put((int) value, node);
        }
    }

    private void fixupProperties() throws SemanticException {
        for (final Node node : tree.nodes()) {
            // Copy, resolving a phandle may add a phandle property to this very node.
            for (final Property property : new ArrayList<>(node.getProperties())) {
                fixupProperty(property);
            }
        }
    }

    private void fixupProperty(final Property property) throws SemanticException {
        final byte[] value = property.getValue();
        final ByteArrayList result = new ByteArrayList(value.length);
        final List<Marker> labelMarkers = new ArrayList<>();

        int previous = 0;
        for (final Marker marker : property.getMarkers()) {
            int position = marker.offset;
            result.addElements(result.size(), value, previous, position - previous);

            if (marker.type == Marker.Type.LABEL) {
                final Marker label = new Marker(result.size(), marker.reference, Marker.Type.LABEL);
                if (!labelMarkers.contains(label)) {
                    labelMarkers.add(label);
                }
            } else {
                final Node target;
                try {
                    target = tree.resolveReference(marker.reference);
                } catch (final SemanticException e) {
                    throw new SemanticException(String.format("%s: %s", property.getNode().getPath(), e.getMessage()), e);
                }

                target.isReferenced = true;

                if (marker.type == Marker.Type.PATH) {
                    final byte[] path = target.getPath().getBytes(StandardCharsets.UTF_8);
                    result.addElements(result.size(), path);
                    result.add((byte) 0);
                } else {
                    final byte[] phandle = getOrAllocatePhandle(target);
                    result.addElements(result.size(), phandle);
                    position += Values.CELL_SIZE;
                }
            }

            previous = position;
        }

        result.addElements(result.size(), value, previous, value.length - previous);

        property.setResolvedValue(result.toByteArray(), labelMarkers);
        if (!labelMarkers.isEmpty()) {
            valueLabels.put(property, labelMarkers);
        }
    }

    /**
     * Returns the phandle of a node, allocating the smallest free one if the node does not
     * have one yet or only holds a self-reference placeholder.
     */
    private byte[] getOrAllocatePhandle(final Node node) {
        Property phandle = node.getProperty(PHANDLE_PROPERTY);
        if (phandle != null && !Arrays.equals(phandle.getValue(), PHANDLE_PLACEHOLDER)) {
            return phandle.getValue();
        }

        int value = 1;
        while (tree.phandleToNode.containsKey(value)) {
            value++;
        }
        tree.phandleToNode.put(value, node);

        if (phandle == null) {
            phandle = node.createProperty(PHANDLE_PROPERTY);
        }

        final byte[] data = ByteArrayUtils.toBigEndian(BigInteger.valueOf(value), Values.CELL_SIZE);
        phandle.setRawValue(data);
        return data;
    }

    private void registerAliases() throws SemanticException {
        tree.aliases.clear();

        final Node aliases = tree.getRoot().getChild(ALIASES_NODE);
        if (aliases == null) {
            return;
        }

        // Collected separately so alias paths cannot resolve through other aliases.
        final Map<String, Node> result = new LinkedHashMap<>();
        for (final Property property : aliases.getProperties()) {
            if (!ALIAS_NAME_PATTERN.matcher(property.getName()).matches()) {
                throw new SemanticException(String.format("/aliases: alias property name '%s' should include only characters from [0-9a-z-]",
                        property.getName()));
            }

            final String path = property.toText();
            try {
                result.put(property.getName(), tree.getNode(path));
            } catch (final SemanticException e) {
                throw new SemanticException(String.format("/aliases: bad path for '%s': %s", property.getName(), e.getMessage()), e);
            }
        }

        tree.aliases.putAll(result);
    }

    private void removeUnreferenced() {
        for (final Node node : tree.nodes()) {
            if (node.omitIfNoRef && !node.isReferenced) {
                LOGGER.debug("Dropping unreferenced node [{}].", node.getPath());
                node.detach();
            }
        }
    }

    private void registerLabels() throws SemanticException {
        final Map<String, List<Object>> labelToThings = new LinkedHashMap<>();

        tree.labelToNode.clear();
        tree.labelToProperty.clear();
        tree.labelToPropertyOffset.clear();

        for (final Node node : tree.nodes()) {
            for (final String label : node.getLabels()) {
                addThing(labelToThings, label, node);
                tree.labelToNode.put(label, node);
            }

            for (final Property property : node.getProperties()) {
                for (final String label : property.getLabels()) {
                    addThing(labelToThings, label, property);
                    tree.labelToProperty.put(label, property);
                }

                for (final Marker label : valueLabels.getOrDefault(property, Collections.emptyList())) {
                    final PropertyOffset offset = new PropertyOffset(property, label.offset);
                    addThing(labelToThings, label.reference, offset);
                    tree.labelToPropertyOffset.put(label.reference, offset);
                }
            }
        }

        for (final Map.Entry<String, List<Object>> entry : labelToThings.entrySet()) {
            final List<Object> things = entry.getValue();
            if (things.size() <= 1) {
                continue;
            }

            final List<String> descriptions = new ArrayList<>();
            for (final Object thing : things) {
                if (thing instanceof Node) {
                    descriptions.add("on " + ((Node) thing).getPath());
                } else if (thing instanceof Property) {
                    final Property property = (Property) thing;
                    descriptions.add(String.format("on property '%s' of node %s", property.getName(), property.getNode().getPath()));
                } else {
                    final Property property = ((PropertyOffset) thing).property;
                    descriptions.add(String.format("in the value of property '%s' of node %s", property.getName(), property.getNode().getPath()));
                }
            }
            Collections.sort(descriptions);

            throw new SemanticException(String.format("Label '%s' appears %s", entry.getKey(), String.join(" and ", descriptions)));
        }
    }

    private static void addThing(final Map<String, List<Object>> labelToThings, final String label, final Object thing) {
        final List<Object> things = labelToThings.computeIfAbsent(label, l -> new ArrayList<>());
        if (!things.contains(thing)) {
            things.add(thing);
        }
    }
}
