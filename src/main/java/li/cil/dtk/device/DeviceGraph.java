package li.cil.dtk.device;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import li.cil.dtk.api.Diagnostics;
import li.cil.dtk.binding.BindingResolver;
import li.cil.dtk.devicetree.DeviceTree;
import li.cil.dtk.devicetree.Node;
import li.cil.dtk.devicetree.Property;
import li.cil.dtk.exception.SemanticException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.Nullable;
import java.util.*;

/**
 * The devices of a finished {@link DeviceTree}, one per node, in tree order.
 */
public final class DeviceGraph {
    private static final Logger LOGGER = LogManager.getLogger();

    private final DeviceTree tree;
    private final Diagnostics diagnostics;
    private final Map<Node, Device> devices = new LinkedHashMap<>();

    private DeviceGraph(final DeviceTree tree, final Diagnostics diagnostics) {
        this.tree = tree;
        this.diagnostics = diagnostics;
    }

    /**
     * Builds the device graph for a tree.
     *
     * @param tree        the tree, which must have been post-processed.
     * @param bindings    the bindings to interpret nodes with.
     * @param diagnostics receives non-fatal findings.
     * @throws SemanticException if the tree is inconsistent with itself or its bindings.
     */
    public static DeviceGraph build(final DeviceTree tree, final BindingResolver bindings, final Diagnostics diagnostics) throws SemanticException {
        if (!tree.isFinished()) {
            throw new IllegalArgumentException("device tree has not been post-processed");
        }

        final DeviceGraph graph = new DeviceGraph(tree, diagnostics);

        // Bindings of children depend on the bindings of their parents, and nodes() lists
        // parents first.
        final Object2IntMap<String> enabledCounts = new Object2IntOpenHashMap<>();
        for (final Node node : tree.nodes()) {
            final Device parent = node.getParent() != null ? graph.devices.get(node.getParent()) : null;
            final Device device = new Device(graph, node, parent);
            device.initBinding(bindings);

            for (final String compat : device.getCompats()) {
                final int count = enabledCounts.getInt(compat);
                device.setInstanceNumber(compat, count);
                if (device.isEnabled()) {
                    enabledCounts.put(compat, count + 1);
                }
            }

            graph.devices.put(node, device);
        }

        for (final Device device : graph.devices.values()) {
            device.resolve(diagnostics);
        }

        LOGGER.debug("Built device graph for [{}] with [{}] device(s).", tree.getFileName(), graph.devices.size());

        return graph;
    }

    public static DeviceGraph build(final DeviceTree tree, final BindingResolver bindings) throws SemanticException {
        return build(tree, bindings, Diagnostics.LOGGER);
    }

    public DeviceTree getTree() {
        return tree;
    }

    Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public List<Device> getDevices() {
        return new ArrayList<>(devices.values());
    }

    public Device getDevice(final Node node) {
        final Device device = devices.get(node);
        if (device == null) {
            throw new IllegalArgumentException(String.format("%s is not part of this device graph", node));
        }
        return device;
    }

    /**
     * Looks up a device by absolute path or alias-relative path.
     */
    public Device getDevice(final String path) throws SemanticException {
        return getDevice(tree.getNode(path));
    }

    /**
     * Follows a property of {@code /chosen} that holds a node path, e.g. {@code zephyr,console}.
     *
     * @return the device, or {@code null} if there is no {@code /chosen} node or no such property.
     */
    @Nullable
    public Device getChosenDevice(final String propertyName) throws SemanticException {
        if (!tree.hasNode("/chosen")) {
            return null;
        }

        final Property property = tree.getNode("/chosen").getProperty(propertyName);
        if (property == null) {
            return null;
        }

        final String path = property.toText();
        if (!tree.hasNode(path)) {
            throw new SemanticException(String.format("%s points to %s, which does not exist", property, path));
        }
        return getDevice(path);
    }
}
