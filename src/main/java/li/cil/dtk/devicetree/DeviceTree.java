package li.cil.dtk.devicetree;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import li.cil.dtk.exception.SemanticException;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.*;

/**
 * A device tree parsed from one source file and everything it includes.
 * <p>
 * Trees are populated by the parser and then finished by {@link DeviceTreePostProcessor},
 * which resolves references and builds the label, alias and phandle indexes. Finished
 * trees are read-only. Instances are independent of each other, there is no shared state.
 */
public final class DeviceTree {
    private final String fileName;
    private final List<MemoryReservation> memoryReservations = new ArrayList<>();
    @Nullable private Node root;
    private boolean isFinished;

    final Map<String, Node> aliases = new LinkedHashMap<>();
    final Map<String, Node> labelToNode = new HashMap<>();
    final Map<String, Property> labelToProperty = new HashMap<>();
    final Map<String, PropertyOffset> labelToPropertyOffset = new HashMap<>();
    final Int2ObjectMap<Node> phandleToNode = new Int2ObjectOpenHashMap<>();

    public DeviceTree(final String fileName) {
        this.fileName = fileName;
    }

    /**
     * The name of the top-level source file.
     */
    public String getFileName() {
        return fileName;
    }

    public Node getRoot() {
        if (root == null) {
            throw new IllegalStateException("No root node defined.");
        }
        return root;
    }

    public boolean hasRoot() {
        return root != null;
    }

    public List<MemoryReservation> getMemoryReservations() {
        return Collections.unmodifiableList(memoryReservations);
    }

    public Map<String, Node> getAliases() {
        return Collections.unmodifiableMap(aliases);
    }

    @Nullable
    public Node getNodeByLabel(final String label) {
        return labelToNode.get(label);
    }

    @Nullable
    public Property getPropertyByLabel(final String label) {
        return labelToProperty.get(label);
    }

    @Nullable
    public PropertyOffset getPropertyOffsetByLabel(final String label) {
        return labelToPropertyOffset.get(label);
    }

    @Nullable
    public Node getNodeByPhandle(final int phandle) {
        return phandleToNode.get(phandle);
    }

    public Int2ObjectMap<Node> getPhandles() {
        return Int2ObjectMaps.unmodifiable(phandleToNode);
    }

    public boolean isFinished() {
        return isFinished;
    }

    /**
     * All nodes, parents before children, children in definition order.
     */
    public List<Node> nodes() {
        final List<Node> result = new ArrayList<>();
        if (root != null) {
            root.visit(result::add);
        }
        return result;
    }

    /**
     * Looks up a node by absolute path ({@code /foo/bar}) or alias-relative path
     * ({@code alias/bar}). Repeated and trailing slashes are ignored.
     */
    public Node getNode(final String path) throws SemanticException {
        Node current;
        int componentIndex;
        final String rest;
        if (path.startsWith("/")) {
            current = getRoot();
            componentIndex = 0;
            rest = path;
        } else {
            final String alias = StringUtils.substringBefore(path, "/");
            rest = StringUtils.substringAfter(path, "/");
            current = aliases.get(alias);
            if (current == null) {
                if (!isFinished) {
                    throw new SemanticException("node path does not start with '/'");
                }
                throw new SemanticException(String.format("no alias '%s' found -- did you forget the leading '/' in the node path?", alias));
            }
            componentIndex = 1;
        }

        for (final String component : rest.split("/")) {
            if (component.isEmpty()) {
                continue;
            }

            componentIndex++;

            final Node child = current.getChild(component);
            if (child == null) {
                throw new SemanticException(String.format("component %d ('%s') in path '%s' does not exist",
                        componentIndex, component, path));
            }
            current = child;
        }

        return current;
    }

    public boolean hasNode(final String path) {
        try {
            getNode(path);
            return true;
        } catch (final SemanticException e) {
            return false;
        }
    }

    /**
     * Resolves a reference as written after {@code &}: either a label, or a path wrapped in
     * braces ({@code {/foo/bar}}). Labels are looked up in the live tree, so labels of deleted
     * nodes no longer resolve.
     */
    public Node resolveReference(final String reference) throws SemanticException {
        if (reference.startsWith("{")) {
            return getNode(reference.substring(1, reference.length() - 1));
        }

        for (final Node node : nodes()) {
            if (node.getLabels().contains(reference)) {
                return node;
            }
        }

        throw new SemanticException(String.format("undefined node label '%s'", reference));
    }

    // --------------------------------------------------------------------- //
    // Mutation, only legal while parsing.

    public Node getOrCreateRoot() {
        checkMutable();
        if (root == null) {
            root = new Node(this, "/", null);
        }
        return root;
    }

    public void addMemoryReservation(final MemoryReservation reservation) {
        checkMutable();
        memoryReservations.add(reservation);
    }

    void checkMutable() {
        if (isFinished) {
            throw new IllegalStateException("Device tree has already been finished and is read-only.");
        }
    }

    void markFinished() {
        isFinished = true;
    }

    @Override
    public String toString() {
        return String.format("DeviceTree(fileName='%s')", fileName);
    }
}
