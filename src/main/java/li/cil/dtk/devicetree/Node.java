package li.cil.dtk.devicetree;

import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;
import java.util.*;
import java.util.function.Consumer;

/**
 * A node in a {@link DeviceTree} ({@code name { ... };}).
 * <p>
 * Children and properties are kept in definition order. Reopening a node through a label
 * or path reference reuses the existing instance, so later definitions add to it.
 */
public final class Node {
    private final DeviceTree tree;
    private final String name;
    @Nullable private final Node parent;
    private final Map<String, Node> children = new LinkedHashMap<>();
    private final Map<String, Property> properties = new LinkedHashMap<>();
    private final List<String> labels = new ArrayList<>();

    boolean omitIfNoRef;
    boolean isReferenced;

    Node(final DeviceTree tree, final String name, @Nullable final Node parent) {
        this.tree = tree;
        this.name = name;
        this.parent = parent;
    }

    public DeviceTree getTree() {
        return tree;
    }

    public String getName() {
        return name;
    }

    /**
     * The part of the name after the {@code @}, or the empty string if there is none.
     */
    public String getUnitAddress() {
        return StringUtils.substringAfter(name, "@");
    }

    @Nullable
    public Node getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    public String getPath() {
        if (parent == null) {
            return "/";
        }

        final Deque<String> names = new ArrayDeque<>();
        for (Node node = this; node.parent != null; node = node.parent) {
            names.addFirst(node.name);
        }
        return "/" + String.join("/", names);
    }

    public List<String> getLabels() {
        return Collections.unmodifiableList(labels);
    }

    public Collection<Node> getChildren() {
        return Collections.unmodifiableCollection(children.values());
    }

    @Nullable
    public Node getChild(final String name) {
        return children.get(name);
    }

    public Collection<Property> getProperties() {
        return Collections.unmodifiableCollection(properties.values());
    }

    @Nullable
    public Property getProperty(final String name) {
        return properties.get(name);
    }

    public boolean hasProperty(final String name) {
        return properties.containsKey(name);
    }

    /**
     * Visits this node and all its descendants, parents before children.
     */
    public void visit(final Consumer<Node> visitor) {
        visitor.accept(this);
        for (final Node child : children.values()) {
            child.visit(visitor);
        }
    }

    // --------------------------------------------------------------------- //
    // Mutation, only legal while the owning tree is being parsed.

    public void addLabel(final String label) {
        tree.checkMutable();
        if (!labels.contains(label)) {
            labels.add(label);
        }
    }

    public void setOmitIfNoRef() {
        tree.checkMutable();
        omitIfNoRef = true;
    }

    /**
     * Returns the child with the given name, creating it if it does not exist yet.
     */
    public Node getOrCreateChild(final String name) {
        tree.checkMutable();
        return children.computeIfAbsent(name, n -> new Node(tree, n, this));
    }

    /**
     * Returns the property with the given name, creating an empty one if it does not exist yet.
     */
    public Property getOrCreateProperty(final String name) {
        tree.checkMutable();
        return properties.computeIfAbsent(name, n -> new Property(this, n));
    }

    public void removeProperty(final String name) {
        tree.checkMutable();
        properties.remove(name);
    }

    /**
     * Detaches this node, and with it all its descendants, from the tree.
     */
    public void remove() {
        tree.checkMutable();
        if (parent == null) {
            throw new IllegalStateException("The root node cannot be removed.");
        }
        parent.children.remove(name);
    }

    void detach() {
        if (parent != null) {
            parent.children.remove(name);
        }
    }

    Property createProperty(final String name) {
        return properties.computeIfAbsent(name, n -> new Property(this, n));
    }

    @Override
    public String toString() {
        return String.format("<Node %s in '%s'>", getPath(), tree.getFileName());
    }
}
