package com.vidnyan.pde.domain.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A node of a parsed program tree.
 * Immutable value object: adapters build it once, the engine only reads it and
 * produces new trees when rewriting.
 *
 * @param kind       node kind tag
 * @param name       textual name, null when the node has none
 * @param typeText   declared type as source text, null when absent
 * @param visibility declared visibility, null when the language or node has none
 * @param properties extra attributes supplied by the parser (modifiers, call scope, ...)
 * @param children   ordered children
 * @param location   source location
 */
public record TreeNode(
    NodeKind kind,
    String name,
    String typeText,
    Visibility visibility,
    Map<String, String> properties,
    List<TreeNode> children,
    Location location
) {

    public TreeNode {
        if (kind == null) {
            throw new IllegalArgumentException("Node kind is required");
        }
        properties = properties == null ? Map.of() : Map.copyOf(properties);
        children = children == null ? List.of() : List.copyOf(children);
        location = location == null ? Location.UNKNOWN : location;
    }

    /**
     * Leaf node with only a kind and a name.
     */
    public static TreeNode leaf(NodeKind kind, String name) {
        return builder(kind).name(name).build();
    }

    public Optional<String> property(String key) {
        return Optional.ofNullable(properties.get(key));
    }

    public boolean flag(String key) {
        return Boolean.parseBoolean(properties.get(key));
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Direct children of the given kind.
     */
    public List<TreeNode> childrenOfKind(NodeKind childKind) {
        return children.stream()
                .filter(c -> c.kind() == childKind)
                .toList();
    }

    /**
     * First direct child of the given kind.
     */
    public Optional<TreeNode> firstChild(NodeKind childKind) {
        return children.stream()
                .filter(c -> c.kind() == childKind)
                .findFirst();
    }

    /**
     * All nodes of this subtree in pre-order (this node first).
     */
    public List<TreeNode> preOrder() {
        List<TreeNode> nodes = new ArrayList<>();
        walk(nodes::add);
        return nodes;
    }

    /**
     * Visit this subtree in pre-order.
     */
    public void walk(Consumer<TreeNode> visitor) {
        visitor.accept(this);
        for (TreeNode child : children) {
            child.walk(visitor);
        }
    }

    public int size() {
        int count = 1;
        for (TreeNode child : children) {
            count += child.size();
        }
        return count;
    }

    public TreeNode withChildren(List<TreeNode> newChildren) {
        return new TreeNode(kind, name, typeText, visibility, properties, newChildren, location);
    }

    public Builder toBuilder() {
        return new Builder(kind)
                .name(name)
                .typeText(typeText)
                .visibility(visibility)
                .properties(properties)
                .children(children)
                .location(location);
    }

    /**
     * Short description used in logs and reports.
     */
    public String describe() {
        return name == null ? kind.name() : kind.name() + " " + name;
    }

    public static Builder builder(NodeKind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final NodeKind kind;
        private String name;
        private String typeText;
        private Visibility visibility;
        private final Map<String, String> properties = new LinkedHashMap<>();
        private final List<TreeNode> children = new ArrayList<>();
        private Location location = Location.UNKNOWN;

        public Builder(NodeKind kind) { this.kind = kind; }

        public Builder name(String name) { this.name = name; return this; }
        public Builder typeText(String typeText) { this.typeText = typeText; return this; }
        public Builder visibility(Visibility visibility) { this.visibility = visibility; return this; }
        public Builder property(String key, String value) { this.properties.put(key, value); return this; }
        public Builder flag(String key) { return property(key, "true"); }
        public Builder location(Location location) { this.location = location; return this; }

        public Builder properties(Map<String, String> props) {
            this.properties.clear();
            this.properties.putAll(props);
            return this;
        }

        public Builder child(TreeNode child) { this.children.add(child); return this; }

        public Builder child(Builder child) { return child(child.build()); }

        public Builder children(List<TreeNode> nodes) {
            this.children.clear();
            this.children.addAll(nodes);
            return this;
        }

        public TreeNode build() {
            return new TreeNode(kind, name, typeText, visibility, properties, children, location);
        }
    }
}
