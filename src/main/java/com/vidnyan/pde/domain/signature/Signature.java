package com.vidnyan.pde.domain.signature;

import com.vidnyan.pde.domain.tree.NodeKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Declarative description of a tree shape.
 * Immutable value object; a signature without children is a leaf constraint
 * on kind, name and properties only.
 *
 * @param kind               required node kind
 * @param namePattern        regular expression searched in the node name, null for any name
 * @param requiredProperties property name to required textual value
 * @param children           child signatures, matched order-independently
 * @param optional           whether an absent node satisfies this signature
 * @param typePattern        compiled form of the {@code type} property, null when none is required
 */
public record Signature(
    NodeKind kind,
    Pattern namePattern,
    Map<String, String> requiredProperties,
    List<Signature> children,
    boolean optional,
    Pattern typePattern
) {

    public static final String TYPE_PROPERTY = "type";

    /**
     * @throws IllegalArgumentException if the kind is missing or the {@code type} property
     *                                  is not a valid regular expression
     */
    public Signature {
        if (kind == null) {
            throw new IllegalArgumentException("Signature kind is required");
        }
        requiredProperties = requiredProperties == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(requiredProperties));
        children = children == null ? List.of() : List.copyOf(children);
        String typeRegex = requiredProperties.get(TYPE_PROPERTY);
        if (typePattern == null && typeRegex != null) {
            typePattern = compileType(typeRegex);
        }
    }

    public Signature(NodeKind kind, Pattern namePattern, Map<String, String> requiredProperties,
                     List<Signature> children, boolean optional) {
        this(kind, namePattern, requiredProperties, children, optional, null);
    }

    private static Pattern compileType(String regex) {
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("Invalid type pattern '" + regex + "': " + e.getDescription(), e);
        }
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Human readable form used in logs and reports.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name());
        if (namePattern != null) {
            sb.append("~/").append(namePattern.pattern()).append('/');
        }
        if (!requiredProperties.isEmpty()) {
            sb.append(requiredProperties);
        }
        if (optional) {
            sb.append('?');
        }
        if (!children.isEmpty()) {
            sb.append(" {");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(children.get(i).describe());
            }
            sb.append('}');
        }
        return sb.toString();
    }

    public static Builder of(NodeKind kind) {
        return new Builder(kind);
    }

    public static class Builder {
        private final NodeKind kind;
        private Pattern namePattern;
        private final Map<String, String> requiredProperties = new LinkedHashMap<>();
        private final List<Signature> children = new ArrayList<>();
        private boolean optional;

        public Builder(NodeKind kind) { this.kind = kind; }

        public Builder named(String regex) {
            this.namePattern = regex == null ? null : Pattern.compile(regex);
            return this;
        }

        public Builder property(String name, String value) {
            this.requiredProperties.put(name, value);
            return this;
        }

        public Builder optional() { this.optional = true; return this; }
        public Builder optional(boolean value) { this.optional = value; return this; }

        public Builder child(Signature child) { this.children.add(child); return this; }

        public Builder child(Builder child) { return child(child.build()); }

        public Builder children(Signature... more) {
            for (Signature child : more) {
                this.children.add(child);
            }
            return this;
        }

        public Signature build() {
            return new Signature(kind, namePattern, requiredProperties, children, optional);
        }
    }
}
