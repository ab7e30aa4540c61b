package com.vidnyan.pde.domain.signature;

import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a node satisfies a {@link Signature}.
 *
 * Matching is all-or-nothing: kind, name pattern and properties fail fast, and a
 * non-leaf signature holds only when every required child signature is found.
 * Partial credit is the scorer's job.
 *
 * Child search looks at direct children first. When nothing qualifies it
 * descends one extra level through transparent nodes: all grandchildren when the
 * parent itself is of a transparent kind, otherwise the children of direct
 * children that are of a transparent kind. The first matching node wins; there
 * is no backtracking across siblings.
 *
 * Stateless apart from its configuration, safe to share between threads.
 */
@Slf4j
public class SignatureMatcher {

    public static final Set<NodeKind> DEFAULT_TRANSPARENT_KINDS = EnumSet.of(NodeKind.BLOCK);

    private final Set<NodeKind> transparentKinds;
    private final Map<String, PropertyExtractor> extractors;

    public SignatureMatcher() {
        this(DEFAULT_TRANSPARENT_KINDS, Map.of());
    }

    public SignatureMatcher(Set<NodeKind> transparentKinds) {
        this(transparentKinds, Map.of());
    }

    /**
     * @param transparentKinds kinds the child search may descend through
     * @param extraExtractors  additional property extractors; override built-ins of the same name
     */
    public SignatureMatcher(Set<NodeKind> transparentKinds, Map<String, PropertyExtractor> extraExtractors) {
        this.transparentKinds = transparentKinds.isEmpty()
                ? EnumSet.noneOf(NodeKind.class)
                : EnumSet.copyOf(transparentKinds);
        Map<String, PropertyExtractor> all = new LinkedHashMap<>(PropertyExtractors.builtIns());
        all.putAll(extraExtractors);
        this.extractors = Map.copyOf(all);
    }

    public Set<NodeKind> transparentKinds() {
        return Collections.unmodifiableSet(transparentKinds);
    }

    /**
     * Check if node matches the signature.
     *
     * @param node      node under test, may be null for an absent child
     * @param signature signature to satisfy
     */
    public boolean matches(TreeNode node, Signature signature) {
        if (node == null) {
            return signature.optional();
        }
        if (node.kind() != signature.kind()) {
            return false;
        }
        if (signature.namePattern() != null) {
            // Fails closed on nodes without a name
            if (!node.kind().isNameBearing() || node.name() == null) {
                return false;
            }
            if (!signature.namePattern().matcher(node.name()).find()) {
                return false;
            }
        }
        for (Map.Entry<String, String> property : signature.requiredProperties().entrySet()) {
            if (!propertyHolds(node, signature, property.getKey(), property.getValue())) {
                return false;
            }
        }
        if (signature.isLeaf()) {
            return true;
        }
        for (Signature childSignature : signature.children()) {
            if (!childSatisfied(node, childSignature)) {
                return false;
            }
        }
        return true;
    }

    private boolean childSatisfied(TreeNode parent, Signature childSignature) {
        for (TreeNode child : parent.children()) {
            if (matches(child, childSignature)) {
                return true;
            }
        }
        boolean parentTransparent = transparentKinds.contains(parent.kind());
        for (TreeNode child : parent.children()) {
            if (!parentTransparent && !transparentKinds.contains(child.kind())) {
                continue;
            }
            for (TreeNode grandchild : child.children()) {
                if (matches(grandchild, childSignature)) {
                    return true;
                }
            }
        }
        return childSignature.optional();
    }

    private boolean propertyHolds(TreeNode node, Signature signature, String name, String value) {
        PropertyExtractor extractor = extractors.get(name);
        if (extractor == null) {
            if (!node.properties().containsKey(name)) {
                log.debug("Property '{}' not supplied for {}, comparing as absent", name, node.describe());
            }
            extractor = PropertyExtractors.generic(name);
        }
        return extractor.satisfies(node, value, signature);
    }
}
