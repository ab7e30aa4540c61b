package com.vidnyan.pde.domain.signature;

import com.vidnyan.pde.domain.tree.TreeNode;

/**
 * Checks one declared signature property against a node.
 * Registered per property name in {@link SignatureMatcher}; this is the
 * extension point for property names the built-in set does not know.
 */
@FunctionalInterface
public interface PropertyExtractor {

    /**
     * @param node          node under test, never null
     * @param requiredValue value declared by the signature
     * @return true when the node satisfies the property
     */
    boolean satisfies(TreeNode node, String requiredValue);

    /**
     * Variant with access to the declaring signature, for extractors that reuse
     * state compiled when the signature was built.
     */
    default boolean satisfies(TreeNode node, String requiredValue, Signature signature) {
        return satisfies(node, requiredValue);
    }
}
