package com.vidnyan.pde.domain.transform;

import com.vidnyan.pde.domain.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Copy-and-rewrite over immutable trees. Nodes are located by identity; only
 * the path from the root to the replaced node is rebuilt.
 */
public final class TreeRewriter {

    private TreeRewriter() {
    }

    /**
     * Return a tree where {@code target} is replaced by {@code replacement}, or
     * {@code root} itself when {@code target} is not part of it.
     */
    public static TreeNode replace(TreeNode root, TreeNode target, TreeNode replacement) {
        if (root == target) {
            return replacement;
        }
        List<TreeNode> children = root.children();
        for (int i = 0; i < children.size(); i++) {
            TreeNode child = children.get(i);
            TreeNode rewritten = replace(child, target, replacement);
            if (rewritten != child) {
                List<TreeNode> copy = new ArrayList<>(children);
                copy.set(i, rewritten);
                return root.withChildren(copy);
            }
        }
        return root;
    }
}
