package com.vidnyan.pde.domain.transform;

import com.vidnyan.pde.domain.tree.TreeNode;

/**
 * A prebuilt tree with placeholder slots used to rewrite a matched node.
 *
 * @param name        template name, usually the pattern name
 * @param description what the rewrite produces
 * @param root        template tree
 */
public record PatternTemplate(
    String name,
    String description,
    TreeNode root
) {

    public PatternTemplate {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Template name is required");
        }
        if (root == null) {
            throw new IllegalArgumentException("Template tree is required for " + name);
        }
        description = description == null ? "" : description;
    }
}
