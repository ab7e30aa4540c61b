package com.vidnyan.pde.domain.transform;

import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.exception.TemplateNotFoundException;

/**
 * Result of applying a template.
 *
 * @param status       outcome
 * @param tree         rewritten tree, or the original node when nothing was applied
 * @param templateName requested template
 */
public record TransformResult(
    Status status,
    TreeNode tree,
    String templateName
) {

    public enum Status {
        APPLIED,
        TEMPLATE_NOT_FOUND
    }

    public static TransformResult applied(TreeNode tree, String templateName) {
        return new TransformResult(Status.APPLIED, tree, templateName);
    }

    public static TransformResult templateNotFound(TreeNode original, String templateName) {
        return new TransformResult(Status.TEMPLATE_NOT_FOUND, original, templateName);
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }

    /**
     * Rewritten tree, or an exception for callers that treat a missing template as fatal.
     */
    public TreeNode orElseThrow() {
        if (status == Status.TEMPLATE_NOT_FOUND) {
            throw new TemplateNotFoundException(templateName);
        }
        return tree;
    }
}
