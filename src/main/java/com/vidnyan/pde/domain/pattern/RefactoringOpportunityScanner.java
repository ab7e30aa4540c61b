package com.vidnyan.pde.domain.pattern;

import com.vidnyan.pde.domain.heuristic.Heuristics;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;

/**
 * Flags procedures whose body directly dispatches on a condition (if/switch).
 * Such procedures are candidates for a Factory or Strategy refactoring; this is
 * a separate counter, independent of any registered pattern.
 */
public class RefactoringOpportunityScanner {

    /**
     * Count candidate procedures anywhere in the tree.
     */
    public int countCandidates(TreeNode tree) {
        int[] count = {0};
        tree.walk(node -> {
            if (isCandidate(node)) {
                count[0]++;
            }
        });
        return count[0];
    }

    public boolean isCandidate(TreeNode node) {
        if (node.kind() != NodeKind.PROCEDURE) {
            return false;
        }
        return Heuristics.body(node)
                .map(body -> body.children().stream().anyMatch(s -> s.kind().isConditionalDispatch()))
                .orElse(false);
    }
}
