package com.vidnyan.pde.domain.pattern;

import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.signature.Signature;
import com.vidnyan.pde.domain.tree.Location;
import com.vidnyan.pde.domain.tree.TreeNode;

import java.util.List;

/**
 * A node whose confidence for a pattern cleared the pattern's threshold.
 * Immutable value object.
 *
 * @param patternName       matched pattern
 * @param node              matched node
 * @param confidence        normalized confidence in [0, 1]
 * @param matchedSignatures signatures the node satisfied
 * @param firedHeuristics   heuristics that fired
 * @param sourceFile        file the tree came from, null for in-memory trees
 */
public record PatternMatch(
    String patternName,
    TreeNode node,
    double confidence,
    List<Signature> matchedSignatures,
    List<Heuristic> firedHeuristics,
    String sourceFile
) {

    public PatternMatch {
        matchedSignatures = List.copyOf(matchedSignatures);
        firedHeuristics = List.copyOf(firedHeuristics);
    }

    public Location location() {
        return node.location();
    }

    public PatternMatch inFile(String file) {
        return new PatternMatch(patternName, node, confidence, matchedSignatures, firedHeuristics, file);
    }

    public String summary() {
        return String.format("%s at %s (%s) confidence %.2f",
                patternName, node.describe(), location().format(), confidence);
    }
}
