package com.vidnyan.pde.domain.scoring;

import com.vidnyan.pde.domain.heuristic.HeuristicEvaluator;
import com.vidnyan.pde.domain.heuristic.HeuristicOutcome;
import com.vidnyan.pde.domain.pattern.PatternDefinition;
import com.vidnyan.pde.domain.signature.Signature;
import com.vidnyan.pde.domain.signature.SignatureMatcher;
import com.vidnyan.pde.domain.tree.TreeNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines structural and heuristic evidence into one normalized confidence.
 *
 * Structural evidence weighs {@value #STRUCTURAL_WEIGHT} times the ratio of
 * matched signatures; each fired heuristic adds its weight. The sum is divided
 * by the maximum attainable mass, so a definition may rely on shape only, on
 * heuristics only, or on both. With no evidence at all the confidence is 0.
 */
public class ConfidenceScorer {

    public static final double STRUCTURAL_WEIGHT = 0.5;

    private final SignatureMatcher matcher;
    private final HeuristicEvaluator evaluator;
    private final boolean astMatchingEnabled;
    private final boolean heuristicsEnabled;

    public ConfidenceScorer(SignatureMatcher matcher, HeuristicEvaluator evaluator) {
        this(matcher, evaluator, true, true);
    }

    public ConfidenceScorer(SignatureMatcher matcher, HeuristicEvaluator evaluator,
                            boolean astMatchingEnabled, boolean heuristicsEnabled) {
        this.matcher = matcher;
        this.evaluator = evaluator;
        this.astMatchingEnabled = astMatchingEnabled;
        this.heuristicsEnabled = heuristicsEnabled;
    }

    public double score(TreeNode node, PatternDefinition definition) {
        return assess(node, definition).confidence();
    }

    /**
     * Score a node and keep the evidence behind the score.
     */
    public Assessment assess(TreeNode node, PatternDefinition definition) {
        double confidence = 0.0;
        double maxMass = 0.0;

        List<Signature> matched = new ArrayList<>();
        if (astMatchingEnabled && !definition.signatures().isEmpty()) {
            for (Signature signature : definition.signatures()) {
                if (matcher.matches(node, signature)) {
                    matched.add(signature);
                }
            }
            double ratio = (double) matched.size() / definition.signatures().size();
            confidence += STRUCTURAL_WEIGHT * ratio;
            maxMass += STRUCTURAL_WEIGHT;
        }

        List<HeuristicOutcome> outcomes = List.of();
        if (heuristicsEnabled && !definition.heuristics().isEmpty()) {
            outcomes = evaluator.evaluate(node, definition.heuristics());
            for (HeuristicOutcome outcome : outcomes) {
                maxMass += outcome.heuristic().weight();
                if (outcome.fired()) {
                    confidence += outcome.heuristic().weight();
                }
            }
        }

        if (maxMass <= 0.0) {
            return Assessment.UNDECIDABLE;
        }
        double normalized = Math.min(1.0, Math.max(0.0, confidence / maxMass));
        return new Assessment(normalized, matched, outcomes);
    }
}
