package com.vidnyan.pde.domain.scoring;

import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.heuristic.HeuristicOutcome;
import com.vidnyan.pde.domain.signature.Signature;

import java.util.List;

/**
 * Evidence gathered for one (definition, node) pair and the confidence it yields.
 *
 * @param confidence        normalized confidence in [0, 1]
 * @param matchedSignatures signatures the node satisfied
 * @param outcomes          outcome of every heuristic that was run
 */
public record Assessment(
    double confidence,
    List<Signature> matchedSignatures,
    List<HeuristicOutcome> outcomes
) {

    public static final Assessment UNDECIDABLE = new Assessment(0.0, List.of(), List.of());

    public Assessment {
        matchedSignatures = List.copyOf(matchedSignatures);
        outcomes = List.copyOf(outcomes);
    }

    public List<Heuristic> firedHeuristics() {
        return outcomes.stream()
                .filter(outcome -> outcome.fired())
                .map(HeuristicOutcome::heuristic)
                .toList();
    }

    public boolean clears(double threshold) {
        return confidence >= threshold;
    }
}
