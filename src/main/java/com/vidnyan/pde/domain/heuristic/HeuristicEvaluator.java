package com.vidnyan.pde.domain.heuristic;

import com.vidnyan.pde.domain.tree.TreeNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs heuristics against a node.
 * A heuristic that throws counts as not fired; the failure is logged and handed
 * to the failure handler, never propagated.
 */
@Slf4j
public class HeuristicEvaluator {

    /**
     * Receives heuristic failures, e.g. for metrics.
     */
    @FunctionalInterface
    public interface FailureHandler {
        void onFailure(Heuristic heuristic, TreeNode node, RuntimeException error);
    }

    private final FailureHandler failureHandler;

    public HeuristicEvaluator() {
        this((heuristic, node, error) -> { });
    }

    public HeuristicEvaluator(FailureHandler failureHandler) {
        this.failureHandler = failureHandler;
    }

    public List<HeuristicOutcome> evaluate(TreeNode node, List<Heuristic> heuristics) {
        List<HeuristicOutcome> outcomes = new ArrayList<>(heuristics.size());
        for (Heuristic heuristic : heuristics) {
            outcomes.add(evaluate(node, heuristic));
        }
        return outcomes;
    }

    public HeuristicOutcome evaluate(TreeNode node, Heuristic heuristic) {
        try {
            return heuristic.check().test(node)
                    ? HeuristicOutcome.fired(heuristic)
                    : HeuristicOutcome.notFired(heuristic);
        } catch (RuntimeException e) {
            log.warn("Heuristic '{}' failed on {}: {}", heuristic.description(), node.describe(), e.toString());
            failureHandler.onFailure(heuristic, node, e);
            return HeuristicOutcome.failed(heuristic, e.toString());
        }
    }
}
