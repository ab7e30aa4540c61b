package com.vidnyan.pde.domain.heuristic;

/**
 * Result of running one heuristic against one node.
 *
 * @param heuristic the heuristic
 * @param fired     whether it fired
 * @param failure   failure message when the check threw, null otherwise
 */
public record HeuristicOutcome(
    Heuristic heuristic,
    boolean fired,
    String failure
) {

    public static HeuristicOutcome fired(Heuristic heuristic) {
        return new HeuristicOutcome(heuristic, true, null);
    }

    public static HeuristicOutcome notFired(Heuristic heuristic) {
        return new HeuristicOutcome(heuristic, false, null);
    }

    public static HeuristicOutcome failed(Heuristic heuristic, String message) {
        return new HeuristicOutcome(heuristic, false, message);
    }

    public boolean failed() {
        return failure != null;
    }
}
