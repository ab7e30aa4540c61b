package com.vidnyan.pde.domain.heuristic;

import com.vidnyan.pde.domain.tree.TreeNode;

import java.util.function.Predicate;

/**
 * A named, weighted check over a node that tree shape alone cannot express.
 * The check must be free of side effects.
 *
 * @param description what the check looks for
 * @param weight      contribution when the check fires, in (0, 1]
 * @param check       predicate over the node
 */
public record Heuristic(
    String description,
    double weight,
    Predicate<TreeNode> check
) {

    public Heuristic {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Heuristic description is required");
        }
        if (!(weight > 0.0 && weight <= 1.0)) {
            throw new IllegalArgumentException(
                    "Heuristic weight must be in (0, 1], got " + weight + " for '" + description + "'");
        }
        if (check == null) {
            throw new IllegalArgumentException("Heuristic check is required for '" + description + "'");
        }
    }

    public static Heuristic of(String description, double weight, Predicate<TreeNode> check) {
        return new Heuristic(description, weight, check);
    }

    @Override
    public String toString() {
        return description + " (" + weight + ")";
    }
}
