package com.vidnyan.pde.application.port.out;

import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.report.FileDetectionResult;
import com.vidnyan.pde.domain.tree.TreeNode;

import java.nio.file.Path;

/**
 * Observability hook for detection and transformation.
 * Implementations must not influence results; every method defaults to a no-op.
 * Methods may be called concurrently from scan workers.
 */
public interface DetectionListener {

    default void onMatch(PatternMatch match) {
    }

    default void onFileScanned(FileDetectionResult result) {
    }

    default void onParseFailure(Path file, String message) {
    }

    default void onHeuristicFailure(Heuristic heuristic, TreeNode node, RuntimeException error) {
    }

    default void onTemplateApplied(String templateName, TreeNode node) {
    }

    default void onTemplateNotFound(String templateName) {
    }

    default void onWriteFailure(Path target, Exception error) {
    }

    /**
     * The definition registry stopped accepting registrations and is now shared read-only.
     */
    default void onRegistryFrozen(int definitionCount) {
    }
}
