package com.vidnyan.pde.domain.report;

import com.vidnyan.pde.domain.pattern.PatternMatch;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of running detection over one file: the partial result each worker
 * produces before results are folded into a {@link DetectionReport}.
 */
public record FileDetectionResult(
    String file,
    Status status,
    List<PatternMatch> matches,
    int refactoringCandidates,
    int nodesVisited,
    Duration duration,
    String errorMessage
) {

    public enum Status {
        SUCCESS,
        PARSE_FAILURE,
        DETECTION_FAILURE,
        SKIPPED
    }

    public FileDetectionResult {
        matches = matches == null ? List.of() : List.copyOf(matches);
        duration = duration == null ? Duration.ZERO : duration;
    }

    /**
     * Create a successful result.
     */
    public static FileDetectionResult success(String file, List<PatternMatch> matches,
                                              int refactoringCandidates, int nodesVisited,
                                              Duration duration) {
        return new FileDetectionResult(file, Status.SUCCESS, matches, refactoringCandidates,
                nodesVisited, duration, null);
    }

    /**
     * Create a parse failure result; contributes zero matches.
     */
    public static FileDetectionResult parseFailure(String file, String message) {
        return new FileDetectionResult(file, Status.PARSE_FAILURE, List.of(), 0, 0,
                Duration.ZERO, message);
    }

    /**
     * Create a result for a file that parsed but could not be scored; contributes zero matches.
     */
    public static FileDetectionResult detectionFailure(String file, String message) {
        return new FileDetectionResult(file, Status.DETECTION_FAILURE, List.of(), 0, 0,
                Duration.ZERO, message);
    }

    /**
     * Create a skipped result.
     */
    public static FileDetectionResult skipped(String file, String reason) {
        return new FileDetectionResult(file, Status.SKIPPED, List.of(), 0, 0,
                Duration.ZERO, reason);
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public int matchCount() {
        return matches.size();
    }
}
