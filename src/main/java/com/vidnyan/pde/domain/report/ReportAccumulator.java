package com.vidnyan.pde.domain.report;

import com.vidnyan.pde.domain.pattern.PatternMatch;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds per-file results into a {@link DetectionReport}.
 * Not thread-safe: a single thread folds the per-file results in file order.
 */
public class ReportAccumulator {

    private final Map<String, Integer> patternCounts = new LinkedHashMap<>();
    private final Map<String, List<PatternMatch>> filePatterns = new LinkedHashMap<>();
    private final List<String> failedFiles = new ArrayList<>();
    private final List<String> skippedFiles = new ArrayList<>();
    private int totalDetections;
    private double totalConfidence;
    private int potentialRefactorings;
    private int filesScanned;

    public ReportAccumulator add(FileDetectionResult result) {
        filesScanned++;
        switch (result.status()) {
            case PARSE_FAILURE, DETECTION_FAILURE -> failedFiles.add(result.file());
            case SKIPPED -> skippedFiles.add(result.file());
            case SUCCESS -> {
                potentialRefactorings += result.refactoringCandidates();
                if (!result.matches().isEmpty()) {
                    filePatterns.computeIfAbsent(result.file(), f -> new ArrayList<>())
                            .addAll(result.matches());
                    for (PatternMatch match : result.matches()) {
                        patternCounts.merge(match.patternName(), 1, Integer::sum);
                        totalConfidence += match.confidence();
                        totalDetections++;
                    }
                }
            }
        }
        return this;
    }

    /**
     * Combine with another partial accumulator. Only tests use this, to check
     * that folding is associative.
     */
    ReportAccumulator merge(ReportAccumulator other) {
        other.patternCounts.forEach((k, v) -> patternCounts.merge(k, v, Integer::sum));
        other.filePatterns.forEach((k, v) -> filePatterns.computeIfAbsent(k, f -> new ArrayList<>()).addAll(v));
        failedFiles.addAll(other.failedFiles);
        skippedFiles.addAll(other.skippedFiles);
        totalDetections += other.totalDetections;
        totalConfidence += other.totalConfidence;
        potentialRefactorings += other.potentialRefactorings;
        filesScanned += other.filesScanned;
        return this;
    }

    public DetectionReport toReport() {
        double average = totalDetections > 0 ? totalConfidence / totalDetections : 0.0;
        Map<String, List<PatternMatch>> files = new LinkedHashMap<>();
        filePatterns.forEach((k, v) -> files.put(k, List.copyOf(v)));
        return new DetectionReport(
                patternCounts,
                files,
                totalDetections,
                average,
                potentialRefactorings,
                filesScanned,
                failedFiles,
                skippedFiles);
    }
}
