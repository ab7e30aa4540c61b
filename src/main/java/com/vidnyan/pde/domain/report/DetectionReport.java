package com.vidnyan.pde.domain.report;

import com.vidnyan.pde.domain.pattern.PatternMatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pattern usage across a project. Derived data, recomputable from the matches.
 *
 * @param patternCounts         matches per pattern name
 * @param filePatterns          matches per file, only files with at least one match
 * @param totalDetections       number of matches
 * @param averageConfidence     mean confidence over all matches, 0 when there are none
 * @param potentialRefactorings procedures flagged by the conditional-dispatch scan
 * @param filesScanned          files handed to the detector
 * @param failedFiles           files that failed to parse or could not be scored
 * @param skippedFiles          files no parser supports
 */
public record DetectionReport(
    Map<String, Integer> patternCounts,
    Map<String, List<PatternMatch>> filePatterns,
    int totalDetections,
    double averageConfidence,
    int potentialRefactorings,
    int filesScanned,
    List<String> failedFiles,
    List<String> skippedFiles
) {

    public static final DetectionReport EMPTY = new ReportAccumulator().toReport();

    public DetectionReport {
        patternCounts = Collections.unmodifiableMap(new LinkedHashMap<>(patternCounts));
        filePatterns = Collections.unmodifiableMap(new LinkedHashMap<>(filePatterns));
        failedFiles = List.copyOf(failedFiles);
        skippedFiles = List.copyOf(skippedFiles);
    }

    public record PatternCount(String name, int count) {}

    public record FileCount(String file, int count) {}

    /**
     * Share of all detections per pattern.
     */
    public Map<String, Double> patternDistribution() {
        Map<String, Double> distribution = new LinkedHashMap<>();
        if (totalDetections == 0) {
            return distribution;
        }
        patternCounts.forEach((name, count) -> distribution.put(name, (double) count / totalDetections));
        return distribution;
    }

    /**
     * Most detected patterns, highest count first.
     */
    public List<PatternCount> topPatterns(int limit) {
        List<PatternCount> result = new ArrayList<>();
        patternCounts.forEach((name, count) -> result.add(new PatternCount(name, count)));
        result.sort(Comparator.comparingInt(PatternCount::count).reversed());
        return result.size() > limit ? List.copyOf(result.subList(0, limit)) : List.copyOf(result);
    }

    /**
     * Files with the most detections, highest count first.
     */
    public List<FileCount> filesWithMostPatterns(int limit) {
        List<FileCount> result = new ArrayList<>();
        filePatterns.forEach((file, matches) -> result.add(new FileCount(file, matches.size())));
        result.sort(Comparator.comparingInt(FileCount::count).reversed());
        return result.size() > limit ? List.copyOf(result.subList(0, limit)) : List.copyOf(result);
    }

    /**
     * Mean confidence per pattern.
     */
    public Map<String, Double> qualityMetrics() {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (List<PatternMatch> matches : filePatterns.values()) {
            for (PatternMatch match : matches) {
                double[] acc = sums.computeIfAbsent(match.patternName(), k -> new double[2]);
                acc[0] += match.confidence();
                acc[1]++;
            }
        }
        Map<String, Double> result = new LinkedHashMap<>();
        sums.forEach((name, acc) -> result.put(name, acc[0] / acc[1]));
        return result;
    }

    /**
     * All matches, file by file.
     */
    public List<PatternMatch> allMatches() {
        return filePatterns.values().stream()
                .flatMap(List::stream)
                .toList();
    }

    public boolean hasFailures() {
        return !failedFiles.isEmpty();
    }
}
