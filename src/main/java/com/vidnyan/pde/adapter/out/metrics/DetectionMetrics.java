package com.vidnyan.pde.adapter.out.metrics;

import com.vidnyan.pde.application.port.out.DetectionListener;
import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.report.FileDetectionResult;
import com.vidnyan.pde.domain.tree.TreeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process counters for matches and failures. Safe to update from scan workers.
 */
@Slf4j
@Component
public class DetectionMetrics implements DetectionListener {

    private final Map<String, LongAdder> matchesByPattern = new ConcurrentHashMap<>();
    private final LongAdder filesScanned = new LongAdder();
    private final LongAdder parseFailures = new LongAdder();
    private final LongAdder heuristicFailures = new LongAdder();
    private final LongAdder templatesApplied = new LongAdder();
    private final LongAdder templatesNotFound = new LongAdder();
    private final LongAdder writeFailures = new LongAdder();

    @Override
    public void onMatch(PatternMatch match) {
        matchesByPattern.computeIfAbsent(match.patternName(), k -> new LongAdder()).increment();
    }

    @Override
    public void onFileScanned(FileDetectionResult result) {
        filesScanned.increment();
    }

    @Override
    public void onParseFailure(Path file, String message) {
        parseFailures.increment();
    }

    @Override
    public void onHeuristicFailure(Heuristic heuristic, TreeNode node, RuntimeException error) {
        heuristicFailures.increment();
    }

    @Override
    public void onTemplateApplied(String templateName, TreeNode node) {
        templatesApplied.increment();
    }

    @Override
    public void onTemplateNotFound(String templateName) {
        templatesNotFound.increment();
    }

    @Override
    public void onWriteFailure(Path target, Exception error) {
        writeFailures.increment();
    }

    @Override
    public void onRegistryFrozen(int definitionCount) {
        log.debug("Registry frozen with {} definitions", definitionCount);
    }

    public long matches(String patternName) {
        LongAdder adder = matchesByPattern.get(patternName);
        return adder == null ? 0 : adder.sum();
    }

    /**
     * Snapshot of match counters, sorted by pattern name.
     */
    public Map<String, Long> matchCounts() {
        Map<String, Long> snapshot = new TreeMap<>();
        matchesByPattern.forEach((name, adder) -> snapshot.put(name, adder.sum()));
        return snapshot;
    }

    public long filesScanned() {
        return filesScanned.sum();
    }

    public long parseFailures() {
        return parseFailures.sum();
    }

    public long heuristicFailures() {
        return heuristicFailures.sum();
    }

    public long templatesApplied() {
        return templatesApplied.sum();
    }

    public long templatesNotFound() {
        return templatesNotFound.sum();
    }

    public long writeFailures() {
        return writeFailures.sum();
    }

    public void logSummary() {
        log.info("Metrics: files={}, parseFailures={}, heuristicFailures={}, matches={}",
                filesScanned(), parseFailures(), heuristicFailures(), matchCounts());
        if (templatesApplied() > 0 || templatesNotFound() > 0 || writeFailures() > 0) {
            log.info("Metrics: templatesApplied={}, templatesNotFound={}, writeFailures={}",
                    templatesApplied(), templatesNotFound(), writeFailures());
        }
    }
}
