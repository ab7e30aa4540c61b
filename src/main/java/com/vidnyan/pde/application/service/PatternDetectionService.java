package com.vidnyan.pde.application.service;

import com.vidnyan.pde.application.port.in.DetectPatternsUseCase;
import com.vidnyan.pde.application.port.out.DetectionListener;
import com.vidnyan.pde.application.port.out.SourceTreeParser;
import com.vidnyan.pde.config.DetectionProperties;
import com.vidnyan.pde.domain.pattern.PatternDefinition;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.pattern.PatternRegistry;
import com.vidnyan.pde.domain.pattern.RefactoringOpportunityScanner;
import com.vidnyan.pde.domain.report.DetectionReport;
import com.vidnyan.pde.domain.report.FileDetectionResult;
import com.vidnyan.pde.domain.report.ReportAccumulator;
import com.vidnyan.pde.domain.scoring.Assessment;
import com.vidnyan.pde.domain.scoring.ConfidenceScorer;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.exception.ParseFailureException;
import com.vidnyan.pde.scanner.ProjectScanner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Orchestrates pattern detection: walks trees, scores every node against every
 * registered definition and folds per-file results into project reports.
 *
 * Detection over one tree is single-threaded and side-effect free. Project
 * scans run files on a worker pool; each worker returns a per-file partial
 * result and the partials are folded in file order on the calling thread.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternDetectionService implements DetectPatternsUseCase {

    private static final Comparator<PatternMatch> BY_CONFIDENCE_DESC =
            Comparator.comparingDouble(PatternMatch::confidence).reversed();

    private final PatternRegistry registry;
    private final ConfidenceScorer scorer;
    private final List<SourceTreeParser> parsers;
    private final ProjectScanner projectScanner;
    private final List<DetectionListener> listeners;
    private final DetectionProperties properties;

    private final RefactoringOpportunityScanner refactoringScanner = new RefactoringOpportunityScanner();

    @Override
    public void registerDefinition(PatternDefinition definition) {
        registry.register(definition);
        log.info("Registered pattern definition: {} ({} signatures, {} heuristics, threshold {})",
                definition.name(), definition.signatures().size(),
                definition.heuristics().size(), definition.minimumConfidence());
    }

    @Override
    public List<PatternMatch> detect(TreeNode tree) {
        return detect(tree, null);
    }

    /**
     * Detect over a whole tree, attributing matches to a source file.
     */
    public List<PatternMatch> detect(TreeNode tree, String sourceFile) {
        List<PatternDefinition> definitions = registry.definitions();
        List<PatternMatch> matches = new ArrayList<>();
        visit(tree, 0, node -> matches.addAll(matchNode(node, definitions, sourceFile)));
        matches.sort(BY_CONFIDENCE_DESC);
        matches.forEach(match -> notifyListeners(l -> l.onMatch(match)));
        return matches;
    }

    /**
     * Score one node against one definition, whether or not it clears the threshold.
     */
    public Assessment assess(TreeNode node, PatternDefinition definition) {
        return scorer.assess(node, definition);
    }

    @Override
    public List<PatternMatch> detectInFile(Path file) {
        return scanFile(file).matches();
    }

    /**
     * Parse then detect one file. Never throws: a file that cannot be parsed is
     * reported as a parse failure, and a file whose tree cannot be scored as a
     * detection failure, both with zero matches.
     */
    public FileDetectionResult scanFile(Path file) {
        Instant start = Instant.now();
        String fileName = file.toString();
        Optional<SourceTreeParser> parser = findParser(file);
        if (parser.isEmpty()) {
            log.debug("No parser supports {}, skipping", file);
            return FileDetectionResult.skipped(fileName, "No parser available");
        }

        log.debug("Detecting patterns in file: {}", file);
        TreeNode tree;
        try {
            tree = parser.get().parse(file);
        } catch (ParseFailureException e) {
            return parseFailure(file, e.getMessage());
        } catch (RuntimeException e) {
            return parseFailure(file, parser.get().getName() + " failed: " + e);
        }

        List<PatternMatch> matches;
        int candidates;
        try {
            matches = detect(tree, fileName);
            candidates = refactoringScanner.countCandidates(tree);
        } catch (RuntimeException e) {
            return detectionFailure(file, e);
        }
        FileDetectionResult result = FileDetectionResult.success(fileName, matches, candidates,
                tree.size(), Duration.between(start, Instant.now()));
        log.debug("Detected {} pattern instances in {}", matches.size(), file);
        notifyListeners(l -> l.onFileScanned(result));
        return result;
    }

    @Override
    public DetectionReport analyzeProject(Path projectRoot) {
        List<Path> files = projectScanner.scanSourceFiles(projectRoot);
        log.info("Analyzing {} files in project: {}", files.size(), projectRoot);
        return analyzeFiles(files);
    }

    @Override
    public DetectionReport analyzeFiles(List<Path> files) {
        Instant start = Instant.now();
        publishRegistry();

        List<FileDetectionResult> results = runAll(files);
        ReportAccumulator accumulator = new ReportAccumulator();
        results.forEach(accumulator::add);
        DetectionReport report = accumulator.toReport();

        log.info("Analysis complete: {} patterns detected across {} files in {}ms",
                report.totalDetections(), report.filePatterns().size(),
                Duration.between(start, Instant.now()).toMillis());
        log.info("Average confidence: {}", String.format("%.2f", report.averageConfidence()));
        log.info("Potential refactoring opportunities: {}", report.potentialRefactorings());
        if (report.hasFailures()) {
            log.warn("{} of {} files could not be analyzed", report.failedFiles().size(), report.filesScanned());
        }
        return report;
    }

    private List<FileDetectionResult> runAll(List<Path> files) {
        int workers = Math.max(1, Math.min(properties.getParallelism(), files.size()));
        if (workers == 1) {
            List<FileDetectionResult> results = new ArrayList<>(files.size());
            for (Path file : files) {
                if (Thread.currentThread().isInterrupted()) {
                    log.warn("Scan interrupted, {} files not scheduled", files.size() - results.size());
                    break;
                }
                results.add(scanFile(file));
            }
            return results;
        }

        AtomicInteger threadIndex = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "pde-scan-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<Future<FileDetectionResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(executor.submit(() -> scanFile(file)));
            }
            List<FileDetectionResult> results = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Scan interrupted, {} files not collected", futures.size() - i);
                    futures.forEach(f -> f.cancel(false));
                    break;
                } catch (ExecutionException e) {
                    Path file = files.get(i);
                    log.error("Unexpected failure scanning {}", file, e.getCause());
                    results.add(FileDetectionResult.detectionFailure(file.toString(), String.valueOf(e.getCause())));
                }
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private void visit(TreeNode node, int depth, Consumer<TreeNode> visitor) {
        if (properties.getMaxDepth() > 0 && depth >= properties.getMaxDepth()) {
            return;
        }
        visitor.accept(node);
        for (TreeNode child : node.children()) {
            visit(child, depth + 1, visitor);
        }
    }

    private List<PatternMatch> matchNode(TreeNode node, List<PatternDefinition> definitions, String sourceFile) {
        List<PatternMatch> matches = new ArrayList<>(1);
        for (PatternDefinition definition : definitions) {
            if (definition.isUndecidable()) {
                continue;
            }
            Assessment assessment = scorer.assess(node, definition);
            double threshold = Math.max(definition.minimumConfidence(), properties.getMinConfidence());
            if (assessment.clears(threshold)) {
                PatternMatch match = new PatternMatch(
                        definition.name(),
                        node,
                        assessment.confidence(),
                        assessment.matchedSignatures(),
                        assessment.firedHeuristics(),
                        sourceFile);
                log.debug("Detected {} pattern with confidence {}",
                        definition.name(), String.format("%.2f", assessment.confidence()));
                matches.add(match);
            }
        }
        return matches;
    }

    private Optional<SourceTreeParser> findParser(Path file) {
        return parsers.stream()
                .filter(p -> p.supports(file))
                .findFirst();
    }

    private FileDetectionResult parseFailure(Path file, String message) {
        log.warn("Failed to parse file {}: {}", file, message);
        notifyListeners(l -> l.onParseFailure(file, message));
        FileDetectionResult result = FileDetectionResult.parseFailure(file.toString(), message);
        notifyListeners(l -> l.onFileScanned(result));
        return result;
    }

    private FileDetectionResult detectionFailure(Path file, RuntimeException error) {
        log.error("Pattern detection failed for {}", file, error);
        FileDetectionResult result = FileDetectionResult.detectionFailure(file.toString(), error.toString());
        notifyListeners(l -> l.onFileScanned(result));
        return result;
    }

    private void publishRegistry() {
        if (registry.freeze()) {
            int count = registry.size();
            log.info("Pattern registry published with {} definitions", count);
            notifyListeners(l -> l.onRegistryFrozen(count));
        }
    }

    private void notifyListeners(Consumer<DetectionListener> event) {
        for (DetectionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Detection listener {} failed: {}", listener.getClass().getSimpleName(), e.toString());
            }
        }
    }
}
