package com.vidnyan.pde.adapter.in.cli;

import com.vidnyan.pde.adapter.out.metrics.DetectionMetrics;
import com.vidnyan.pde.adapter.out.report.JsonReportWriter;
import com.vidnyan.pde.application.port.in.DetectPatternsUseCase;
import com.vidnyan.pde.application.port.in.TransformPatternUseCase;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.report.DetectionReport;
import com.vidnyan.pde.exception.WriteFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * CLI Runner for standalone pattern detection.
 * Scans a project when pde.analyze.path is set; rewrites a file when
 * pde.transform.source and pde.transform.pattern are set.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DetectionCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED_MATCHES = 100;

    private final DetectPatternsUseCase detectPatternsUseCase;
    private final TransformPatternUseCase transformPatternUseCase;
    private final JsonReportWriter reportWriter;
    private final DetectionMetrics metrics;
    private final ConfigurableApplicationContext context;

    @Value("${pde.analyze.path:}")
    private String sourcePath;

    @Value("${pde.analyze.report-output:}")
    private String reportOutput;

    @Value("${pde.transform.source:}")
    private String transformSource;

    @Value("${pde.transform.pattern:}")
    private String transformPattern;

    @Value("${pde.transform.output:}")
    private String transformOutput;

    @Override
    public void run(String... args) {
        boolean analyze = !isBlank(sourcePath);
        boolean transform = !isBlank(transformSource) && !isBlank(transformPattern);
        if (!analyze && !transform) {
            log.info("No source path specified. Set pde.analyze.path or pde.transform.source and pde.transform.pattern.");
            return;
        }

        int exitCode = 0;
        try {
            if (analyze) {
                exitCode = analyze();
            }
            if (transform) {
                exitCode = Math.max(exitCode, transform());
            }
            metrics.logSummary();
        } finally {
            int code = exitCode;
            // Ensure application shuts down after the run
            SpringApplication.exit(context, () -> code);
        }
    }

    private int analyze() {
        log.info("==============================================================");
        log.info(" PDE - Pattern Detection Engine");
        log.info(" Analyzing: {}", truncatePath(sourcePath, 50));
        log.info("==============================================================");

        DetectionReport report = detectPatternsUseCase.analyzeProject(Path.of(sourcePath));
        printReport(report);

        if (!isBlank(reportOutput)) {
            try {
                reportWriter.write(report, Path.of(reportOutput));
            } catch (WriteFailureException e) {
                log.error(e.getMessage());
                return 2;
            }
        }
        return 0;
    }

    private int transform() {
        Path output = isBlank(transformOutput) ? null : Path.of(transformOutput);
        boolean written = transformPatternUseCase.applyToFile(Path.of(transformSource), transformPattern, output);
        if (!written) {
            log.warn("No {} transformation written for {}", transformPattern, transformSource);
            return 1;
        }
        return 0;
    }

    private void printReport(DetectionReport report) {
        log.info("");
        log.info("==============================================================");
        log.info(" PATTERN DETECTION RESULTS");
        log.info("==============================================================");
        log.info(" Files scanned:            {}", report.filesScanned());
        log.info(" Files with patterns:      {}", report.filePatterns().size());
        log.info(" Total detections:         {}", report.totalDetections());
        log.info(" Average confidence:       {}", String.format("%.2f", report.averageConfidence()));
        log.info(" Refactoring opportunities: {}", report.potentialRefactorings());
        log.info("--------------------------------------------------------------");

        if (report.totalDetections() == 0) {
            log.info(" No patterns detected.");
        } else {
            log.info(" PATTERNS:");
            Map<String, Double> quality = report.qualityMetrics();
            Map<String, Double> distribution = report.patternDistribution();
            report.topPatterns(Integer.MAX_VALUE).forEach(p -> log.info("   {} x{} ({}%, mean confidence {})",
                    p.name(), p.count(),
                    String.format("%.1f", distribution.get(p.name()) * 100),
                    String.format("%.2f", quality.get(p.name()))));

            log.info("");
            log.info(" FILES WITH MOST PATTERNS:");
            report.filesWithMostPatterns(5).forEach(f -> log.info("   {} ({})", f.file(), f.count()));

            log.info("");
            log.info(" MATCH DETAILS:");
            List<PatternMatch> matches = report.allMatches();
            int count = 0;
            for (PatternMatch match : matches) {
                if (++count > MAX_LISTED_MATCHES) {
                    log.info(" ... and {} more matches", matches.size() - MAX_LISTED_MATCHES);
                    break;
                }
                log.info("   {}", match.summary());
            }
        }

        if (report.hasFailures()) {
            log.info("");
            log.info(" FILES THAT FAILED TO PARSE:");
            report.failedFiles().forEach(f -> log.info("   {}", f));
        }
        log.info("==============================================================");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
