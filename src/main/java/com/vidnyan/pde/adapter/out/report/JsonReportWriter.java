package com.vidnyan.pde.adapter.out.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.report.DetectionReport;
import com.vidnyan.pde.domain.signature.Signature;
import com.vidnyan.pde.exception.WriteFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Serializes a {@link DetectionReport} as a nested JSON document.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonReportWriter {

    private static final int TOP_LIMIT = 10;

    private final ObjectMapper objectMapper;

    public ObjectNode toJson(DetectionReport report) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode summary = root.putObject("summary");
        summary.put("filesScanned", report.filesScanned());
        summary.put("filesWithPatterns", report.filePatterns().size());
        summary.put("totalDetections", report.totalDetections());
        summary.put("averageConfidence", report.averageConfidence());
        summary.put("potentialRefactorings", report.potentialRefactorings());

        ObjectNode counts = root.putObject("patternCounts");
        report.patternCounts().forEach(counts::put);

        ObjectNode distribution = root.putObject("patternDistribution");
        report.patternDistribution().forEach(distribution::put);

        ObjectNode quality = root.putObject("qualityMetrics");
        report.qualityMetrics().forEach(quality::put);

        ArrayNode top = root.putArray("topPatterns");
        report.topPatterns(TOP_LIMIT).forEach(p -> top.addObject().put("pattern", p.name()).put("count", p.count()));

        ArrayNode busiest = root.putArray("filesWithMostPatterns");
        report.filesWithMostPatterns(TOP_LIMIT).forEach(f -> busiest.addObject().put("file", f.file()).put("count", f.count()));

        ObjectNode files = root.putObject("files");
        for (Map.Entry<String, List<PatternMatch>> entry : report.filePatterns().entrySet()) {
            ArrayNode matches = files.putArray(entry.getKey());
            entry.getValue().forEach(m -> matches.add(matchJson(m)));
        }

        ArrayNode failed = root.putArray("failedFiles");
        report.failedFiles().forEach(failed::add);
        ArrayNode skipped = root.putArray("skippedFiles");
        report.skippedFiles().forEach(skipped::add);
        return root;
    }

    public String toJsonString(DetectionReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(report));
        } catch (IOException e) {
            throw new IllegalStateException("Report serialization failed", e);
        }
    }

    /**
     * Write the report to a file.
     *
     * @throws WriteFailureException when the file cannot be written
     */
    public void write(DetectionReport report, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), toJson(report));
            log.info("Report written to {}", target);
        } catch (IOException e) {
            throw new WriteFailureException(target, e);
        }
    }

    private ObjectNode matchJson(PatternMatch match) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("pattern", match.patternName());
        node.put("node", match.node().describe());
        node.put("line", match.location().line());
        node.put("column", match.location().column());
        node.put("confidence", match.confidence());
        ArrayNode signatures = node.putArray("matchedSignatures");
        match.matchedSignatures().stream().map(Signature::describe).forEach(signatures::add);
        ArrayNode heuristics = node.putArray("firedHeuristics");
        match.firedHeuristics().stream().map(Heuristic::description).forEach(heuristics::add);
        return node;
    }
}
