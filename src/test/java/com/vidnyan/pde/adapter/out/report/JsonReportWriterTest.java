package com.vidnyan.pde.adapter.out.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.pde.domain.heuristic.Heuristic;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.report.DetectionReport;
import com.vidnyan.pde.domain.report.FileDetectionResult;
import com.vidnyan.pde.domain.report.ReportAccumulator;
import com.vidnyan.pde.domain.signature.Signature;
import com.vidnyan.pde.domain.tree.Location;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.exception.WriteFailureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonReportWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonReportWriter writer = new JsonReportWriter(objectMapper);

    private DetectionReport report() {
        TreeNode node = TreeNode.builder(NodeKind.TYPE_DECL)
                .name("AppConfig")
                .location(Location.at("src/AppConfig.java", 4, 1))
                .build();
        PatternMatch match = new PatternMatch("Singleton", node, 0.9,
                List.of(Signature.of(NodeKind.TYPE_DECL).build()),
                List.of(Heuristic.of("Has private constructor", 0.3, n -> true)),
                "src/AppConfig.java");
        return new ReportAccumulator()
                .add(FileDetectionResult.success("src/AppConfig.java", List.of(match), 1, 12, Duration.ZERO))
                .add(FileDetectionResult.parseFailure("src/Broken.java", "unexpected token"))
                .toReport();
    }

    @Test
    void toJson_ShouldNestSummaryFilesAndMatches() {
        // Act
        JsonNode json = writer.toJson(report());

        // Assert
        assertEquals(2, json.path("summary").path("filesScanned").asInt());
        assertEquals(1, json.path("summary").path("totalDetections").asInt());
        assertEquals(0.9, json.path("summary").path("averageConfidence").asDouble(), 1e-9);
        assertEquals(1, json.path("patternCounts").path("Singleton").asInt());
        assertEquals("Singleton", json.path("topPatterns").get(0).path("pattern").asText());

        JsonNode match = json.path("files").path("src/AppConfig.java").get(0);
        assertEquals("Singleton", match.path("pattern").asText());
        assertEquals(4, match.path("line").asInt());
        assertEquals("Has private constructor", match.path("firedHeuristics").get(0).asText());
        assertEquals(1, match.path("matchedSignatures").size());

        assertEquals("src/Broken.java", json.path("failedFiles").get(0).asText());
    }

    @Test
    void write_ShouldCreateParentDirectories() throws IOException {
        Path target = tempDir.resolve("reports/detection.json");

        writer.write(report(), target);

        JsonNode written = objectMapper.readTree(target.toFile());
        assertEquals(writer.toJson(report()), written);
    }

    @Test
    void write_TargetIsDirectory_ShouldThrowWriteFailure() throws IOException {
        Path directory = Files.createDirectories(tempDir.resolve("taken"));

        assertThrows(WriteFailureException.class, () -> writer.write(report(), directory));
    }

    @Test
    void toJsonString_EmptyReport_ShouldStillCarrySummary() {
        String text = writer.toJsonString(DetectionReport.EMPTY);

        assertTrue(text.contains("\"totalDetections\" : 0"));
    }
}
