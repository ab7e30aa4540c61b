package com.vidnyan.pde.application.service;

import com.vidnyan.pde.adapter.out.metrics.DetectionMetrics;
import com.vidnyan.pde.adapter.out.parser.JavaParserTreeAdapter;
import com.vidnyan.pde.application.port.out.DetectionListener;
import com.vidnyan.pde.application.port.out.SourceTreeParser;
import com.vidnyan.pde.catalog.PatternCatalog;
import com.vidnyan.pde.catalog.TemplateCatalog;
import com.vidnyan.pde.config.DetectionProperties;
import com.vidnyan.pde.domain.heuristic.HeuristicEvaluator;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.pattern.PatternRegistry;
import com.vidnyan.pde.domain.scoring.ConfidenceScorer;
import com.vidnyan.pde.domain.signature.SignatureMatcher;
import com.vidnyan.pde.domain.transform.PatternTemplate;
import com.vidnyan.pde.domain.transform.TemplateRegistry;
import com.vidnyan.pde.domain.transform.TemplateSubstitutor;
import com.vidnyan.pde.domain.transform.TransformResult;
import com.vidnyan.pde.domain.transform.TreePrinter;
import com.vidnyan.pde.domain.tree.NodeKind;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.exception.TemplateNotFoundException;
import com.vidnyan.pde.scanner.ProjectScanner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PatternTransformationServiceTest {

    private static final String CONNECTION_SINGLETON = """
            package com.example;

            public class ConnectionSingleton {
                private static ConnectionSingleton instance;

                private ConnectionSingleton() {
                }

                public void connect() {
                }
            }
            """;

    private static final String EVENT_BUS = """
            package com.example;

            import java.util.ArrayList;
            import java.util.List;

            public class EventSubject {
                private final List<Listener> listeners = new ArrayList<>();

                public void addListener(Listener listener) {
                    listeners.add(listener);
                }

                public void notifyListeners(String event) {
                    for (Listener listener : listeners) {
                        listener.onEvent(event);
                    }
                }
            }
            """;

    @TempDir
    Path tempDir;

    private final JavaParserTreeAdapter parser = new JavaParserTreeAdapter();
    private DetectionMetrics metrics;
    private PatternDetectionService detectionService;
    private PatternTransformationService transformationService;

    @BeforeEach
    void setUp() {
        metrics = new DetectionMetrics();
        List<DetectionListener> listeners = List.of(metrics);
        List<SourceTreeParser> parsers = List.of(parser);
        DetectionProperties properties = new DetectionProperties();
        properties.setParallelism(1);

        PatternRegistry registry = new PatternRegistry().registerAll(PatternCatalog.standardDefinitions());
        ConfidenceScorer scorer = new ConfidenceScorer(new SignatureMatcher(), new HeuristicEvaluator());
        detectionService = new PatternDetectionService(registry, scorer, parsers,
                new ProjectScanner(properties), listeners, properties);

        TemplateRegistry templates = new TemplateRegistry();
        TemplateCatalog.standardTemplates().forEach(templates::register);
        transformationService = new PatternTransformationService(templates, new TemplateSubstitutor(),
                new TreePrinter(), detectionService, parsers, listeners);
    }

    private PatternMatch singletonMatch(TreeNode tree) {
        Optional<PatternMatch> match = detectionService.detect(tree).stream()
                .filter(m -> m.patternName().equals(PatternCatalog.SINGLETON))
                .findFirst();
        assertTrue(match.isPresent(), "expected a Singleton match");
        return match.get();
    }

    @Test
    void applyTemplate_RewrittenTree_ShouldReSatisfyItsPattern() {
        // Arrange
        TreeNode tree = parser.parseSource(CONNECTION_SINGLETON, "ConnectionSingleton.java");
        PatternMatch match = singletonMatch(tree);

        // Act
        TransformResult result = transformationService.applyTemplate(match, PatternCatalog.SINGLETON);

        // Assert
        assertTrue(result.isApplied());
        TreeNode rewritten = result.tree();
        assertEquals("ConnectionSingleton", rewritten.name());
        assertTrue(rewritten.childrenOfKind(NodeKind.PROCEDURE).stream().anyMatch(p -> "getInstance".equals(p.name())));
        assertTrue(rewritten.childrenOfKind(NodeKind.PROCEDURE).stream().anyMatch(p -> "connect".equals(p.name())));
        assertEquals(1, rewritten.childrenOfKind(NodeKind.FIELD).size());

        double confidence = detectionService.assess(rewritten, PatternCatalog.singleton()).confidence();
        assertTrue(confidence >= PatternCatalog.singleton().minimumConfidence(), "confidence " + confidence);
        assertTrue(confidence >= match.confidence());
        assertEquals(1, metrics.templatesApplied());
    }

    @Test
    void applyTemplate_Twice_ShouldYieldEqualTreesAndLeaveOriginalUntouched() {
        TreeNode tree = parser.parseSource(CONNECTION_SINGLETON, "ConnectionSingleton.java");
        TreeNode snapshot = parser.parseSource(CONNECTION_SINGLETON, "ConnectionSingleton.java");
        PatternMatch match = singletonMatch(tree);

        TreeNode first = transformationService.applyTemplate(match, PatternCatalog.SINGLETON).tree();
        TreeNode second = transformationService.applyTemplate(match, PatternCatalog.SINGLETON).tree();

        assertEquals(first, second);
        assertEquals(snapshot, tree);
    }

    @Test
    void applyTemplate_UnknownTemplate_ShouldReturnOriginalNode() {
        TreeNode tree = parser.parseSource(CONNECTION_SINGLETON, "ConnectionSingleton.java");
        PatternMatch match = singletonMatch(tree);

        TransformResult result = transformationService.applyTemplate(match, "Visitor");

        assertFalse(result.isApplied());
        assertEquals(TransformResult.Status.TEMPLATE_NOT_FOUND, result.status());
        assertSame(match.node(), result.tree());
        assertThrows(TemplateNotFoundException.class, result::orElseThrow);
        assertEquals(1, metrics.templatesNotFound());
    }

    @Test
    void applyTemplate_WholeTree_ShouldReplaceMatchedNodeInCopy() {
        TreeNode tree = parser.parseSource(CONNECTION_SINGLETON, "ConnectionSingleton.java");
        PatternMatch match = singletonMatch(tree);

        TreeNode rewritten = transformationService.applyTemplate(tree, match, PatternCatalog.SINGLETON).tree();

        assertEquals(NodeKind.COMPILATION_UNIT, rewritten.kind());
        assertNotEquals(tree, rewritten);
        assertTrue(rewritten.preOrder().stream().anyMatch(n -> "getInstance".equals(n.name())));
        assertFalse(tree.preOrder().stream().anyMatch(n -> "getInstance".equals(n.name())));
    }

    @Test
    void applyToFile_ShouldWriteRenderedTree() throws IOException {
        Path source = tempDir.resolve("ConnectionSingleton.java");
        Files.writeString(source, CONNECTION_SINGLETON);
        Path output = tempDir.resolve("out/ConnectionSingleton.tree");

        boolean written = transformationService.applyToFile(source, PatternCatalog.SINGLETON, output);

        assertTrue(written);
        String text = Files.readString(output);
        assertTrue(text.startsWith(";; pattern engine tree"));
        assertTrue(text.contains("(PROCEDURE \"getInstance\""));
        assertEquals(CONNECTION_SINGLETON, Files.readString(source));
    }

    @Test
    void applyToFile_PatternWithoutTemplate_ShouldReturnFalse() throws IOException {
        Path source = tempDir.resolve("EventSubject.java");
        Files.writeString(source, EVENT_BUS);
        Path output = tempDir.resolve("EventSubject.tree");

        boolean written = transformationService.applyToFile(source, PatternCatalog.OBSERVER, output);

        assertFalse(written);
        assertFalse(Files.exists(output));
        assertEquals(1, metrics.templatesNotFound());
    }

    @Test
    void registerTemplate_ShouldMakeTemplateAvailableToFiles() throws IOException {
        Path source = tempDir.resolve("EventSubject.java");
        Files.writeString(source, EVENT_BUS);
        Path output = tempDir.resolve("EventSubject.tree");
        TreeNode finalSubject = TreeNode.builder(NodeKind.TYPE_DECL)
                .name("${name}")
                .flag("final")
                .child(TreeNode.leaf(NodeKind.PLACEHOLDER, TemplateSubstitutor.MEMBERS_SLOT))
                .build();

        transformationService.registerTemplate(new PatternTemplate(PatternCatalog.OBSERVER, "Final subject", finalSubject));

        assertTrue(transformationService.applyToFile(source, PatternCatalog.OBSERVER, output));
        String text = Files.readString(output);
        String typeLine = text.lines().map(String::strip).filter(l -> l.startsWith("(TYPE_DECL")).findFirst().orElseThrow();
        assertTrue(typeLine.startsWith("(TYPE_DECL \"EventSubject\""), typeLine);
        assertTrue(typeLine.contains(":final true"), typeLine);
        assertTrue(text.contains("(PROCEDURE \"notifyListeners\""));
    }

    @Test
    void applyToFile_NoMatch_ShouldReturnFalse() throws IOException {
        Path source = tempDir.resolve("EventSubject.java");
        Files.writeString(source, EVENT_BUS);

        assertFalse(transformationService.applyToFile(source, PatternCatalog.SINGLETON, null));
        assertEquals(EVENT_BUS, Files.readString(source));
    }

    @Test
    void applyToFile_UnparsableSource_ShouldReturnFalse() throws IOException {
        Path source = tempDir.resolve("Broken.java");
        Files.writeString(source, "public class Broken {");

        assertFalse(transformationService.applyToFile(source, PatternCatalog.SINGLETON, null));
        assertEquals(1, metrics.parseFailures());
    }

    @Test
    void applyToFile_UnwritableTarget_ShouldReportWriteFailure() throws IOException {
        Path source = tempDir.resolve("ConnectionSingleton.java");
        Files.writeString(source, CONNECTION_SINGLETON);
        Path directory = Files.createDirectories(tempDir.resolve("occupied"));

        boolean written = transformationService.applyToFile(source, PatternCatalog.SINGLETON, directory);

        assertFalse(written);
        assertEquals(1, metrics.writeFailures());
    }
}
