package com.vidnyan.pde.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.vidnyan.pde.application.port.out.DetectionListener;
import com.vidnyan.pde.application.port.out.PatternDefinitionRepository;
import com.vidnyan.pde.application.port.out.SourceTreeParser;
import com.vidnyan.pde.catalog.PatternCatalog;
import com.vidnyan.pde.catalog.TemplateCatalog;
import com.vidnyan.pde.domain.heuristic.HeuristicEvaluator;
import com.vidnyan.pde.domain.pattern.PatternRegistry;
import com.vidnyan.pde.domain.scoring.ConfidenceScorer;
import com.vidnyan.pde.domain.signature.SignatureMatcher;
import com.vidnyan.pde.domain.transform.TemplateRegistry;
import com.vidnyan.pde.domain.transform.TemplateSubstitutor;
import com.vidnyan.pde.domain.transform.TreePrinter;
import com.vidnyan.pde.domain.tree.NodeKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumSet;
import java.util.List;

/**
 * Spring configuration for the detection engine.
 * The context is the owned registry of engine collaborators; domain classes stay framework free.
 */
@Slf4j
@Configuration
public class PdeConfiguration {

    /**
     * ObjectMapper for JSON parsing.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, true);
    }

    @Bean
    public SignatureMatcher signatureMatcher(DetectionProperties properties) {
        return new SignatureMatcher(properties.getTransparentKinds().isEmpty()
                ? EnumSet.noneOf(NodeKind.class)
                : EnumSet.copyOf(properties.getTransparentKinds()));
    }

    /**
     * Heuristic failures are forwarded to every listener.
     */
    @Bean
    public HeuristicEvaluator heuristicEvaluator(List<DetectionListener> listeners) {
        return new HeuristicEvaluator((heuristic, node, error) -> {
            for (DetectionListener listener : listeners) {
                try {
                    listener.onHeuristicFailure(heuristic, node, error);
                } catch (RuntimeException e) {
                    log.warn("Detection listener {} failed: {}", listener.getClass().getSimpleName(), e.toString());
                }
            }
        });
    }

    @Bean
    public ConfidenceScorer confidenceScorer(SignatureMatcher matcher, HeuristicEvaluator evaluator,
                                             DetectionProperties properties) {
        return new ConfidenceScorer(matcher, evaluator,
                properties.isEnableAstMatching(), properties.isEnableHeuristics());
    }

    /**
     * Standard catalog first, then custom definitions; a custom definition
     * replaces a standard one of the same name.
     */
    @Bean
    public PatternRegistry patternRegistry(PatternDefinitionRepository repository) {
        PatternRegistry registry = new PatternRegistry()
                .registerAll(PatternCatalog.standardDefinitions())
                .registerAll(repository.findAll());
        log.info("Registered {} pattern definitions:", registry.size());
        registry.definitions().forEach(d -> log.info("  - {} ({}, threshold {})",
                d.name(), d.category(), d.minimumConfidence()));
        return registry;
    }

    @Bean
    public TemplateRegistry templateRegistry() {
        TemplateRegistry registry = new TemplateRegistry();
        TemplateCatalog.standardTemplates().forEach(registry::register);
        log.info("Registered templates: {}", registry.names());
        return registry;
    }

    @Bean
    public TemplateSubstitutor templateSubstitutor() {
        return new TemplateSubstitutor();
    }

    @Bean
    public TreePrinter treePrinter() {
        return new TreePrinter();
    }

    /**
     * Log available parsers on startup.
     */
    @Bean
    public String logParsers(List<SourceTreeParser> parsers) {
        log.info("Registered {} source tree parsers:", parsers.size());
        parsers.forEach(p -> log.info("  - {}", p.getName()));
        return "parsers-logged";
    }
}
