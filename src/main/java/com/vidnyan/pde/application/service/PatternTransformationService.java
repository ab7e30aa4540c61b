package com.vidnyan.pde.application.service;

import com.vidnyan.pde.application.port.in.TransformPatternUseCase;
import com.vidnyan.pde.application.port.out.DetectionListener;
import com.vidnyan.pde.application.port.out.SourceTreeParser;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.transform.PatternTemplate;
import com.vidnyan.pde.domain.transform.TemplateRegistry;
import com.vidnyan.pde.domain.transform.TemplateSubstitutor;
import com.vidnyan.pde.domain.transform.TransformResult;
import com.vidnyan.pde.domain.transform.TreePrinter;
import com.vidnyan.pde.domain.transform.TreeRewriter;
import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.exception.ParseFailureException;
import com.vidnyan.pde.exception.WriteFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Rewrites matched nodes with registered templates.
 * Trees are immutable: every transformation yields a new tree.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PatternTransformationService implements TransformPatternUseCase {

    private final TemplateRegistry templates;
    private final TemplateSubstitutor substitutor;
    private final TreePrinter printer;
    private final PatternDetectionService detectionService;
    private final List<SourceTreeParser> parsers;
    private final List<DetectionListener> listeners;

    public void registerTemplate(PatternTemplate template) {
        templates.register(template);
        log.info("Registered template: {}", template.name());
    }

    @Override
    public TransformResult applyTemplate(PatternMatch match, String templateName) {
        Optional<PatternTemplate> template = templates.find(templateName);
        if (template.isEmpty()) {
            log.error("Template not found: {} (match {} left unchanged)", templateName, match.summary());
            notifyListeners(l -> l.onTemplateNotFound(templateName));
            return TransformResult.templateNotFound(match.node(), templateName);
        }
        TreeNode rewritten = substitutor.substitute(template.get().root(), match.node());
        log.debug("Applied template {} to {}", templateName, match.node().describe());
        notifyListeners(l -> l.onTemplateApplied(templateName, rewritten));
        return TransformResult.applied(rewritten, templateName);
    }

    /**
     * Rewrite a whole tree: the matched node is replaced inside a copy of {@code tree}.
     */
    public TransformResult applyTemplate(TreeNode tree, PatternMatch match, String templateName) {
        TransformResult result = applyTemplate(match, templateName);
        if (!result.isApplied()) {
            return TransformResult.templateNotFound(tree, templateName);
        }
        return TransformResult.applied(TreeRewriter.replace(tree, match.node(), result.tree()), templateName);
    }

    @Override
    public boolean applyToFile(Path file, String patternName, Path outputPath) {
        Path target = outputPath != null ? outputPath : file;
        try {
            String rendered = transformFile(file, patternName);
            if (rendered == null) {
                return false;
            }
            write(target, rendered);
            log.info("Applied {} template to {} -> {}", patternName, file, target);
            return true;
        } catch (ParseFailureException e) {
            log.warn("Cannot transform {}: {}", file, e.getMessage());
            notifyListeners(l -> l.onParseFailure(file, e.getMessage()));
            return false;
        } catch (WriteFailureException e) {
            log.error(e.getMessage());
            notifyListeners(l -> l.onWriteFailure(target, e));
            return false;
        }
    }

    /**
     * Render the rewritten tree of a file, or null when there is nothing to apply.
     */
    String transformFile(Path file, String patternName) {
        SourceTreeParser parser = parsers.stream()
                .filter(p -> p.supports(file))
                .findFirst()
                .orElseThrow(() -> new ParseFailureException(file, "No parser available"));
        TreeNode tree = parser.parse(file);

        Optional<PatternMatch> best = detectionService.detect(tree, file.toString()).stream()
                .filter(m -> m.patternName().equals(patternName))
                .findFirst();
        if (best.isEmpty()) {
            log.info("No {} pattern found in {}", patternName, file);
            return null;
        }

        TransformResult result = applyTemplate(tree, best.get(), patternName);
        if (!result.isApplied()) {
            return null;
        }
        return printer.print(result.tree());
    }

    private void write(Path target, String content) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new WriteFailureException(target, e);
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
