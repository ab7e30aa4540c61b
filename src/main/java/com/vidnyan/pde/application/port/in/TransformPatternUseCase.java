package com.vidnyan.pde.application.port.in;

import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.transform.TransformResult;

import java.nio.file.Path;

/**
 * Use case: rewrite matched code using registered templates.
 */
public interface TransformPatternUseCase {

    /**
     * Apply a template to a match. The original tree is never modified.
     * An unknown template yields {@link TransformResult.Status#TEMPLATE_NOT_FOUND}
     * carrying the original node.
     */
    TransformResult applyTemplate(PatternMatch match, String templateName);

    /**
     * Parse a file, rewrite the best match of the pattern with the pattern's
     * template and write the rendered tree.
     *
     * @param outputPath target file, null to overwrite the source
     * @return true when the output was written
     */
    boolean applyToFile(Path file, String patternName, Path outputPath);
}
