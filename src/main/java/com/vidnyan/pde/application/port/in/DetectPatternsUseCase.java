package com.vidnyan.pde.application.port.in;

import com.vidnyan.pde.domain.pattern.PatternDefinition;
import com.vidnyan.pde.domain.pattern.PatternMatch;
import com.vidnyan.pde.domain.report.DetectionReport;
import com.vidnyan.pde.domain.tree.TreeNode;

import java.nio.file.Path;
import java.util.List;

/**
 * Primary use case: find design idioms in parsed program trees.
 */
public interface DetectPatternsUseCase {

    /**
     * Register a definition; must happen before concurrent detection begins.
     */
    void registerDefinition(PatternDefinition definition);

    /**
     * Detect all registered patterns over a whole tree.
     *
     * @return matches by descending confidence, ties in pre-order discovery order
     */
    List<PatternMatch> detect(TreeNode tree);

    /**
     * Parse a file with the external parser and detect patterns in it.
     * A file that cannot be parsed yields no matches.
     */
    List<PatternMatch> detectInFile(Path file);

    /**
     * Scan every supported file under a directory and fold the matches into a report.
     */
    DetectionReport analyzeProject(Path projectRoot);

    /**
     * Scan the given files and fold the matches into a report.
     */
    DetectionReport analyzeFiles(List<Path> files);
}
