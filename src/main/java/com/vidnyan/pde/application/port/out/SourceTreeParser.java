package com.vidnyan.pde.application.port.out;

import com.vidnyan.pde.domain.tree.TreeNode;
import com.vidnyan.pde.exception.ParseFailureException;

import java.nio.file.Path;

/**
 * Port for the external parser that turns a source file into a tree.
 * Implemented by adapters (e.g., JavaParser adapter).
 */
public interface SourceTreeParser {

    /**
     * Check if this parser handles the given file.
     */
    boolean supports(Path file);

    /**
     * Parse a file into a tree.
     *
     * @throws ParseFailureException when no tree can be produced
     */
    TreeNode parse(Path file);

    /**
     * Get the parser name for logging.
     */
    default String getName() {
        return getClass().getSimpleName();
    }
}
