package com.vidnyan.pde.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * The external parser could not produce a tree for a file.
 */
@Getter
public class ParseFailureException extends PatternDetectionException {

    private final Path file;

    public ParseFailureException(Path file, String message) {
        super("Failed to parse " + file + ": " + message);
        this.file = file;
    }

    public ParseFailureException(Path file, String message, Throwable cause) {
        super("Failed to parse " + file + ": " + message, cause);
        this.file = file;
    }
}
