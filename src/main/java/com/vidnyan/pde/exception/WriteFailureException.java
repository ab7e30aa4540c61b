package com.vidnyan.pde.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * Persisting transformed output or a report failed.
 */
@Getter
public class WriteFailureException extends PatternDetectionException {

    private final Path target;

    public WriteFailureException(Path target, Throwable cause) {
        super("Failed to write " + target + ": " + cause.getMessage(), cause);
        this.target = target;
    }
}
