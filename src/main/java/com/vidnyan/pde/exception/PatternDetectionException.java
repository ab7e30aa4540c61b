package com.vidnyan.pde.exception;

/**
 * Base type for failures raised by the detection engine.
 */
public class PatternDetectionException extends RuntimeException {

    public PatternDetectionException(String message) {
        super(message);
    }

    public PatternDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
