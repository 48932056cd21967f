package com.promptoptimizer.domain.optimization.exception;

/**
 * Thrown when a strategy receives null or blank text.
 */
public class InvalidPromptException extends RuntimeException {

    public InvalidPromptException(String message) {
        super(message);
    }
}
