package com.promptoptimizer.application.optimization.exception;

public class BatchTooLargeException extends RuntimeException {

    public BatchTooLargeException(int size, int maxSize) {
        super(String.format("Batch contains %d prompts; the maximum is %d.", size, maxSize));
    }
}
