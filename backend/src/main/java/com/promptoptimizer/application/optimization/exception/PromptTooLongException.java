package com.promptoptimizer.application.optimization.exception;

public class PromptTooLongException extends RuntimeException {

    public PromptTooLongException(int length, int maxLength) {
        super(String.format("Prompt is %d characters long; the maximum is %d.", length, maxLength));
    }
}
