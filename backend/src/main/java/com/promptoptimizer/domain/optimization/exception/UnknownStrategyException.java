package com.promptoptimizer.domain.optimization.exception;

public class UnknownStrategyException extends RuntimeException {

    private final String strategyName;

    public UnknownStrategyException(String strategyName) {
        super("Unknown optimization strategy: " + strategyName);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
