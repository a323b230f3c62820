package com.media.resolution.strategy;

/**
 * Runtime exception thrown by the chain when a strategy's lookup failed.
 * Ends resolution of the current source only.
 */
public class StrategyFailureException extends RuntimeException {

    private final String strategyName;

    public StrategyFailureException(String strategyName, Throwable cause) {
        super("strategy " + strategyName + " failed: " + cause.getMessage(), cause);
        this.strategyName = strategyName;
    }

    public String getStrategyName() {
        return strategyName;
    }
}
