package com.purchasingpower.repoagent.exception;

/**
 * Base type for every failure the engine surfaces to its callers.
 *
 * <p>{@link #isRetryable()} tells the resilience layer whether another attempt
 * (same model or a fallback model) may succeed.
 */
public abstract class EngineException extends RuntimeException {

    protected EngineException(String message) {
        super(message);
    }

    protected EngineException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
