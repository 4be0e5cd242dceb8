package com.purchasingpower.repoagent.exception;

/**
 * Network blip or temporary upstream failure. Retried, then subject to model fallback.
 */
public class TransientUpstreamException extends EngineException {

    public TransientUpstreamException(String message) {
        super(message);
    }

    public TransientUpstreamException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
