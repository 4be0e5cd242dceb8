package com.purchasingpower.repoagent.exception;

/**
 * The provider answered 2xx but the body does not have the expected shape.
 * Treated as transient: another attempt or model may answer correctly.
 */
public class MalformedResponseException extends EngineException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
