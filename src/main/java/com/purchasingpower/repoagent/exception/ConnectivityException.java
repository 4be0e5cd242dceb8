package com.purchasingpower.repoagent.exception;

/**
 * Raised without touching the network when the cached connectivity check is ERROR.
 */
public class ConnectivityException extends EngineException {

    public ConnectivityException(String message) {
        super("AI provider is unreachable: " + message);
    }
}
