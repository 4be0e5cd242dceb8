package com.purchasingpower.repoagent.exception;

/**
 * Bad caller input (malformed URL, missing field). Never retried.
 */
public class InputValidationException extends EngineException {

    public InputValidationException(String message) {
        super(message);
    }
}
