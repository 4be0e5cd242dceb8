package com.purchasingpower.repoagent.exception;

import lombok.Getter;

/**
 * 401/403 from the provider. Retrying with the same credentials cannot help.
 */
@Getter
public class AuthenticationException extends EngineException {

    private final int status;

    public AuthenticationException(int status, String detail) {
        super("Authentication error (status " + status + "). Please check your API key. (" + detail + ")");
        this.status = status;
    }
}
