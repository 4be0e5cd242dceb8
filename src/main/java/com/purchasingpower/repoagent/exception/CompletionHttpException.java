package com.purchasingpower.repoagent.exception;

import lombok.Getter;

/**
 * Non-2xx answer from the completion endpoint that is neither an auth,
 * rate-limit nor server-side failure (e.g. 400 for an unknown model).
 */
@Getter
public class CompletionHttpException extends EngineException {

    private final int status;

    public CompletionHttpException(int status, String message) {
        super("API request failed with status " + status + ": " + message);
        this.status = status;
    }
}
