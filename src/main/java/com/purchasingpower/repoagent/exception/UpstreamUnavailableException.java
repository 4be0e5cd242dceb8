package com.purchasingpower.repoagent.exception;

import lombok.Getter;

@Getter
public class UpstreamUnavailableException extends TransientUpstreamException {

    private final int status;

    public UpstreamUnavailableException(int status, String detail) {
        super("The AI service is currently unavailable (status " + status + "). Please try again later. (" + detail + ")");
        this.status = status;
    }
}
