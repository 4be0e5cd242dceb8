package com.purchasingpower.repoagent.exception;

public class RateLimitedException extends TransientUpstreamException {

    public RateLimitedException(String detail) {
        super("API rate limit exceeded. Please try again in a few moments. (" + detail + ")");
    }
}
