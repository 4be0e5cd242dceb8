package com.purchasingpower.repoagent.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached result of a provider connectivity check.
 */
public record ConnectivityStatus(State state, String message, Instant timestamp, Duration ttl) {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    public static ConnectivityStatus ok(Instant now, Duration ttl) {
        return new ConnectivityStatus(State.OK, null, now, ttl);
    }

    public static ConnectivityStatus error(String message, Instant now, Duration ttl) {
        return new ConnectivityStatus(State.ERROR, message, now, ttl);
    }

    public boolean isOk() {
        return state == State.OK;
    }

    public boolean isStale(Instant now) {
        return !now.isBefore(timestamp.plus(ttl));
    }

    public enum State {
        OK,
        ERROR
    }
}
