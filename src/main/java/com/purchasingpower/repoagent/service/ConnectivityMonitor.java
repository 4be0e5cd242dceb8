package com.purchasingpower.repoagent.service;

import com.purchasingpower.repoagent.client.LLMProvider;
import com.purchasingpower.repoagent.config.ModelConfig;
import com.purchasingpower.repoagent.config.ResilienceConfig;
import com.purchasingpower.repoagent.exception.AuthenticationException;
import com.purchasingpower.repoagent.exception.ConnectivityException;
import com.purchasingpower.repoagent.exception.EngineException;
import com.purchasingpower.repoagent.exception.RateLimitedException;
import com.purchasingpower.repoagent.model.ConnectivityStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Cached provider reachability check.
 *
 * <p>A fresh check lists the provider's models. The result is authoritative for
 * {@code app.resilience.connectivity-ttl}; while a cached ERROR is fresh, completion calls
 * fail through {@link #ensureReachable()} without contacting the provider. A check that
 * failed on credentials or rate limiting re-raises that error instead of reporting the
 * provider unreachable. Concurrent checks may both hit the provider; the last one to
 * finish wins the cache.
 */
@Slf4j
@Component
public class ConnectivityMonitor {

    static final String CRITICAL_MODELS_MISSING = "Critical models are unavailable. Some features may not work.";

    private final LLMProvider provider;
    private final ModelConfig modelConfig;
    private final Duration ttl;
    private final Clock clock;

    private volatile CachedCheck cached;

    public ConnectivityMonitor(LLMProvider provider, ModelConfig modelConfig,
                               ResilienceConfig resilienceConfig, Clock clock) {
        this.provider = provider;
        this.modelConfig = modelConfig;
        this.ttl = resilienceConfig.getConnectivityTtl();
        this.clock = clock;
    }

    /**
     * @param force ignore a fresh cached result and ask the provider again
     */
    public Mono<ConnectivityStatus> check(boolean force) {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            CachedCheck current = cached;
            if (!force && current != null && !current.status().isStale(now)) {
                log.debug("Using cached connectivity status {} from {}",
                        current.status().state(), current.status().timestamp());
                return Mono.just(current.status());
            }
            return provider.listModels()
                    .map(advertised -> new CachedCheck(evaluate(advertised, now), null))
                    .onErrorResume(e -> Mono.just(new CachedCheck(
                            ConnectivityStatus.error(e.getMessage(), now, ttl), classifiedCause(e))))
                    .doOnNext(this::store)
                    .map(CachedCheck::status);
        });
    }

    /**
     * Completes empty unless a fresh cached check failed. Fails with the cached credential or
     * rate-limit error when that was the cause, otherwise with {@link ConnectivityException}.
     */
    public Mono<Void> ensureReachable() {
        return Mono.defer(() -> {
            CachedCheck current = cached;
            if (current == null || current.status().isOk() || current.status().isStale(clock.instant())) {
                return Mono.empty();
            }
            if (current.cause() != null) {
                return Mono.error(current.cause());
            }
            return Mono.error(new ConnectivityException(current.status().message()));
        });
    }

    public Optional<ConnectivityStatus> cachedStatus() {
        return Optional.ofNullable(cached).map(CachedCheck::status);
    }

    private ConnectivityStatus evaluate(List<String> advertised, Instant now) {
        List<String> missing = modelConfig.getRequired().stream()
                .filter(model -> !advertised.contains(model))
                .toList();
        if (missing.isEmpty()) {
            return ConnectivityStatus.ok(now, ttl);
        }

        log.warn("Some required models are unavailable: {}", String.join(", ", missing));
        boolean hasFallback = modelConfig.getFallbacks().stream().anyMatch(advertised::contains);
        return hasFallback
                ? ConnectivityStatus.ok(now, ttl)
                : ConnectivityStatus.error(CRITICAL_MODELS_MISSING, now, ttl);
    }

    /**
     * Failures that say nothing about reachability are kept so callers see the real error.
     */
    private EngineException classifiedCause(Throwable e) {
        if (e instanceof AuthenticationException || e instanceof RateLimitedException) {
            return (EngineException) e;
        }
        return null;
    }

    private void store(CachedCheck check) {
        cached = check;
        ConnectivityStatus status = check.status();
        if (status.isOk()) {
            log.info("AI provider {} reachable", provider.getProviderName());
        } else {
            log.warn("AI provider {} check failed: {}", provider.getProviderName(), status.message());
        }
    }

    private record CachedCheck(ConnectivityStatus status, EngineException cause) {
    }
}
