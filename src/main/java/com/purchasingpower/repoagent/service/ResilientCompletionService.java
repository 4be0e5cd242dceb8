package com.purchasingpower.repoagent.service;

import com.purchasingpower.repoagent.client.LLMProvider;
import com.purchasingpower.repoagent.config.ResilienceConfig;
import com.purchasingpower.repoagent.exception.AuthenticationException;
import com.purchasingpower.repoagent.exception.ConnectivityException;
import com.purchasingpower.repoagent.exception.EngineException;
import com.purchasingpower.repoagent.exception.InputValidationException;
import com.purchasingpower.repoagent.model.CompletionRequest;
import com.purchasingpower.repoagent.model.TaskType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import reactor.util.retry.RetryBackoffSpec;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Completion calls with retry on the preferred model and ordered model fallback.
 *
 * <p>Policy:
 * <ol>
 *   <li>fail fast with {@link ConnectivityException} while a fresh cached check is ERROR</li>
 *   <li>preferred model: up to {@code maxAttempts} attempts, fixed delay, retryable errors only</li>
 *   <li>each remaining fallback model once, in order; first success wins</li>
 *   <li>all failed: the last error</li>
 * </ol>
 * Authentication and validation failures end the call at once since no other attempt can succeed.
 */
@Slf4j
@Service
public class ResilientCompletionService {

    private final LLMProvider provider;
    private final ConnectivityMonitor connectivity;
    private final ModelCatalog catalog;
    private final ResilienceConfig config;

    public ResilientCompletionService(LLMProvider provider, ConnectivityMonitor connectivity,
                                      ModelCatalog catalog, ResilienceConfig config) {
        this.provider = provider;
        this.connectivity = connectivity;
        this.catalog = catalog;
        this.config = config;
    }

    /**
     * @param request  conversation; without a model id the best available model for {@code taskType} is used
     * @param taskType decides the degraded-mode model
     */
    public Mono<String> complete(CompletionRequest request, TaskType taskType) {
        return connectivity.ensureReachable()
                .then(resolveModel(request, taskType))
                .flatMap(model -> execute(request, model, provider::complete, e -> true));
    }

    /**
     * Streamed completion under the same policy, except that once a chunk has been
     * delivered the call is never repeated: the caller already holds partial output.
     */
    public Mono<String> stream(CompletionRequest request, TaskType taskType,
                               Consumer<String> onChunk, Consumer<String> onComplete) {
        return Mono.defer(() -> {
            AtomicBoolean emitted = new AtomicBoolean();
            Consumer<String> tracking = chunk -> {
                emitted.set(true);
                onChunk.accept(chunk);
            };
            Predicate<Throwable> beforeFirstChunk = e -> !emitted.get();

            return connectivity.ensureReachable()
                    .then(resolveModel(request, taskType))
                    .flatMap(model -> execute(request, model,
                            attempt -> provider.stream(attempt, tracking, onComplete),
                            beforeFirstChunk));
        });
    }

    private Mono<String> resolveModel(CompletionRequest request, TaskType taskType) {
        if (request.getModelId() != null && !request.getModelId().isBlank()) {
            return Mono.just(request.getModelId());
        }
        return catalog.bestAvailable(catalog.defaultModel(), taskType);
    }

    /**
     * @param mayRepeat false once repeating the call is no longer safe; vetoes both retry and fallback
     */
    private Mono<String> execute(CompletionRequest request, String preferred,
                                 Function<CompletionRequest, Mono<String>> call,
                                 Predicate<Throwable> mayRepeat) {
        int retries = Math.max(config.getMaxAttempts(), 1) - 1;
        RetryBackoffSpec sameModel = Retry.fixedDelay(retries, config.getRetryDelay())
                .filter(mayRepeat.and(this::isRetryable))
                .doBeforeRetry(signal -> log.warn("Attempt {} with {} failed: {}",
                        signal.totalRetries() + 1, preferred, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());

        List<String> fallbacks = catalog.fallbacksExcluding(preferred);
        Predicate<Throwable> fallbackAllowed = mayRepeat.and(this::allowsFallback);

        return Mono.defer(() -> call.apply(request.withModel(preferred)))
                .retryWhen(sameModel)
                .onErrorResume(e -> fallbackAllowed.test(e) && !fallbacks.isEmpty(),
                        e -> fallback(request, call, fallbacks, 0, e, fallbackAllowed));
    }

    private Mono<String> fallback(CompletionRequest request, Function<CompletionRequest, Mono<String>> call,
                                  List<String> models, int index, Throwable lastError,
                                  Predicate<Throwable> fallbackAllowed) {
        if (index >= models.size()) {
            log.error("All models failed; last error: {}", lastError.getMessage());
            return Mono.error(lastError);
        }
        String model = models.get(index);
        log.info("Trying fallback model: {}", model);
        return Mono.defer(() -> call.apply(request.withModel(model)))
                .onErrorResume(fallbackAllowed,
                        e -> {
                            log.warn("Fallback to {} failed: {}", model, e.getMessage());
                            return fallback(request, call, models, index + 1, e, fallbackAllowed);
                        });
    }

    private boolean isRetryable(Throwable e) {
        return e instanceof EngineException engineException && engineException.isRetryable();
    }

    /**
     * Another model may still answer unless the failure is about credentials, input or reachability.
     */
    private boolean allowsFallback(Throwable e) {
        return !(e instanceof AuthenticationException
                || e instanceof InputValidationException
                || e instanceof ConnectivityException);
    }
}
