package com.purchasingpower.repoagent.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.repoagent.exception.AuthenticationException;
import com.purchasingpower.repoagent.exception.CompletionHttpException;
import com.purchasingpower.repoagent.exception.EmptyResponseException;
import com.purchasingpower.repoagent.exception.EngineException;
import com.purchasingpower.repoagent.exception.MalformedResponseException;
import com.purchasingpower.repoagent.exception.RateLimitedException;
import com.purchasingpower.repoagent.exception.TransientUpstreamException;
import com.purchasingpower.repoagent.exception.UpstreamUnavailableException;
import com.purchasingpower.repoagent.model.CallContext;
import com.purchasingpower.repoagent.model.ChatMessage;
import com.purchasingpower.repoagent.model.CompletionRequest;
import com.purchasingpower.repoagent.model.ServiceType;
import com.purchasingpower.repoagent.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * {@link LLMProvider} for OpenAI-compatible {@code /chat/completions} endpoints (OpenRouter by default).
 *
 * <p>Single attempt per call; retries and model fallback live in
 * {@link com.purchasingpower.repoagent.service.ResilientCompletionService}.
 */
@Slf4j
@Component
public class ChatCompletionClient implements LLMProvider {

    static final String DONE = "[DONE]";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    public ChatCompletionClient(@Qualifier("completionWebClient") WebClient webClient, ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> complete(CompletionRequest request) {
        return Mono.defer(() -> {
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.LLM, "ChatCompletion", log);
            ctx.logRequest("model=" + request.getModelId(), "messages", request.getMessages().size());

            return webClient.post()
                    .uri("/chat/completions")
                    .bodyValue(toRequestBody(request))
                    .exchangeToMono(response -> response.statusCode().is2xxSuccessful()
                            ? response.bodyToMono(String.class).defaultIfEmpty("")
                            : errorBody(response).flatMap(e -> Mono.<String>error(e)))
                    .onErrorMap(WebClientRequestException.class, this::connectionFailure)
                    .map(this::extractContent)
                    .doOnNext(text -> ctx.logResponse(ExternalCallLogger.truncate(text, 200), "chars", text.length()))
                    .doOnError(e -> ctx.logError(e.getMessage(), e));
        });
    }

    @Override
    public Mono<String> stream(CompletionRequest request, Consumer<String> onChunk, Consumer<String> onComplete) {
        return Mono.defer(() -> {
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.LLM, "ChatCompletionStream", log);
            ctx.logRequest("model=" + request.getModelId() + " (stream)");
            StringBuilder full = new StringBuilder();

            return webClient.post()
                    .uri("/chat/completions")
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(toRequestBody(request.asStreaming()))
                    .exchangeToFlux(response -> response.statusCode().is2xxSuccessful()
                            ? response.bodyToFlux(SSE_TYPE)
                            : errorBody(response).flatMapMany(e -> Flux.<ServerSentEvent<String>>error(e)))
                    .onErrorMap(WebClientRequestException.class, this::connectionFailure)
                    .filter(event -> event.data() != null)
                    .map(event -> event.data().trim())
                    .takeWhile(data -> !DONE.equals(data))
                    .<String>handle((data, sink) -> {
                        try {
                            String delta = extractDelta(data);
                            if (delta != null && !delta.isEmpty()) {
                                sink.next(delta);
                            }
                        } catch (EngineException e) {
                            sink.error(e);
                        }
                    })
                    .doOnNext(chunk -> {
                        full.append(chunk);
                        onChunk.accept(chunk);
                    })
                    .then(Mono.fromCallable(() -> {
                        String text = full.toString();
                        ctx.logResponse("stream finished", "chars", text.length());
                        onComplete.accept(text);
                        return text;
                    }))
                    .doOnError(e -> ctx.logError(e.getMessage(), e));
        });
    }

    @Override
    public Mono<List<String>> listModels() {
        return Mono.defer(() -> {
            CallContext ctx = ExternalCallLogger.startCall(ServiceType.LLM, "ListModels", log);
            ctx.logRequest("GET /models");

            return webClient.get()
                    .uri("/models")
                    .exchangeToMono(response -> response.statusCode().is2xxSuccessful()
                            ? response.bodyToMono(String.class).defaultIfEmpty("")
                            : errorBody(response).flatMap(e -> Mono.<String>error(e)))
                    .onErrorMap(WebClientRequestException.class, this::connectionFailure)
                    .map(this::extractModelIds)
                    .doOnNext(ids -> ctx.logResponse(ids.size() + " models advertised"))
                    .doOnError(e -> ctx.logError(e.getMessage(), e));
        });
    }

    @Override
    public String getProviderName() {
        return "openai-compatible";
    }

    private Map<String, Object> toRequestBody(CompletionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(ChatMessage.system(request.getSystemPrompt()));
        }
        messages.addAll(request.getMessages());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.getModelId());
        body.put("messages", messages);
        body.put("temperature", request.getTemperature());
        body.put("max_tokens", request.getMaxTokens());
        if (request.isStreaming()) {
            body.put("stream", true);
        }
        return body;
    }

    String extractContent(String body) {
        if (body == null || body.isBlank()) {
            throw new EmptyResponseException();
        }
        JsonNode root = readTree(body);
        JsonNode choices = root.path("choices");
        if (!choices.isArray()) {
            throw new MalformedResponseException("Invalid response format: Missing choices array");
        }
        if (choices.isEmpty()) {
            throw new MalformedResponseException("No choices returned in API response");
        }
        JsonNode message = choices.get(0).path("message");
        if (!message.isObject()) {
            throw new MalformedResponseException("Invalid choice format: Missing message");
        }
        JsonNode content = message.path("content");
        if (!content.isTextual()) {
            throw new MalformedResponseException("Invalid message format: Content is not a string");
        }
        return content.asText();
    }

    /**
     * Delta text of one stream event; {@code null} for events that carry none.
     * Unparseable events are skipped, an in-band error object fails the stream.
     */
    String extractDelta(String data) {
        JsonNode event;
        try {
            event = objectMapper.readTree(data);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed stream event: {}", ExternalCallLogger.truncate(data, 120));
            return null;
        }
        if (event.hasNonNull("error")) {
            throw new TransientUpstreamException("Stream interrupted by provider: " + errorMessage(event, data));
        }
        JsonNode content = event.path("choices").path(0).path("delta").path("content");
        return content.isTextual() ? content.asText() : null;
    }

    private List<String> extractModelIds(String body) {
        if (body.isBlank()) {
            throw new EmptyResponseException();
        }
        JsonNode data = readTree(body).path("data");
        if (!data.isArray()) {
            throw new MalformedResponseException("Invalid models response: Missing data array");
        }
        List<String> ids = new ArrayList<>();
        data.forEach(model -> {
            if (model.path("id").isTextual()) {
                ids.add(model.path("id").asText());
            }
        });
        return ids;
    }

    private JsonNode readTree(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private Mono<EngineException> errorBody(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> classify(status.value(), body));
    }

    /**
     * Maps a non-2xx status to the exception type that tells the resilience layer what to do next.
     */
    EngineException classify(int status, String body) {
        String detail = errorMessage(null, body);
        if (status == 401 || status == 403) {
            return new AuthenticationException(status, detail);
        }
        if (status == 429) {
            return new RateLimitedException(detail);
        }
        if (status >= 500) {
            return new UpstreamUnavailableException(status, detail);
        }
        return new CompletionHttpException(status, detail);
    }

    private String errorMessage(JsonNode parsed, String raw) {
        JsonNode node = parsed;
        if (node == null) {
            if (raw == null || raw.isBlank()) {
                return "No error details available";
            }
            try {
                node = objectMapper.readTree(raw);
            } catch (JsonProcessingException e) {
                return ExternalCallLogger.truncate(raw, 300);
            }
        }
        if (node.path("error").path("message").isTextual()) {
            return node.path("error").path("message").asText();
        }
        if (node.path("message").isTextual()) {
            return node.path("message").asText();
        }
        return "Unknown error";
    }

    private Throwable connectionFailure(WebClientRequestException e) {
        return new TransientUpstreamException("Could not reach the AI service: " + e.getMessage(), e);
    }
}
