package com.purchasingpower.repoagent.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the engine's exception taxonomy to HTTP statuses and {@link ApiError} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EngineException.class)
    public ResponseEntity<ApiError> handleEngine(EngineException e, WebRequest request) {
        HttpStatus status;
        String code;
        Map<String, Object> details = null;

        if (e instanceof InvalidReferenceException invalid) {
            status = HttpStatus.BAD_REQUEST;
            code = "INVALID_REPOSITORY_URL";
            details = Map.of("reference", String.valueOf(invalid.getReference()));
        } else if (e instanceof InputValidationException) {
            status = HttpStatus.BAD_REQUEST;
            code = "INVALID_INPUT";
        } else if (e instanceof RepositoryNotLoadedException) {
            status = HttpStatus.CONFLICT;
            code = "REPOSITORY_NOT_LOADED";
        } else if (e instanceof NotFoundException notFound) {
            status = HttpStatus.NOT_FOUND;
            code = "FILE_NOT_FOUND";
            details = Map.of("path", notFound.getPath());
        } else if (e instanceof CloneException clone) {
            status = HttpStatus.BAD_GATEWAY;
            code = "CLONE_FAILED";
            details = Map.of("url", clone.getRepoUrl());
        } else if (e instanceof AuthenticationException) {
            status = HttpStatus.UNAUTHORIZED;
            code = "PROVIDER_AUTHENTICATION_FAILED";
            details = Map.of("hint", "Check app.completion.api-key");
        } else if (e instanceof RateLimitedException) {
            status = HttpStatus.TOO_MANY_REQUESTS;
            code = "RATE_LIMITED";
        } else if (e instanceof ConnectivityException) {
            status = HttpStatus.SERVICE_UNAVAILABLE;
            code = "PROVIDER_UNREACHABLE";
            details = Map.of("hint", "GET /api/v1/connectivity?force=true re-checks the provider");
        } else if (e instanceof TransientUpstreamException || e instanceof MalformedResponseException) {
            status = HttpStatus.BAD_GATEWAY;
            code = "UPSTREAM_UNAVAILABLE";
        } else if (e instanceof CompletionHttpException httpError) {
            status = HttpStatus.BAD_GATEWAY;
            code = "UPSTREAM_REJECTED";
            details = Map.of("upstreamStatus", httpError.getStatus());
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
            code = "REPOSITORY_IO_ERROR";
        }

        if (status.is5xxServerError()) {
            log.error("[ExceptionHandler] {}: {}", code, e.getMessage(), e);
        } else {
            log.warn("[ExceptionHandler] {}: {}", code, e.getMessage());
        }
        return build(status, code, e.getMessage(), request, details);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException e, WebRequest request) {
        Map<String, Object> fields = e.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> String.valueOf(error.getDefaultMessage()),
                        (first, second) -> first));
        log.warn("[ExceptionHandler] Invalid request body: {}", fields);
        return build(HttpStatus.BAD_REQUEST, "INVALID_INPUT", "Request validation failed", request, fields);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleNotReadable(Exception e, WebRequest request) {
        log.warn("[ExceptionHandler] Bad request: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "INVALID_PAYLOAD", e.getMessage(), request, null);
    }

    @ExceptionHandler(UnsupportedOperationException.class)
    public ResponseEntity<ApiError> handleUnsupported(UnsupportedOperationException e, WebRequest request) {
        log.warn("[ExceptionHandler] Unsupported operation: {}", e.getMessage());
        return build(HttpStatus.NOT_IMPLEMENTED, "NOT_SUPPORTED", e.getMessage(), request, null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception e, WebRequest request) {
        log.error("[ExceptionHandler] Unexpected error: ", e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred: " + e.getMessage(), request, null);
    }

    private ResponseEntity<ApiError> build(HttpStatus status, String code, String message,
                                           WebRequest request, Map<String, Object> details) {
        ApiError error = new ApiError(
                OffsetDateTime.now(),
                status.value(),
                status.getReasonPhrase(),
                code,
                message,
                getRequestPath(request),
                details);
        return ResponseEntity.status(status).body(error);
    }

    private String getRequestPath(WebRequest request) {
        if (request instanceof ServletWebRequest servletRequest) {
            return servletRequest.getRequest().getRequestURI();
        }
        return null;
    }
}
