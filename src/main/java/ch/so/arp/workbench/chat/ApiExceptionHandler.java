package ch.so.arp.workbench.chat;

import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import ch.so.arp.workbench.pipeline.InvalidRequestException;
import ch.so.arp.workbench.resilience.ConfigurationException;
import ch.so.arp.workbench.resilience.UpstreamServiceException;

/**
 * Maps failures of the chat and search endpoints to JSON error bodies.
 * Internal details are logged, never returned.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    static final String UPSTREAM_ERROR = "UPSTREAM_ERROR";
    static final String SERVICE_BUSY = "SERVICE_BUSY";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    static final String GENERIC_MESSAGE = "Internal server error. Please try again later.";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOGGER.warn("Request validation error: {}", message);
        return error(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR, "Malformed request body");
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(InvalidRequestException ex) {
        LOGGER.warn("Request rejected: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler(UpstreamServiceException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(UpstreamServiceException ex) {
        LOGGER.warn("Upstream service '{}' failed after {} attempt(s): {}", ex.getService(), ex.getAttempts(),
                ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, UPSTREAM_ERROR, ex.getMessage());
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<ErrorResponse> handleRejected(RejectedExecutionException ex) {
        LOGGER.warn("Chat worker pool saturated: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, SERVICE_BUSY, "Too many concurrent requests. Please try again later.");
    }

    @ExceptionHandler(CompletionException.class)
    public ResponseEntity<ErrorResponse> handleCompletion(CompletionException ex) {
        Throwable cause = ex.getCause();
        if (cause instanceof InvalidRequestException invalid) {
            return handleInvalidRequest(invalid);
        }
        if (cause instanceof UpstreamServiceException upstream) {
            return handleUpstream(upstream);
        }
        return handleUnexpected(cause != null ? cause : ex);
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
        LOGGER.error("Service is misconfigured: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, GENERIC_MESSAGE);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Throwable ex) {
        LOGGER.error("Unexpected error while handling request", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, GENERIC_MESSAGE);
    }

    /**
     * Describes a failure that happened after a streamed response was opened
     * and can no longer change the HTTP status.
     */
    static StreamError describeStreamFailure(Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof UpstreamServiceException upstream) {
            return new StreamError(UPSTREAM_ERROR, upstream.getMessage(), upstream.getService());
        }
        if (cause instanceof InvalidRequestException invalid) {
            return new StreamError(VALIDATION_ERROR, invalid.getMessage(), null);
        }
        return new StreamError(INTERNAL_ERROR, GENERIC_MESSAGE, null);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message));
    }

    /**
     * JSON body returned for failed requests.
     */
    public record ErrorResponse(String code, String message) {
    }

    /**
     * Payload of the {@code error} event closing a failed stream. {@code service}
     * names the failing upstream, if any.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record StreamError(String code, String message, String service) {
    }
}
