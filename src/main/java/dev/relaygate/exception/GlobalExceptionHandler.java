package dev.relaygate.exception;

import dev.relaygate.config.RequestIdFilter;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.net.URI;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Global exception handler using RFC 7807 Problem Details.
 *
 * <p>Every problem carries {@code success:false} and an {@code error} object with a
 * caller-safe message and the {@code request_id} that correlates to server logs.
 * Domain errors ({@link GatewayException}) map their own status and type; anything
 * unexpected becomes a generic 500 whose detail is only exposed in development.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String TYPE_BASE = "https://relaygate.dev/errors/";

    private final boolean exposeDetails;

    public GlobalExceptionHandler(@Value("${relaygate.preset:development}") String preset) {
        this.exposeDetails = "development".equalsIgnoreCase(preset);
    }

    @ExceptionHandler(GatewayException.class)
    public ProblemDetail handleGateway(GatewayException ex) {
        if (ex.getStatus().is5xxServerError()) log.error("{}: {}", ex.getTitle(), ex.getMessage());
        else log.warn("{}: {}", ex.getTitle(), ex.getMessage());
        ProblemDetail problem = problem(ex.getStatus(), ex.getType(), ex.getTitle(), ex.getMessage());
        ex.properties().forEach(problem::setProperty);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
        List<String> fields = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .toList();
        log.warn("Validation failed: {}", fields);
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation", "Invalid Request", "Validation failed");
        problem.setProperty("fields", fields);
        return problem;
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class, IllegalArgumentException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String detail = ex instanceof HttpMessageNotReadableException ? "Malformed request body" : ex.getMessage();
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Invalid Request", detail);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ProblemDetail handleConflict(IllegalStateException ex) {
        log.warn("State conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "state-conflict", "State Conflict", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "not-found", "Not Found", "No route for " + ex.getResourcePath());
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ProblemDetail handleRateLimited(RequestNotPermitted ex) {
        log.warn("Rate limited: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "rate-limited", "Rate Limited",
                "Too many requests. Please retry later.");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "service-unavailable", "Service Unavailable",
                "Service temporarily unavailable. Please retry later.");
    }

    @ExceptionHandler({TimeoutException.class, AsyncRequestTimeoutException.class})
    public ProblemDetail handleTimeout(Exception ex) {
        log.warn("Upstream timeout: {}", ex.toString());
        return problem(HttpStatus.GATEWAY_TIMEOUT, "timeout", "Gateway Timeout",
                "The provider did not answer in time. Please retry later.");
    }

    @ExceptionHandler(CancellationException.class)
    public ProblemDetail handleCancelled(CancellationException ex) {
        log.info("Request cancelled: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "cancelled", "Request Cancelled", "The request was cancelled");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        ProblemDetail problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal Server Error",
                "An unexpected error occurred. Please try again later.");
        if (exposeDetails) problem.setProperty("details", ex.toString());
        return problem;
    }

    // ── Internal ───────────────────────────────────────────────────

    private ProblemDetail problem(HttpStatus status, String type, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        problem.setProperty("success", false);
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("message", detail);
        error.put("request_id", MDC.get(RequestIdFilter.MDC_KEY));
        problem.setProperty("error", error);
        return problem;
    }
}
