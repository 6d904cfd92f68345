package org.jstats.fantasyhub_api.core.config;

import jakarta.validation.ConstraintViolationException;
import org.jstats.fantasyhub_api.core.upstream.UpstreamErrors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.net.URI;
import java.util.concurrent.RejectedExecutionException;

@RestControllerAdvice
public class ProblemHandler {

    private static final Logger log = LoggerFactory.getLogger(ProblemHandler.class);

    private static final String PROBLEM_BASE = "https://api.jstats.org/problems/";

    // Anything thrown as ResponseStatusException becomes a Problem
    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handle(ResponseStatusException ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(ex.getStatusCode(), ex.getReason());
        pd.setType(URI.create(PROBLEM_BASE + ex.getStatusCode().value()));
        pd.setTitle(switch (HttpStatus.valueOf(ex.getStatusCode().value())) {
            case NOT_FOUND -> "Resource Not Found";
            case BAD_REQUEST -> "Bad Request";
            case CONFLICT -> "Conflict";
            default -> "Request Failed";
        });
        return pd;
    }

    @ExceptionHandler({ConstraintViolationException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ProblemDetail badRequest(Exception ex) {
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        pd.setType(URI.create(PROBLEM_BASE + "400"));
        pd.setTitle("Bad Request");
        return pd;
    }

    @ExceptionHandler(UpstreamErrors.RateLimitedException.class)
    public ResponseEntity<ProblemDetail> rateLimited(UpstreamErrors.RateLimitedException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.TOO_MANY_REQUESTS,
                "Rate limit reached at an upstream platform. Please retry later.");
        pd.setType(URI.create(PROBLEM_BASE + "rate-limit"));
        pd.setTitle("Too Many Requests");
        var headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, String.valueOf(ex.retryAfter.toSeconds()));
        return new ResponseEntity<>(pd, headers, HttpStatus.TOO_MANY_REQUESTS);
    }

    @ExceptionHandler(UpstreamErrors.UpstreamJsonParseException.class)
    public ProblemDetail parse(UpstreamErrors.UpstreamJsonParseException ex) {
        var pd = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
        pd.setTitle("Failed to parse upstream JSON");
        pd.setDetail(ex.getMessage());
        return pd;
    }

    @ExceptionHandler(UpstreamErrors.UpstreamException.class)
    public ProblemDetail upstream(UpstreamErrors.UpstreamException ex) {
        var pd = ProblemDetail.forStatus(HttpStatus.BAD_GATEWAY);
        pd.setTitle("Upstream platform error");
        pd.setDetail(ex.getMessage());
        return pd;
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ProblemDetail busy(RejectedExecutionException ex) {
        var pd = ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE,
                "Too many loads queued. Please retry later.");
        pd.setType(URI.create(PROBLEM_BASE + "busy"));
        pd.setTitle("Service Unavailable");
        return pd;
    }

    // Catch any other unexpected exception as a 500 Problem (avoid leaking internals)
    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        ProblemDetail pd = ProblemDetail.forStatusAndDetail(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error. If this persists, contact support.");
        pd.setType(URI.create(PROBLEM_BASE + "internal-error"));
        pd.setTitle("Internal Server Error");
        return pd;
    }
}
