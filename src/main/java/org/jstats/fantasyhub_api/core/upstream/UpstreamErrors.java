package org.jstats.fantasyhub_api.core.upstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Exception types and status translation shared by the platform clients.
 * <ul>
 *     <li>404 -> {@link NotFoundException} (callers map it to an empty result)</li>
 *     <li>401/403 -> {@link UpstreamAuthException} (no retry)</li>
 *     <li>429 -> {@link RateLimitedException} (retry)</li>
 *     <li>5xx -> {@link Upstream5xxException} (retry)</li>
 *     <li>other 4xx -> {@link UpstreamClientException} (no retry)</li>
 *     <li>unreadable body -> {@link UpstreamJsonParseException} (no retry)</li>
 * </ul>
 */
public final class UpstreamErrors {

    private static final Logger log = LoggerFactory.getLogger(UpstreamErrors.class);

    private UpstreamErrors() {
    }

    public static class UpstreamException extends RuntimeException {
        public UpstreamException(String message) { super(message); }
        public UpstreamException(String message, Throwable cause) { super(message, cause); }
    }

    public static final class NotFoundException extends UpstreamException {
        public NotFoundException(String what) { super("Not found: " + what); }
    }

    public static final class RateLimitedException extends UpstreamException {
        public final Duration retryAfter;
        public RateLimitedException(Duration ra) {
            super("Rate limited, retry after " + ra.toSeconds() + "s");
            this.retryAfter = ra;
        }
    }

    public static final class Upstream5xxException extends UpstreamException {
        public final int status;
        public Upstream5xxException(int status) {
            super("Upstream HTTP " + status);
            this.status = status;
        }
    }

    public static final class UpstreamAuthException extends UpstreamException {
        public final int status;
        public UpstreamAuthException(int status) {
            super("Upstream rejected credentials: HTTP " + status);
            this.status = status;
        }
    }

    public static final class UpstreamClientException extends UpstreamException {
        public final int status;
        public UpstreamClientException(int status, String preview) {
            super(problemMsg("Upstream 4xx: HTTP " + status, preview));
            this.status = status;
        }
    }

    public static final class UpstreamJsonParseException extends UpstreamException {
        public UpstreamJsonParseException(String msg) { super(msg); }
    }

    /** Raised by the clients' recover handlers once retries are exhausted. */
    public static final class UpstreamUnavailableException extends UpstreamException {
        public UpstreamUnavailableException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Installs the status handlers every platform call shares.
     */
    public static RestClient.ResponseSpec guard(RestClient.ResponseSpec spec, String what) {
        return spec
                .onStatus(s -> s.value() == 404, (req, res) -> { throw new NotFoundException(what); })
                .onStatus(s -> s.value() == 401 || s.value() == 403, (req, res) -> {
                    throw new UpstreamAuthException(res.getStatusCode().value());
                })
                .onStatus(s -> s.value() == 429, (req, res) -> {
                    throw new RateLimitedException(parseRetryAfter(res.getHeaders()));
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    throw new Upstream5xxException(res.getStatusCode().value());
                });
    }

    /**
     * Runs a call and translates the exceptions RestClient raises outside the status handlers.
     */
    public static <T> T translate(String source, String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpClientErrorException ex) {
            var status = ex.getStatusCode().value();
            var bodyBytes = ex.getResponseBodyAsByteArray();
            var preview = new String(bodyBytes, 0, Math.min(bodyBytes.length, 500), StandardCharsets.UTF_8);
            if (log.isWarnEnabled()) {
                log.warn("{} client error {} for {}. Body: {}", source, status, what, preview);
            }
            throw new UpstreamClientException(status, preview);
        } catch (HttpMessageConversionException conv) {
            var cause = conv.getCause();
            var msg = (cause instanceof com.fasterxml.jackson.core.JsonProcessingException jp)
                    ? jp.getOriginalMessage()
                    : conv.getMessage();
            if (log.isErrorEnabled()) {
                log.error("Failed to parse {} JSON for {}: {}", source, what, msg);
            }
            throw new UpstreamJsonParseException(msg);
        }
    }

    /**
     * Decides what a recover handler throws: failures that were never retried keep their type,
     * everything else becomes {@link UpstreamUnavailableException}.
     */
    public static RuntimeException exhausted(String source, String what, RuntimeException ex) {
        if (ex instanceof UpstreamJsonParseException
                || ex instanceof UpstreamAuthException
                || ex instanceof UpstreamClientException
                || ex instanceof NotFoundException) {
            return ex;
        }
        if (ex instanceof RateLimitedException rl) {
            log.warn("Recover after rate limit from {} for {}. Retry-After ~{}s", source, what, rl.retryAfter.toSeconds());
        } else if (ex instanceof ResourceAccessException) {
            log.error("Recover after IO error while calling {} for {}", source, what, ex);
        } else {
            log.error("Recover after upstream failure from {} for {}: {}", source, what, ex.getMessage());
        }
        return new UpstreamUnavailableException(source + " unavailable for " + what + ": " + ex.getMessage(), ex);
    }

    static Duration parseRetryAfter(HttpHeaders headers) {
        var ra = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (ra == null || ra.isBlank()) return Duration.ofSeconds(2);
        try { return Duration.ofSeconds(Math.max(1, Long.parseLong(ra.trim()))); }
        catch (NumberFormatException ignore) { return Duration.ofSeconds(2); }
    }

    private static String problemMsg(String leading, String preview) {
        if (preview == null || preview.isBlank()) return leading;
        var safe = preview.length() > 500 ? preview.substring(0, 500) : preview;
        return leading + ": " + safe;
    }
}
