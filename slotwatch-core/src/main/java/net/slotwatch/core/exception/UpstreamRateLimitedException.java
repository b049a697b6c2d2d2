package net.slotwatch.core.exception;

import java.time.Duration;

public class UpstreamRateLimitedException extends UpstreamException {
    private final Duration retryAfter;

    public UpstreamRateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
