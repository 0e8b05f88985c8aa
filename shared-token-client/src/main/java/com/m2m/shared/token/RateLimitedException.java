package com.m2m.shared.token;

import java.time.Duration;

import lombok.Getter;

/**
 * The upstream provider is throttling refreshes, or a shared cooldown is still active.
 * Callers should wait {@link #getRetryAfter()} before trying again.
 */
@Getter
public class RateLimitedException extends SharedTokenException {

    private final Duration retryAfter;

    public RateLimitedException(Duration retryAfter) {
        super("Upstream token refresh is rate limited, retry after " + retryAfter.toMillis() + " ms");
        this.retryAfter = retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    public long retryAfterMs() {
        return retryAfter.toMillis();
    }
}
