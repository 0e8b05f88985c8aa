package com.m2m.shared.token;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the shared token warm from a long-running host by asking the coordinator on a fixed delay.
 * Failures are logged and the schedule keeps going.
 */
@Slf4j
public class ScheduledTokenWarmer implements AutoCloseable {

    private final SharedTokenCoordinator coordinator;
    private final ScheduledExecutorService ses = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "shared-token-warmer");
        t.setDaemon(true);
        return t;
    });

    public ScheduledTokenWarmer(SharedTokenCoordinator coordinator, Duration interval) {
        this(coordinator, interval, interval);
    }

    public ScheduledTokenWarmer(SharedTokenCoordinator coordinator, Duration initialDelay, Duration interval) {
        this.coordinator = coordinator;
        ses.scheduleWithFixedDelay(this::warm, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void warm() {
        try {
            coordinator.getSharedAccessToken();
        } catch (RateLimitedException e) {
            log.warn("Token warm-up skipped, provider cooling down for {} ms", e.retryAfterMs());
        } catch (RuntimeException e) {
            log.warn("Failed to warm shared token", e);
        }
    }

    @Override
    public void close() {
        ses.shutdownNow();
    }
}
