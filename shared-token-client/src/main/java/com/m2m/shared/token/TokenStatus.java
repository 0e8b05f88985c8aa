package com.m2m.shared.token;

import java.time.Duration;
import java.time.Instant;

public record TokenStatus(boolean tokenCached, Duration backoffRemaining, Instant checkedAt) {

    public boolean coolingDown() {
        return !backoffRemaining.isZero();
    }
}
