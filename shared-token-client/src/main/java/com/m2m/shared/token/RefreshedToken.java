package com.m2m.shared.token;

import java.time.Duration;

public record RefreshedToken(String accessToken, Duration lifetime) {

    @Override
    public String toString() {
        return "RefreshedToken[lifetime=" + lifetime + "]";
    }
}
