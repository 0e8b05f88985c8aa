package com.m2m.shared.token;

import lombok.Getter;

/**
 * The token endpoint rejected a refresh for a reason other than throttling, or could not be reached.
 * A status of {@code -1} means no HTTP response was received.
 */
@Getter
public class RefreshFailedException extends SharedTokenException {

    private final int status;
    private final String body;

    public RefreshFailedException(int status, String body) {
        super("Token refresh failed: HTTP " + status + " - " + body);
        this.status = status;
        this.body = body;
    }

    public RefreshFailedException(String message, Throwable cause) {
        super(message, cause);
        this.status = -1;
        this.body = null;
    }

    protected RefreshFailedException(String message, int status, String body) {
        super(message);
        this.status = status;
        this.body = body;
    }
}
