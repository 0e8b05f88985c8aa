package com.m2m.shared.token;

public class SharedTokenException extends RuntimeException {

    public SharedTokenException(String message) {
        super(message);
    }

    public SharedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
