package com.m2m.shared.token;

public class TokenStoreException extends SharedTokenException {

    public TokenStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
