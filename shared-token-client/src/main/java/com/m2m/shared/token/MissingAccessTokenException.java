package com.m2m.shared.token;

public class MissingAccessTokenException extends RefreshFailedException {

    public MissingAccessTokenException(int status, String body) {
        super("Invalid token response: missing access_token", status, body);
    }
}
