package com.m2m.shared.token;

@FunctionalInterface
public interface TokenCall<T, X extends Exception> {

    T call(String accessToken) throws X;
}
