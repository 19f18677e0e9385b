package com.m2m.jwks.auth;

public class KeySetFetchException extends Exception {
    private static final long serialVersionUID = 1L;

    public KeySetFetchException(String message) {
        super(message);
    }

    public KeySetFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
