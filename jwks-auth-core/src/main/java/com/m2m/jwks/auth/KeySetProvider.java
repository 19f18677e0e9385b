package com.m2m.jwks.auth;

/**
 * Source of trusted verification keys, plus the chance to tune validation for that source.
 */
public interface KeySetProvider {

    JsonWebKeySet getKeys() throws AuthException;

    default ValidationPolicy adjustValidation(ValidationPolicy policy) {
        return policy;
    }
}
