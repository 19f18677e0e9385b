package com.m2m.jwks.auth;

import java.security.PublicKey;

/**
 * Signature and claim validation of a compact JWS, given the key already selected for it.
 */
@FunctionalInterface
public interface TokenDecoder {

    Claims decode(String token, String algorithm, PublicKey key, ValidationPolicy policy) throws AuthException;
}
