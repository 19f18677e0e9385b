package com.m2m.jwks.auth;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Immutable JWK Set as published by an issuer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JsonWebKeySet(List<JsonWebKey> keys) {

    public JsonWebKeySet {
        if (keys == null) {
            throw new IllegalArgumentException("JWK Set has no 'keys' member");
        }
        keys = List.copyOf(keys);
    }

    public Optional<JsonWebKey> findByKeyId(String kid) {
        return keys.stream()
            .filter(k -> kid.equals(k.kid()))
            .findFirst();
    }
}
