package com.m2m.jwks.auth;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Fixed, in-memory trust source. Handy for tests and for keys shipped with the configuration.
 */
public record StaticKeySetProvider(JsonWebKeySet keys, UnaryOperator<ValidationPolicy> validationHook)
    implements KeySetProvider {

    public StaticKeySetProvider(JsonWebKeySet keys) {
        this(keys, UnaryOperator.identity());
    }

    public StaticKeySetProvider {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(validationHook, "validationHook");
    }

    @Override
    public JsonWebKeySet getKeys() {
        return keys;
    }

    @Override
    public ValidationPolicy adjustValidation(ValidationPolicy policy) {
        return Objects.requireNonNull(validationHook.apply(policy), "validation hook returned null");
    }
}
