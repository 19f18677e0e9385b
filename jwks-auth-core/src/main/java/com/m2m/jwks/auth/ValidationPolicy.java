package com.m2m.jwks.auth;

import java.time.Duration;
import java.util.Set;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Rules applied when decoding a token whose signature key has been resolved.
 * <p>
 * The default policy ({@link #forAlgorithm(String)}) checks the signature with the header's algorithm,
 * requires {@code exp} and validates {@code exp}/{@code nbf} with a 60 second leeway.
 * Issuer and audience are only checked when a hook adds them.
 */
@Value
@Builder(toBuilder = true)
public class ValidationPolicy {

    public static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(60);

    @Singular
    Set<String> algorithms;

    @Builder.Default
    Duration leeway = DEFAULT_LEEWAY;

    @Singular
    Set<String> requiredClaims;

    @Singular
    Set<String> issuers;

    @Singular
    Set<String> audiences;

    public static ValidationPolicy forAlgorithm(String algorithm) {
        return ValidationPolicy.builder()
            .algorithm(algorithm)
            .requiredClaim("exp")
            .build();
    }
}
