package com.m2m.jwks.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One public key record of a JWK Set. Only the members needed for RSA and EC verification keys are kept.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonWebKey(
    String kid,
    String kty,
    String alg,
    String use,
    String n,
    String e,
    String crv,
    String x,
    String y
) {

    public static JsonWebKey rsa(String kid, String n, String e) {
        return new JsonWebKey(kid, "RSA", null, "sig", n, e, null, null, null);
    }

    public static JsonWebKey ec(String kid, String crv, String x, String y) {
        return new JsonWebKey(kid, "EC", null, "sig", null, null, crv, x, y);
    }
}
