package com.m2m.jwks.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record JwtHeader(String alg, String kid, String typ) {
}
