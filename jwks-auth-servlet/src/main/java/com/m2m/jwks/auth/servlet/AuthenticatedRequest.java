package com.m2m.jwks.auth.servlet;

import com.m2m.jwks.auth.Claims;

import jakarta.servlet.ServletRequest;

/**
 * Access to the claims that {@link BearerTokenFilter} attached to the current request.
 */
public final class AuthenticatedRequest {

    public static final String CLAIMS_ATTRIBUTE = Claims.class.getName();

    private AuthenticatedRequest() {}

    static void attach(ServletRequest request, Claims claims) {
        request.setAttribute(CLAIMS_ATTRIBUTE, claims);
    }

    /**
     * @throws IllegalStateException if the request did not pass through {@link BearerTokenFilter}
     */
    public static Claims claims(ServletRequest request) {
        Object claims = request.getAttribute(CLAIMS_ATTRIBUTE);
        if (!(claims instanceof Claims verified)) {
            throw new IllegalStateException("No verified claims on request; is BearerTokenFilter mapped for this path?");
        }
        return verified;
    }
}
