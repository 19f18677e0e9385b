package com.m2m.jwks.auth.servlet;

import java.io.IOException;
import java.util.Objects;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.m2m.jwks.auth.AuthException;
import com.m2m.jwks.auth.Claims;
import com.m2m.jwks.auth.JwksAuthConfig;
import com.m2m.jwks.auth.TokenVerifier;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticates requests carrying {@code Authorization: Bearer <jwt>}.
 * <p>
 * Verified claims are attached to the request before the chain continues, see
 * {@link AuthenticatedRequest#claims(ServletRequest)}. Rejections are answered with a JSON
 * {@link ErrorResponse}; the status follows the {@link AuthException.Kind}.
 */
@Slf4j
public class BearerTokenFilter implements Filter {

    private static final String BEARER = "bearer ";

    private final TokenVerifier verifier;
    private final String headerName;
    private final ObjectMapper mapper;

    public BearerTokenFilter(TokenVerifier verifier) {
        this(verifier, "Authorization", new ObjectMapper());
    }

    public BearerTokenFilter(TokenVerifier verifier, JwksAuthConfig config) {
        this(verifier, config.getHeaderName(), new ObjectMapper());
    }

    public BearerTokenFilter(TokenVerifier verifier, String headerName, ObjectMapper mapper) {
        this.verifier = Objects.requireNonNull(verifier, "verifier");
        this.headerName = (headerName == null || headerName.isBlank()) ? "Authorization" : headerName;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
        throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        String token = bearerToken(httpRequest);
        if (token == null) {
            reject(httpResponse, HttpServletResponse.SC_UNAUTHORIZED, "Missing bearer token");
            return;
        }

        Claims claims;
        try {
            claims = verifier.verify(token);
        } catch (AuthException e) {
            if (e.getKind() == AuthException.Kind.INVALID_TOKEN) {
                log.debug("Rejected token for {} {}: {}", httpRequest.getMethod(), httpRequest.getRequestURI(), e.getMessage());
            } else {
                log.warn("Cannot authenticate {} {}", httpRequest.getMethod(), httpRequest.getRequestURI(), e);
            }
            reject(httpResponse, e.getHttpStatus(), e.getMessage());
            return;
        }

        AuthenticatedRequest.attach(httpRequest, claims);
        chain.doFilter(request, response);
    }

    String bearerToken(HttpServletRequest request) {
        String header = request.getHeader(headerName);
        if (header == null || header.length() <= BEARER.length()
            || !header.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return null;
        }
        String token = header.substring(BEARER.length()).trim();
        return token.isEmpty() ? null : token;
    }

    private void reject(HttpServletResponse response, int status, String message) throws IOException {
        response.setStatus(status);
        if (status == HttpServletResponse.SC_UNAUTHORIZED) {
            response.setHeader("WWW-Authenticate", "Bearer");
        }
        response.setContentType("application/json");
        response.setCharacterEncoding("UTF-8");
        mapper.writeValue(response.getWriter(), new ErrorResponse(message));
    }
}
