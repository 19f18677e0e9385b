package com.m2m.jwks.auth.servlet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.m2m.jwks.auth.AuthException;
import com.m2m.jwks.auth.Claims;
import com.m2m.jwks.auth.JsonWebKeySet;
import com.m2m.jwks.auth.JwksAuthConfig;
import com.m2m.jwks.auth.StaticKeySetProvider;
import com.m2m.jwks.auth.TokenVerifier;

import jakarta.servlet.FilterChain;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

@ExtendWith(MockitoExtension.class)
class BearerTokenFilterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private TokenVerifier verifier;
    @Mock
    private HttpServletRequest request;
    @Mock
    private HttpServletResponse response;
    @Mock
    private FilterChain chain;

    private final Map<String, Object> attributes = new HashMap<>();
    private StringWriter body;

    @BeforeEach
    void setUp() throws Exception {
        body = new StringWriter();
        lenient().when(response.getWriter()).thenReturn(new PrintWriter(body));
        lenient().doAnswer(inv -> attributes.put(inv.getArgument(0), inv.getArgument(1)))
            .when(request).setAttribute(anyString(), any());
        lenient().when(request.getAttribute(anyString()))
            .thenAnswer(inv -> attributes.get(inv.<String>getArgument(0)));
    }

    private String error() throws Exception {
        return MAPPER.readTree(body.toString()).get("error").asText();
    }

    @Test
    void attachesClaimsAndContinues() throws Exception {
        Claims claims = new Claims("user-1", 1700000060L);
        when(request.getHeader("Authorization")).thenReturn("Bearer abc.def.ghi");
        when(verifier.verify("abc.def.ghi")).thenReturn(claims);

        new BearerTokenFilter(verifier).doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        assertSame(claims, AuthenticatedRequest.claims(request));
    }

    @Test
    void schemeIsCaseInsensitive() throws Exception {
        when(request.getHeader("Authorization")).thenReturn("bearer abc.def.ghi");
        when(verifier.verify("abc.def.ghi")).thenReturn(new Claims("user-1", 1L));

        new BearerTokenFilter(verifier).doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void missingHeaderIsRejectedBeforeVerification() throws Exception {
        new BearerTokenFilter(verifier).doFilter(request, response, chain);

        verify(response).setStatus(401);
        verify(response).setHeader("WWW-Authenticate", "Bearer");
        verify(chain, never()).doFilter(any(), any());
        verifyNoInteractions(verifier);
        assertEquals("Missing bearer token", error());
    }

    @Test
    void nonBearerSchemeIsRejectedBeforeVerification() throws Exception {
        when(request.getHeader("Authorization")).thenReturn("Basic dXNlcjpwYXNz");

        new BearerTokenFilter(verifier).doFilter(request, response, chain);

        verify(response).setStatus(401);
        verifyNoInteractions(verifier);
    }

    @Test
    void invalidTokenIsUnauthorized() throws Exception {
        when(request.getHeader("Authorization")).thenReturn("Bearer abc.def.ghi");
        when(verifier.verify("abc.def.ghi")).thenThrow(AuthException.invalidToken("JWT expired"));

        new BearerTokenFilter(verifier).doFilter(request, response, chain);

        verify(response).setStatus(401);
        verify(response).setContentType("application/json");
        verify(chain, never()).doFilter(any(), any());
        assertEquals("Invalid token: JWT expired", error());
    }

    @Test
    void missingCredentialsIsInternalServerError() throws Exception {
        when(request.getHeader("Authorization")).thenReturn("Bearer abc.def.ghi");
        when(verifier.verify("abc.def.ghi"))
            .thenThrow(AuthException.missingCredentials("HTTP 503", null));

        new BearerTokenFilter(verifier).doFilter(request, response, chain);

        verify(response).setStatus(500);
        verify(response, never()).setHeader(anyString(), anyString());
        assertEquals("Missing credentials: HTTP 503", error());
    }

    @Test
    void unsupportedAlgorithmIsInternalServerError() throws Exception {
        when(request.getHeader("Authorization")).thenReturn("Bearer abc.def.ghi");
        when(verifier.verify("abc.def.ghi")).thenThrow(AuthException.unsupportedAlgorithm());

        new BearerTokenFilter(verifier).doFilter(request, response, chain);

        verify(response).setStatus(500);
        assertEquals("Unsupported algorithm", error());
    }

    @Test
    void readsConfiguredHeader() throws Exception {
        JwksAuthConfig config = new JwksAuthConfig();
        config.setHeaderName("Secured-Authorization");
        when(request.getHeader("Secured-Authorization")).thenReturn("Bearer abc.def.ghi");
        when(verifier.verify("abc.def.ghi")).thenReturn(new Claims("svc", 1L));

        new BearerTokenFilter(verifier, config).doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
    }

    @Test
    void malformedTokenThroughRealVerifier() throws Exception {
        TokenVerifier real = new TokenVerifier(new StaticKeySetProvider(new JsonWebKeySet(List.of())));
        when(request.getHeader("Authorization")).thenReturn("Bearer not-a-jwt");

        new BearerTokenFilter(real).doFilter(request, response, chain);

        verify(response).setStatus(401);
        assertEquals("Invalid token: invalid format", error());
    }

    @Test
    void claimsOutsideAuthenticatedPathIsProgrammerError() {
        assertThrows(IllegalStateException.class, () -> AuthenticatedRequest.claims(request));
    }
}
