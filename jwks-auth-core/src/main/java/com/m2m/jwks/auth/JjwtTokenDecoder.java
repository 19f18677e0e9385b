package com.m2m.jwks.auth;

import java.security.PublicKey;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;

/**
 * {@link TokenDecoder} using JJWT for signature, {@code exp} and {@code nbf} checks. Required claims,
 * issuer and audience are checked against the policy afterwards.
 */
public class JjwtTokenDecoder implements TokenDecoder {

    @Override
    public Claims decode(String token, String algorithm, PublicKey key, ValidationPolicy policy)
        throws AuthException {
        if (!policy.getAlgorithms().contains(algorithm)) {
            throw AuthException.invalidToken("algorithm " + algorithm + " is not allowed");
        }

        io.jsonwebtoken.Claims body;
        try {
            JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .clockSkewSeconds(policy.getLeeway().toSeconds())
                .build();
            Jws<io.jsonwebtoken.Claims> jws = parser.parseSignedClaims(token);
            body = jws.getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw AuthException.invalidToken(e.getMessage(), e);
        }

        for (String claim : policy.getRequiredClaims()) {
            if (body.get(claim) == null) {
                throw AuthException.invalidToken("missing required claim '" + claim + "'");
            }
        }
        if (!policy.getIssuers().isEmpty() && !policy.getIssuers().contains(body.getIssuer())) {
            throw AuthException.invalidToken("issuer " + body.getIssuer() + " is not accepted");
        }
        if (!policy.getAudiences().isEmpty() && !anyMatch(body.getAudience(), policy.getAudiences())) {
            throw AuthException.invalidToken("audience " + body.getAudience() + " is not accepted");
        }

        return toClaims(body);
    }

    private static boolean anyMatch(Set<String> actual, Set<String> accepted) {
        return actual != null && actual.stream().anyMatch(accepted::contains);
    }

    private static Claims toClaims(io.jsonwebtoken.Claims body) throws AuthException {
        String subject = body.getSubject();
        if (subject == null) {
            throw AuthException.invalidToken("missing required claim 'sub'");
        }
        Date expiration = body.getExpiration();
        if (expiration == null) {
            throw AuthException.invalidToken("missing required claim 'exp'");
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        for (Map.Entry<String, Object> claim : body.entrySet()) {
            String name = claim.getKey();
            Object value = claim.getValue();
            if ("sub".equals(name) || "exp".equals(name) || value == null) {
                continue;
            }
            extra.put(name, jsonValue(value));
        }
        return new Claims(subject, expiration.getTime() / 1000, extra);
    }

    private static Object jsonValue(Object value) {
        if (value instanceof Date date) {
            return date.getTime() / 1000;
        }
        if (value instanceof Collection<?> collection) {
            return Collections.unmodifiableList(new ArrayList<>(collection));
        }
        return value;
    }
}
