package com.m2m.jwks.auth;

import java.io.IOException;
import java.security.PublicKey;
import java.util.Objects;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;

/**
 * Verifies bearer tokens against the keys of a {@link KeySetProvider}.
 * <p>
 * The token header selects the key by {@code kid}; the header's {@code alg} seeds the default
 * {@link ValidationPolicy}, which the provider may then adjust. Each step fails fast and nothing is retried.
 * Safe for concurrent use.
 */
public class TokenVerifier {

    private final KeySetProvider keySetProvider;
    private final KeyMaterialResolver keyMaterialResolver;
    private final TokenDecoder tokenDecoder;
    private final ObjectMapper mapper;

    public TokenVerifier(KeySetProvider keySetProvider) {
        this(keySetProvider, new KeyMaterialResolver(), new JjwtTokenDecoder());
    }

    public TokenVerifier(KeySetProvider keySetProvider,
                         KeyMaterialResolver keyMaterialResolver,
                         TokenDecoder tokenDecoder) {
        this.keySetProvider = Objects.requireNonNull(keySetProvider, "keySetProvider");
        this.keyMaterialResolver = Objects.requireNonNull(keyMaterialResolver, "keyMaterialResolver");
        this.tokenDecoder = Objects.requireNonNull(tokenDecoder, "tokenDecoder");
        this.mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Claims verify(String token) throws AuthException {
        if (token == null || token.split("\\.", -1).length < 2) {
            throw AuthException.invalidToken("invalid format");
        }

        JwtHeader header = parseHeader(token);

        JsonWebKeySet keys = keySetProvider.getKeys();

        String kid = header.kid();
        if (kid == null) {
            throw AuthException.invalidToken("missing kid header field");
        }

        JsonWebKey jwk = keys.findByKeyId(kid)
            .orElseThrow(() -> AuthException.invalidToken("no matching key found for kid " + kid));

        PublicKey key = keyMaterialResolver.resolve(jwk);

        ValidationPolicy policy = keySetProvider.adjustValidation(ValidationPolicy.forAlgorithm(header.alg()));

        return tokenDecoder.decode(token, header.alg(), key, policy);
    }

    JwtHeader parseHeader(String token) throws AuthException {
        String encoded = token.substring(0, token.indexOf('.'));
        JwtHeader header;
        try {
            header = mapper.readValue(Decoders.BASE64URL.decode(encoded), JwtHeader.class);
        } catch (DecodingException | IOException e) {
            throw AuthException.invalidToken("malformed header: " + e.getMessage(), e);
        }
        if (header == null || header.alg() == null) {
            throw AuthException.invalidToken("missing alg header field");
        }
        return header;
    }
}
