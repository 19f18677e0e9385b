package com.m2m.jwks.auth;

import java.math.BigInteger;
import java.security.AlgorithmParameters;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECParameterSpec;
import java.security.spec.ECPoint;
import java.security.spec.ECPublicKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Map;

import io.jsonwebtoken.io.DecodingException;
import io.jsonwebtoken.io.Decoders;

/**
 * Turns a JWK record into a {@link PublicKey} usable for signature checks.
 * Only RSA and EC keys are supported.
 */
public class KeyMaterialResolver {

    private static final Map<String, String> CURVES = Map.of(
        "P-256", "secp256r1",
        "P-384", "secp384r1",
        "P-521", "secp521r1"
    );

    public PublicKey resolve(JsonWebKey jwk) throws AuthException {
        if ("RSA".equals(jwk.kty())) {
            return rsaKey(jwk);
        }
        if ("EC".equals(jwk.kty())) {
            return ecKey(jwk);
        }
        throw AuthException.unsupportedAlgorithm();
    }

    private static PublicKey rsaKey(JsonWebKey jwk) throws AuthException {
        BigInteger modulus = unsigned("n", jwk.n());
        BigInteger exponent = unsigned("e", jwk.e());
        try {
            return KeyFactory.getInstance("RSA").generatePublic(new RSAPublicKeySpec(modulus, exponent));
        } catch (GeneralSecurityException e) {
            throw AuthException.invalidToken("invalid RSA key " + jwk.kid() + ": " + e.getMessage(), e);
        }
    }

    private static PublicKey ecKey(JsonWebKey jwk) throws AuthException {
        String curve = (jwk.crv() == null) ? null : CURVES.get(jwk.crv());
        if (curve == null) {
            throw AuthException.invalidToken("unsupported EC curve '" + jwk.crv() + "' for key " + jwk.kid());
        }
        BigInteger x = unsigned("x", jwk.x());
        BigInteger y = unsigned("y", jwk.y());
        try {
            AlgorithmParameters parameters = AlgorithmParameters.getInstance("EC");
            parameters.init(new ECGenParameterSpec(curve));
            ECParameterSpec spec = parameters.getParameterSpec(ECParameterSpec.class);
            return KeyFactory.getInstance("EC").generatePublic(new ECPublicKeySpec(new ECPoint(x, y), spec));
        } catch (GeneralSecurityException e) {
            throw AuthException.invalidToken("invalid EC key " + jwk.kid() + ": " + e.getMessage(), e);
        }
    }

    private static BigInteger unsigned(String member, String encoded) throws AuthException {
        if (encoded == null || encoded.isEmpty()) {
            throw AuthException.invalidToken("missing JWK member '" + member + "'");
        }
        try {
            return new BigInteger(1, Decoders.BASE64URL.decode(encoded));
        } catch (DecodingException e) {
            throw AuthException.invalidToken("malformed JWK member '" + member + "': " + e.getMessage(), e);
        }
    }
}
