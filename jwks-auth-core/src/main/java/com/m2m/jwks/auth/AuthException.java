package com.m2m.jwks.auth;

import lombok.Getter;

/**
 * Failure of a token verification.
 * <p>
 * The {@link Kind} separates defects of the presented token from failures on our side
 * (unreachable key set, unsupported key family), which matters when mapping to a response status.
 */
@Getter
public class AuthException extends Exception {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_TOKEN(401),
        MISSING_CREDENTIALS(500),
        UNSUPPORTED_ALGORITHM(500);

        private final int httpStatus;

        Kind(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }
    }

    private final Kind kind;

    private AuthException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static AuthException invalidToken(String reason) {
        return new AuthException(Kind.INVALID_TOKEN, "Invalid token: " + reason, null);
    }

    public static AuthException invalidToken(String reason, Throwable cause) {
        return new AuthException(Kind.INVALID_TOKEN, "Invalid token: " + reason, cause);
    }

    public static AuthException missingCredentials(String reason, Throwable cause) {
        return new AuthException(Kind.MISSING_CREDENTIALS, "Missing credentials: " + reason, cause);
    }

    public static AuthException unsupportedAlgorithm() {
        return new AuthException(Kind.UNSUPPORTED_ALGORITHM, "Unsupported algorithm", null);
    }

    public int getHttpStatus() {
        return kind.httpStatus();
    }
}
