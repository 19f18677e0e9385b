package com.m2m.jwks.auth;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Verified token payload. Everything besides {@code sub} and {@code exp} is carried in {@link #extra()}.
 */
public record Claims(String subject, long expiry, Map<String, Object> extra) {

    public Claims {
        Objects.requireNonNull(subject, "subject");
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public Claims(String subject, long expiry) {
        this(subject, expiry, Map.of());
    }

    /**
     * Value of the named claim, or {@code null} when absent.
     */
    public Object get(String name) {
        if (name == null) {
            return null;
        }
        return switch (name) {
            case "sub" -> subject;
            case "exp" -> expiry;
            default -> extra.get(name);
        };
    }

    @JsonValue
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sub", subject);
        map.put("exp", expiry);
        map.putAll(extra);
        return map;
    }
}
