package com.m2m.jwks.auth.servlet;

/**
 * Body written for rejected requests: {@code {"error": "..."}}.
 */
public record ErrorResponse(String error) {
}
