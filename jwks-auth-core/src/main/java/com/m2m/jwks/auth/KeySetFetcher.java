package com.m2m.jwks.auth;

import java.net.URI;

/**
 * Retrieves the raw JWK Set document. Implementations carry their own timeouts.
 */
@FunctionalInterface
public interface KeySetFetcher {

    byte[] fetch(URI uri) throws KeySetFetchException;
}
