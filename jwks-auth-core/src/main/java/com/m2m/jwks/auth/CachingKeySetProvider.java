package com.m2m.jwks.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the most recently fetched JWK Set in a single slot and refetches it once its TTL has passed.
 * <p>
 * The lock is held for the whole fill, network call included. Concurrent callers that find the slot
 * empty or expired queue up behind the first one and read what it stored, so there is never more than
 * one fetch in flight per instance. A failed fetch leaves the slot as it was.
 * <p>
 * Meant to be built once and shared by all request threads.
 */
@Slf4j
public final class CachingKeySetProvider implements KeySetProvider {

    private final URI jwkSetUri;
    private final Duration ttl;
    private final UnaryOperator<ValidationPolicy> validationHook;
    private final KeySetFetcher fetcher;
    private final Clock clock;
    private final ObjectMapper mapper;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong fetchCount = new AtomicLong();
    private CacheEntry cached;

    private record CacheEntry(JsonWebKeySet value, Instant expiry) {
        boolean isExpired(Instant now) {
            return !now.isBefore(expiry);
        }
    }

    private CachingKeySetProvider(Builder builder) {
        this.jwkSetUri = builder.jwkSetUri;
        this.ttl = builder.ttl;
        this.validationHook = builder.validationHook;
        this.fetcher = builder.fetcher;
        this.clock = builder.clock;
        this.mapper = builder.mapper;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Cache fetching over HTTP, with TTL, timeout and validation rules taken from the config.
     */
    public static CachingKeySetProvider create(JwksAuthConfig config) {
        HttpClient http = HttpClient.newBuilder()
            .connectTimeout(config.getHttpTimeout())
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

        return builder()
            .jwkSetUri(config.getJwkSetUri())
            .ttl(config.getCacheTtl())
            .validationHook(config.validationHook())
            .fetcher(new HttpKeySetFetcher(http, config.getHttpTimeout()))
            .build();
    }

    @Override
    public JsonWebKeySet getKeys() throws AuthException {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw AuthException.missingCredentials("interrupted while waiting for JWK Set from " + jwkSetUri, ie);
        }

        try {
            if (cached == null || cached.isExpired(clock.instant())) {
                JsonWebKeySet keys = fetchKeySet();
                cached = new CacheEntry(keys, clock.instant().plus(ttl));
            }
            return cached.value();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public ValidationPolicy adjustValidation(ValidationPolicy policy) {
        return Objects.requireNonNull(validationHook.apply(policy), "validation hook returned null");
    }

    /**
     * Drops the cached key set so that the next {@link #getKeys()} fetches again.
     */
    public void invalidate() {
        lock.lock();
        try {
            cached = null;
        } finally {
            lock.unlock();
        }
    }

    public long getFetchCount() {
        return fetchCount.get();
    }

    public URI getJwkSetUri() {
        return jwkSetUri;
    }

    public Duration getTtl() {
        return ttl;
    }

    private JsonWebKeySet fetchKeySet() throws AuthException {
        fetchCount.incrementAndGet();
        log.info("Fetching JWK Set from {}", jwkSetUri);

        byte[] payload;
        try {
            payload = fetcher.fetch(jwkSetUri);
        } catch (KeySetFetchException e) {
            log.warn("Failed to fetch JWK Set from {}", jwkSetUri, e);
            throw AuthException.missingCredentials(e.getMessage(), e);
        }

        if (payload == null) {
            throw AuthException.missingCredentials("empty response from " + jwkSetUri, null);
        }

        try {
            JsonWebKeySet keys = mapper.readValue(payload, JsonWebKeySet.class);
            if (keys == null) {
                throw AuthException.missingCredentials("malformed JWK Set from " + jwkSetUri, null);
            }
            log.info("Cached {} keys from {}", keys.keys().size(), jwkSetUri);
            return keys;
        } catch (IOException e) {
            log.warn("Failed to parse JWK Set from {}", jwkSetUri, e);
            throw AuthException.missingCredentials("malformed JWK Set from " + jwkSetUri + ": " + e.getMessage(), e);
        }
    }

    public static final class Builder {
        private URI jwkSetUri;
        private Duration ttl;
        private UnaryOperator<ValidationPolicy> validationHook;
        private KeySetFetcher fetcher;
        private Clock clock = Clock.systemUTC();
        private ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        private Builder() {}

        public Builder jwkSetUri(URI jwkSetUri) {
            this.jwkSetUri = jwkSetUri;
            return this;
        }

        public Builder jwkSetUri(String jwkSetUri) {
            this.jwkSetUri = (jwkSetUri == null) ? null : URI.create(jwkSetUri);
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder validationHook(UnaryOperator<ValidationPolicy> validationHook) {
            this.validationHook = validationHook;
            return this;
        }

        public Builder fetcher(KeySetFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public CachingKeySetProvider build() {
            if (jwkSetUri == null) {
                throw new IllegalStateException("JWK Set URI is required");
            }
            if (ttl == null) {
                throw new IllegalStateException("TTL is required");
            }
            if (validationHook == null) {
                throw new IllegalStateException("Validation hook is required");
            }
            if (fetcher == null) {
                throw new IllegalStateException("Key set fetcher is required");
            }
            return new CachingKeySetProvider(this);
        }
    }
}
