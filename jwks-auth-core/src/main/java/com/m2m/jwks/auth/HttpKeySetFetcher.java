package com.m2m.jwks.auth;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link KeySetFetcher} backed by the JDK HTTP client. Issues a single GET per call, no retries.
 */
public record HttpKeySetFetcher(HttpClient http, Duration timeout) implements KeySetFetcher {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    public HttpKeySetFetcher(HttpClient http) {
        this(http, DEFAULT_TIMEOUT);
    }

    public HttpKeySetFetcher(HttpClient http, Duration timeout) {
        this.http = Objects.requireNonNull(http, "http");
        this.timeout = (timeout == null) ? DEFAULT_TIMEOUT : timeout;
    }

    @Override
    public byte[] fetch(URI uri) throws KeySetFetchException {
        HttpRequest req = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", "application/json")
            .GET()
            .build();

        try {
            HttpResponse<byte[]> resp = http.send(req, HttpResponse.BodyHandlers.ofByteArray());
            int sc = resp.statusCode();
            if (sc < 200 || sc >= 300) {
                throw new KeySetFetchException("Error while getting " + uri + ": HTTP " + sc);
            }
            return resp.body();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new KeySetFetchException("Interrupted while getting " + uri, ie);
        } catch (IOException e) {
            throw new KeySetFetchException("Error while getting " + uri + ": " + e, e);
        }
    }
}
