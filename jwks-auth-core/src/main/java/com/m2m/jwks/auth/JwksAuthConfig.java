package com.m2m.jwks.auth;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.function.UnaryOperator;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class JwksAuthConfig {

    private URI jwkSetUri;
    private Duration cacheTtl = Duration.ofMinutes(5);
    private Duration httpTimeout = Duration.ofSeconds(10);
    private Duration leeway = ValidationPolicy.DEFAULT_LEEWAY;
    private Set<String> issuers = Collections.emptySet();
    private Set<String> audiences = Collections.emptySet();
    private String headerName = "Authorization";

    /**
     * Hook that applies the configured leeway and, when set, restricts issuer and audience.
     */
    public UnaryOperator<ValidationPolicy> validationHook() {
        Duration configuredLeeway = leeway;
        Set<String> configuredIssuers = (issuers == null) ? Set.of() : Set.copyOf(issuers);
        Set<String> configuredAudiences = (audiences == null) ? Set.of() : Set.copyOf(audiences);

        return policy -> {
            ValidationPolicy.ValidationPolicyBuilder builder = policy.toBuilder();
            if (configuredLeeway != null) {
                builder.leeway(configuredLeeway);
            }
            if (!configuredIssuers.isEmpty()) {
                builder.issuers(configuredIssuers).requiredClaim("iss");
            }
            if (!configuredAudiences.isEmpty()) {
                builder.audiences(configuredAudiences).requiredClaim("aud");
            }
            return builder.build();
        };
    }
}
