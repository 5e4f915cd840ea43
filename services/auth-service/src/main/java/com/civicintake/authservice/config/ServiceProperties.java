package com.civicintake.authservice.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code civic.service.*}.
 *
 * <pre>
 * civic:
 *   service:
 *     name: auth-service
 *     environment: production
 *     description: Session and authorization service
 * </pre>
 *
 * @param name service name used for logging and metric tags. Required.
 * @param environment deployment environment (development, test, production)
 * @param description human-readable description for the info endpoint
 */
@ConfigurationProperties(prefix = "civic.service")
@Validated
public record ServiceProperties(@NotBlank String name, String environment, String description) {

    public static final String PRODUCTION = "production";

    public ServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }

    public boolean isProduction() {
        return PRODUCTION.equalsIgnoreCase(environment);
    }
}
