package com.civicintake.authservice;

import com.civicintake.authservice.config.AuthProperties;
import com.civicintake.authservice.config.ServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Civic Intake auth service: login, signup, refresh rotation and the guarded account and audit
 * endpoints.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Actuator health, info, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation and security headers on every request
 *   <li>Envelope-shaped error responses
 *   <li>Scheduled sweeping of expired rate-limit windows
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties({ServiceProperties.class, AuthProperties.class})
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Civic Intake auth service started");
    }
}
