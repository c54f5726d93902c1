package com.truledgr.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required settings are missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String PLACEHOLDER_SECRET = "dev-only-jwt-secret-change-me-before-deploying";
    private static final int MIN_SECRET_BYTES = 32;
    private static final long MIN_ACCESS_TTL_MILLIS = 300_000L;
    private static final long MAX_ACCESS_TTL_MILLIS = 86_400_000L;

    private static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_PROPERTIES) {
            String value = environment.getProperty(key);
            if (value == null || value.isBlank()) {
                problems.add(key + ": missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank())
                .ifPresent(secret -> {
                    if (secret.equals(PLACEHOLDER_SECRET) && !isDevProfile()) {
                        problems.add("jwt.secret: placeholder value is only allowed with the dev profile");
                    }
                    if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
                        problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes");
                    }
                });

        Optional.ofNullable(environment.getProperty("jwt.expiration"))
                .filter(value -> !value.isBlank())
                .ifPresent(value -> {
                    try {
                        long expiration = Long.parseLong(value.trim());
                        if (expiration < MIN_ACCESS_TTL_MILLIS || expiration > MAX_ACCESS_TTL_MILLIS) {
                            problems.add("jwt.expiration: must be between 300000 and 86400000 milliseconds");
                        }
                    } catch (NumberFormatException e) {
                        problems.add("jwt.expiration: must be a number of milliseconds");
                    }
                });

        if (!problems.isEmpty()) {
            log.error("Environment validation failed:");
            problems.forEach(problem -> log.error("  - {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        log.info("Environment validation passed");
    }

    private boolean isDevProfile() {
        return Arrays.asList(environment.getActiveProfiles()).contains("dev");
    }
}
