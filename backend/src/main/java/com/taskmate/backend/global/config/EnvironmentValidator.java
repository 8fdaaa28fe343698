package com.taskmate.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required setting is missing or unsafe.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "taskmate-local-development-secret-key-2026!";
    static final int MIN_SECRET_BYTES = 32;
    static final long MIN_TOKEN_TTL_MILLIS = 300_000L;
    static final long MAX_TOKEN_TTL_MILLIS = 2_592_000_000L;

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

        for (String property : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(property));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(property + ": missing");
            }
        }

        Optional<String> jwtSecret = Optional.ofNullable(environment.getProperty("jwt.secret"));
        jwtSecret.filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret: must be at least " + MIN_SECRET_BYTES + " bytes"));
        if (environment.acceptsProfiles(Profiles.of("prod"))
                && jwtSecret.filter(DEV_JWT_SECRET::equals).isPresent()) {
            problems.add("jwt.secret: replace the development default with a random value");
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long ttl = Long.parseLong(raw.trim());
                if (ttl < MIN_TOKEN_TTL_MILLIS || ttl > MAX_TOKEN_TTL_MILLIS) {
                    problems.add("jwt.expiration: must be between " + MIN_TOKEN_TTL_MILLIS + " and "
                            + MAX_TOKEN_TTL_MILLIS + " milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be a number of milliseconds");
            }
        });

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration check failed - {}", problem));
            throw new IllegalStateException("Invalid configuration: " + String.join(", ", problems));
        }

        log.info("Configuration check passed");
    }
}
