package com.awardhub.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when a required setting is missing or obviously wrong.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String[] REQUIRED_PROPERTIES = {
            "spring.datasource.url",
            "spring.data.redis.host",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "awardhub.storage.root"
    };

    private static final String PLACEHOLDER_SECRET = "change-me-awardhub-dev-secret-0123456789abcdef";

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }
        if (PLACEHOLDER_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret still uses the development placeholder");
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_PROPERTIES) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.expiration")).ifPresent(raw -> {
            try {
                long expiration = Long.parseLong(raw.trim());
                // 5 minutes .. 24 hours
                if (expiration < 300_000L || expiration > 86_400_000L) {
                    problems.add("jwt.expiration must be between 300000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException ex) {
                problems.add("jwt.expiration must be numeric");
            }
        });
        return problems;
    }
}
