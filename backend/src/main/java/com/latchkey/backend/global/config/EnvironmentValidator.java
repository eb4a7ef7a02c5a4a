package com.latchkey.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Refuses to finish start-up while a required setting is missing or still holds a shipped default.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_TOKEN_SECRET = "dev-token-secret-change-me-before-deploying-0000";
    static final String DEFAULT_REMEMBER_ME_SECRET = "dev-remember-me-secret-change-me";
    static final int MIN_TOKEN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "latchkey.token.secret",
            "latchkey.remember-me.secret",
            "latchkey.remember-me.salt",
            "latchkey.mail.base-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = findProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Invalid configuration: {}", problem));
            throw new IllegalStateException("Configuration validation failed: " + String.join("; ", problems));
        }
        log.info("Configuration validated");
    }

    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            if (!StringUtils.hasText(environment.getProperty(key))) {
                problems.add(key + " is missing");
            }
        }

        Optional.ofNullable(environment.getProperty("latchkey.token.secret")).ifPresent(secret -> {
            if (secret.equals(DEFAULT_TOKEN_SECRET)) {
                problems.add("latchkey.token.secret still holds the shipped default");
            }
            if (secret.getBytes(StandardCharsets.UTF_8).length < MIN_TOKEN_SECRET_BYTES) {
                problems.add("latchkey.token.secret must be at least " + MIN_TOKEN_SECRET_BYTES + " bytes");
            }
        });
        Optional.ofNullable(environment.getProperty("latchkey.remember-me.secret"))
                .filter(DEFAULT_REMEMBER_ME_SECRET::equals)
                .ifPresent(secret -> problems.add("latchkey.remember-me.secret still holds the shipped default"));
        Optional.ofNullable(environment.getProperty("latchkey.remember-me.salt"))
                .filter(StringUtils::hasText)
                .filter(salt -> !salt.matches("(?:[0-9a-fA-F]{2}){8,}"))
                .ifPresent(salt -> problems.add("latchkey.remember-me.salt must be hex encoded, at least 8 bytes"));

        checkPositiveDuration("latchkey.token.confirmation-ttl", problems);
        checkPositiveDuration("latchkey.token.password-reset-ttl", problems);
        return problems;
    }

    private void checkPositiveDuration(String key, List<String> problems) {
        String raw = environment.getProperty(key);
        if (!StringUtils.hasText(raw)) {
            return;
        }
        try {
            Duration duration = Duration.parse(raw.trim());
            if (duration.isNegative() || duration.isZero()) {
                problems.add(key + " must be positive");
            }
        } catch (DateTimeParseException ex) {
            problems.add(key + " must be an ISO-8601 duration such as PT10M");
        }
    }
}
