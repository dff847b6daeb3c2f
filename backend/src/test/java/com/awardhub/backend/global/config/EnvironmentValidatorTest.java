package com.awardhub.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private MockEnvironment environment;

    @BeforeEach
    void setUp() {
        environment = new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/awardhub")
                .withProperty("spring.data.redis.host", "localhost")
                .withProperty("jwt.secret", "a-secret-that-is-long-enough-for-hs256-signing")
                .withProperty("jwt.expiration", "900000")
                .withProperty("app.cors.allowed-origins", "http://localhost:3000")
                .withProperty("awardhub.storage.root", "/tmp/awardhub");
    }

    @Test
    void completeConfigurationPasses() {
        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.collectProblems()).isEmpty();
        validator.validateEnvironment();
    }

    @Test
    void blankRequiredPropertyIsReported() {
        environment.setProperty("jwt.secret", "   ");

        assertThat(new EnvironmentValidator(environment).collectProblems()).containsExactly("jwt.secret is missing");
    }

    @Test
    void accessTokenLifetimeMustStayWithinBounds() {
        environment.setProperty("jwt.expiration", "60000");

        assertThatThrownBy(() -> new EnvironmentValidator(environment).validateEnvironment())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("jwt.expiration must be between");
    }

    @Test
    void nonNumericLifetimeIsReported() {
        environment.setProperty("jwt.expiration", "fifteen minutes");

        assertThat(new EnvironmentValidator(environment).collectProblems())
                .containsExactly("jwt.expiration must be numeric");
    }
}
