package com.awardhub.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import com.awardhub.backend.modules.auth.application.JwtTokenService;
import com.awardhub.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.awardhub.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.awardhub.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.awardhub.backend.modules.auth.presentation.dto.TokenPairResponse;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-with-more-than-32-bytes!";
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void issuedTokenCarriesPhoneAndRoles() {
        JwtTokenService service = service(Clock.fixed(NOW, ZoneOffset.UTC));
        UUID userId = UUID.randomUUID();

        TokenPairResponse pair = service.issueTokenPair(userId, "+998901234567", List.of("USER", "STAFF"), "refresh");
        ParsedToken parsed = service.parseAccessToken(pair.accessToken());

        assertThat(pair.tokenType()).isEqualTo("Bearer");
        assertThat(pair.expiresIn()).isEqualTo(900);
        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.phoneNumber()).isEqualTo("+998901234567");
        assertThat(parsed.roles()).containsExactly("USER", "STAFF");
    }

    @Test
    void expiredTokenIsRejected() {
        String token = service(Clock.fixed(NOW, ZoneOffset.UTC))
                .issueTokenPair(UUID.randomUUID(), "+998901234567", List.of("USER"), "refresh")
                .accessToken();
        JwtTokenService later = service(Clock.fixed(NOW.plusSeconds(901), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        String token = new JwtTokenService(new JwtTokenProvider("another-secret-that-is-also-long-enough!!"),
                900_000L, 604_800_000L, Clock.fixed(NOW, ZoneOffset.UTC))
                .issueTokenPair(UUID.randomUUID(), "+998901234567", List.of("USER"), "refresh")
                .accessToken();

        assertThatThrownBy(() -> service(Clock.fixed(NOW, ZoneOffset.UTC)).parseAccessToken(token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shortSecretIsRefused() {
        assertThatThrownBy(() -> new JwtTokenProvider("too-short"))
                .isInstanceOf(IllegalStateException.class);
    }

    private JwtTokenService service(Clock clock) {
        return new JwtTokenService(provider, 900_000L, 604_800_000L, clock);
    }
}
