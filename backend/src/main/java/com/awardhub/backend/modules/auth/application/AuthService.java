package com.awardhub.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.domain.UserSession;
import com.awardhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.awardhub.backend.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.awardhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.awardhub.backend.modules.auth.presentation.dto.LogoutRequest;
import com.awardhub.backend.modules.auth.presentation.dto.RefreshRequest;
import com.awardhub.backend.modules.auth.presentation.dto.SigninRequest;
import com.awardhub.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.awardhub.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class AuthService {

    static final String REASON_EXPIRED = "EXPIRED";
    static final String REASON_ROTATED = "ROTATED";
    static final String REASON_LOGOUT = "LOGOUT";
    static final String REASON_DEVICE_MISMATCH = "DEVICE_MISMATCH";
    static final String REASON_USER_INACTIVE = "USER_INACTIVE";
    static final String REASON_PASSWORD_RESET = "PASSWORD_RESET";
    private static final int DEVICE_ID_MAX_LENGTH = 100;

    private final AppUserRepository appUserRepository;
    private final UserSessionRepository userSessionRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;
    private final Clock clock;

    public AuthService(
            AppUserRepository appUserRepository,
            UserSessionRepository userSessionRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.userSessionRepository = userSessionRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
        this.clock = clock;
    }

    public LoginResponse signin(SigninRequest request) {
        AppUser user = appUserRepository.findByPhoneNumber(request.phoneNumber().trim())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS");
        }

        if (!user.isActive()) {
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        return issueSession(user, request.deviceId());
    }

    /**
     * Issues a fresh access/refresh pair for an already authenticated user.
     */
    public LoginResponse issueSession(AppUser user, String rawDeviceId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        userSessionRepository.revokeSessions(user.getId(), now, true, REASON_EXPIRED);

        List<String> roleCodes = user.roleCodes();
        String refreshToken = UUID.randomUUID().toString();
        TokenPairResponse tokens = jwtTokenService.issueTokenPair(user.getId(), user.getPhoneNumber(), roleCodes, refreshToken);
        persistSession(user, refreshToken, tokens, normalizeDeviceId(rawDeviceId));

        return new LoginResponse(tokens, UserProfileResponse.from(user));
    }

    public LoginResponse refresh(RefreshRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        UserSession session = userSessionRepository.findByRefreshTokenHash(hashRefreshToken(request.refreshToken()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN"));

        if (session.getRevokedAt() != null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "INVALID_REFRESH_TOKEN");
        }

        if (!session.getExpiresAt().isAfter(now)) {
            session.revoke(now, REASON_EXPIRED);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_EXPIRED");
        }

        String requestDeviceId = normalizeDeviceId(request.deviceId());
        String sessionDeviceId = normalizeDeviceId(session.getDeviceId());
        if (sessionDeviceId != null && requestDeviceId != null && !Objects.equals(sessionDeviceId, requestDeviceId)) {
            session.revoke(now, REASON_DEVICE_MISMATCH);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "REFRESH_TOKEN_DEVICE_MISMATCH");
        }

        AppUser user = session.getUser();
        if (!user.isActive()) {
            session.revoke(now, REASON_USER_INACTIVE);
            throw new ResponseStatusException(HttpStatus.FORBIDDEN, "USER_INACTIVE");
        }

        // Rotation: the presented token can never be used again.
        session.revoke(now, REASON_ROTATED);
        return issueSession(user, requestDeviceId != null ? requestDeviceId : sessionDeviceId);
    }

    public void logout(LogoutRequest request) {
        // Unknown tokens get the same response so token validity is not disclosed.
        userSessionRepository.revokeByRefreshTokenHash(
                hashRefreshToken(request.refreshToken()),
                OffsetDateTime.now(clock),
                REASON_LOGOUT
        );
    }

    public void revokeAllSessions(UUID userId, String reason) {
        userSessionRepository.revokeSessions(userId, OffsetDateTime.now(clock), false, reason);
    }

    private void persistSession(AppUser user, String refreshToken, TokenPairResponse tokens, String deviceId) {
        OffsetDateTime issuedAt = tokens.issuedAt();

        UserSession session = new UserSession();
        session.setUser(user);
        session.setRefreshTokenHash(hashRefreshToken(refreshToken));
        session.setIssuedAt(issuedAt);
        session.setExpiresAt(issuedAt.plusSeconds(tokens.refreshExpiresIn()));
        session.setDeviceId(deviceId);

        userSessionRepository.save(session);
    }

    static String hashRefreshToken(String refreshToken) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(refreshToken.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    private String normalizeDeviceId(String rawDeviceId) {
        if (rawDeviceId == null) {
            return null;
        }
        String trimmed = rawDeviceId.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > DEVICE_ID_MAX_LENGTH) {
            return trimmed.substring(0, DEVICE_ID_MAX_LENGTH);
        }
        return trimmed;
    }
}
