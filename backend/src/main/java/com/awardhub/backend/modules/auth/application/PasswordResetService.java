package com.awardhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.domain.PasswordResetCode;
import com.awardhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.awardhub.backend.modules.auth.infrastructure.persistence.PasswordResetCodeRepository;
import com.awardhub.backend.modules.auth.presentation.dto.PasswordResetRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class PasswordResetService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    private final AppUserRepository appUserRepository;
    private final PasswordResetCodeRepository passwordResetCodeRepository;
    private final OtpCodeGenerator otpCodeGenerator;
    private final SmsDispatchService smsDispatchService;
    private final PasswordEncoder passwordEncoder;
    private final AuthService authService;
    private final Clock clock;

    public PasswordResetService(
            AppUserRepository appUserRepository,
            PasswordResetCodeRepository passwordResetCodeRepository,
            OtpCodeGenerator otpCodeGenerator,
            SmsDispatchService smsDispatchService,
            PasswordEncoder passwordEncoder,
            AuthService authService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.passwordResetCodeRepository = passwordResetCodeRepository;
        this.otpCodeGenerator = otpCodeGenerator;
        this.smsDispatchService = smsDispatchService;
        this.passwordEncoder = passwordEncoder;
        this.authService = authService;
        this.clock = clock;
    }

    public void sendResetCode(String rawPhoneNumber) {
        String phoneNumber = rawPhoneNumber.trim();
        if (!appUserRepository.existsByPhoneNumber(phoneNumber)) {
            throw ProblemException.validation(Map.of("phoneNumber", "User with this phone number does not exist"));
        }
        PasswordResetCode resetCode = passwordResetCodeRepository.save(
                new PasswordResetCode(phoneNumber, otpCodeGenerator.nextCode()));
        smsDispatchService.sendPasswordResetCode(phoneNumber, resetCode.getCode());
        log.info("Password reset code {} issued", resetCode.getId());
    }

    public void resetPassword(PasswordResetRequest request) {
        String phoneNumber = request.phoneNumber().trim();
        PasswordResetCode resetCode = passwordResetCodeRepository
                .findFirstByPhoneNumberAndCodeOrderByCreatedAtDesc(phoneNumber, request.code())
                .orElseThrow(() -> ProblemException.badRequest("INVALID_RESET_CODE", "Invalid code"));

        if (!resetCode.isValid(OffsetDateTime.now(clock))) {
            throw ProblemException.badRequest("RESET_CODE_EXPIRED", "The code is expired");
        }

        AppUser user = appUserRepository.findByPhoneNumber(phoneNumber)
                .orElseThrow(() -> ProblemException.badRequest("INVALID_RESET_CODE", "Invalid code"));
        user.setPasswordHash(passwordEncoder.encode(request.newPassword()));
        appUserRepository.save(user);
        passwordResetCodeRepository.delete(resetCode);
        authService.revokeAllSessions(user.getId(), AuthService.REASON_PASSWORD_RESET);

        log.info("Password reset completed for user {}", user.getId());
    }
}
