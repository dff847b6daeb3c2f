package com.awardhub.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.domain.PendingSignup;
import com.awardhub.backend.modules.auth.domain.PhoneVerification;
import com.awardhub.backend.modules.auth.domain.VerificationPurpose;
import com.awardhub.backend.modules.auth.infrastructure.cache.PendingSignupStore;
import com.awardhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.awardhub.backend.modules.auth.infrastructure.persistence.PhoneVerificationRepository;
import com.awardhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.awardhub.backend.modules.auth.presentation.dto.SignupStartRequest;
import com.awardhub.backend.modules.auth.presentation.dto.SignupStartResponse;
import com.awardhub.backend.modules.auth.presentation.dto.SignupVerifyRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Two-phase signup: the validated form is parked in the cache under a verification id,
 * and the account is only created once the SMS code for that id is confirmed.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class SignupService {

    static final String CODE_SENT_MESSAGE = "Verification code sent to your phone number.";

    private static final Logger log = LoggerFactory.getLogger(SignupService.class);

    private final AppUserRepository appUserRepository;
    private final PhoneVerificationRepository phoneVerificationRepository;
    private final PendingSignupStore pendingSignupStore;
    private final OtpCodeGenerator otpCodeGenerator;
    private final SmsDispatchService smsDispatchService;
    private final PasswordEncoder passwordEncoder;
    private final AuthService authService;
    private final Clock clock;

    public SignupService(
            AppUserRepository appUserRepository,
            PhoneVerificationRepository phoneVerificationRepository,
            PendingSignupStore pendingSignupStore,
            OtpCodeGenerator otpCodeGenerator,
            SmsDispatchService smsDispatchService,
            PasswordEncoder passwordEncoder,
            AuthService authService,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.phoneVerificationRepository = phoneVerificationRepository;
        this.pendingSignupStore = pendingSignupStore;
        this.otpCodeGenerator = otpCodeGenerator;
        this.smsDispatchService = smsDispatchService;
        this.passwordEncoder = passwordEncoder;
        this.authService = authService;
        this.clock = clock;
    }

    public SignupStartResponse start(SignupStartRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        if (!request.password().equals(request.passwordConfirm())) {
            errors.put("passwordConfirm", "Passwords do not match");
        }
        String email = normalizeEmail(request.email());
        String phoneNumber = request.phoneNumber().trim();
        collectDuplicateErrors(errors, email, phoneNumber);
        if (request.pinfl() != null && appUserRepository.existsByPinfl(request.pinfl())) {
            errors.put("pinfl", "User with this PINFL already exists.");
        }
        if (request.passportNumber() != null && appUserRepository.existsByPassportNumberIgnoreCase(request.passportNumber())) {
            errors.put("passportNumber", "User with this passport number already exists.");
        }
        if (!errors.isEmpty()) {
            throw ProblemException.validation(errors);
        }

        PendingSignup pending = new PendingSignup(
                request.firstName().trim(),
                request.lastName().trim(),
                request.otherName().trim(),
                request.gender(),
                email,
                phoneNumber,
                passwordEncoder.encode(request.password()),
                request.birthDate(),
                request.address().trim(),
                request.workingPlace() == null ? null : request.workingPlace().trim(),
                request.pinfl(),
                request.passportNumber().toUpperCase(Locale.ROOT)
        );

        PhoneVerification verification = issueVerification(phoneNumber);
        pendingSignupStore.save(verification.getId(), pending);
        smsDispatchService.sendVerificationCode(phoneNumber, verification.getCode());

        log.info("Signup verification {} issued", verification.getId());
        return new SignupStartResponse(verification.getId(), phoneNumber, verification.getExpiresAt(), CODE_SENT_MESSAGE);
    }

    public LoginResponse verify(SignupVerifyRequest request) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        PhoneVerification verification = phoneVerificationRepository.findById(request.verificationId())
                .filter(candidate -> candidate.getPurpose() == VerificationPurpose.SIGNUP)
                .filter(candidate -> candidate.matches(request.code()))
                .filter(candidate -> !candidate.isUsed())
                .orElseThrow(() -> ProblemException.badRequest("INVALID_VERIFICATION_CODE",
                        "Invalid or expired verification code"));
        if (!verification.isValid(now)) {
            throw ProblemException.badRequest("VERIFICATION_CODE_EXPIRED", "Verification code has expired");
        }

        PendingSignup pending = pendingSignupStore.find(verification.getId())
                .orElseThrow(SignupService::sessionExpired);

        Map<String, String> errors = new LinkedHashMap<>();
        collectDuplicateErrors(errors, pending.email(), pending.phoneNumber());
        if (!errors.isEmpty()) {
            throw ProblemException.validation(errors);
        }

        AppUser user = appUserRepository.save(pending.toUser());
        verification.consumeFor(user);
        phoneVerificationRepository.save(verification);
        pendingSignupStore.remove(verification.getId());

        log.info("User {} registered through signup verification {}", user.getId(), verification.getId());
        return authService.issueSession(user, request.deviceId());
    }

    public SignupStartResponse resend(UUID verificationId) {
        PendingSignup pending = pendingSignupStore.find(verificationId)
                .orElseThrow(SignupService::sessionExpired);

        phoneVerificationRepository.findById(verificationId).ifPresent(previous -> {
            previous.markUsed();
            phoneVerificationRepository.save(previous);
        });

        PhoneVerification verification = issueVerification(pending.phoneNumber());
        pendingSignupStore.save(verification.getId(), pending);
        pendingSignupStore.remove(verificationId);
        smsDispatchService.sendVerificationCode(pending.phoneNumber(), verification.getCode());

        log.info("Signup verification {} reissued as {}", verificationId, verification.getId());
        return new SignupStartResponse(verification.getId(), pending.phoneNumber(), verification.getExpiresAt(),
                CODE_SENT_MESSAGE);
    }

    private PhoneVerification issueVerification(String phoneNumber) {
        phoneVerificationRepository.invalidateUnused(phoneNumber, VerificationPurpose.SIGNUP);
        PhoneVerification verification = new PhoneVerification(
                phoneNumber,
                otpCodeGenerator.nextCode(),
                VerificationPurpose.SIGNUP,
                OffsetDateTime.now(clock)
        );
        return phoneVerificationRepository.save(verification);
    }

    private void collectDuplicateErrors(Map<String, String> errors, String email, String phoneNumber) {
        if (appUserRepository.existsByEmailIgnoreCase(email)) {
            errors.put("email", "User with this email already exists.");
        }
        if (appUserRepository.existsByPhoneNumber(phoneNumber)) {
            errors.put("phoneNumber", "User with this phone number already exists.");
        }
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static ProblemException sessionExpired() {
        return ProblemException.badRequest("SIGNUP_SESSION_EXPIRED",
                "Session expired. Please start signup process again.");
    }
}
