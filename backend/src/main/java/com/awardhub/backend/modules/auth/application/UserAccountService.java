package com.awardhub.backend.modules.auth.application;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.global.security.JwtAuthenticationPrincipal;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.awardhub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.awardhub.backend.modules.auth.presentation.dto.UserListResponse;
import com.awardhub.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class UserAccountService {

    static final String REASON_ACCOUNT_CLOSED = "ACCOUNT_CLOSED";

    private static final Logger log = LoggerFactory.getLogger(UserAccountService.class);

    private final AppUserRepository appUserRepository;
    private final AuthService authService;

    public UserAccountService(AppUserRepository appUserRepository, AuthService authService) {
        this.appUserRepository = appUserRepository;
        this.authService = authService;
    }

    @Transactional(readOnly = true)
    public UserProfileResponse getProfile(UUID userId) {
        return UserProfileResponse.from(loadUser(userId));
    }

    /**
     * Owners can read their own record; staff can read anyone's.
     */
    @Transactional(readOnly = true)
    public UserProfileResponse getUser(JwtAuthenticationPrincipal principal, UUID userId) {
        if (!principal.isStaff() && !principal.userId().equals(userId)) {
            throw ProblemException.notFound("USER_NOT_FOUND");
        }
        return UserProfileResponse.from(loadUser(userId));
    }

    @Transactional(readOnly = true)
    public UserListResponse listUsers(String search, Pageable pageable) {
        String pattern = StringUtils.hasText(search) ? "%" + search.trim().toLowerCase(Locale.ROOT) + "%" : null;
        Page<AppUser> page = appUserRepository.search(pattern, pageable);
        return new UserListResponse(
                page.getContent().stream().map(UserProfileResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements()
        );
    }

    public UserProfileResponse updateProfile(UUID userId, UpdateProfileRequest request) {
        AppUser user = loadUser(userId);

        Map<String, String> errors = new LinkedHashMap<>();
        String email = request.email() == null ? null : request.email().trim().toLowerCase(Locale.ROOT);
        if (email != null && appUserRepository.existsByEmailIgnoreCaseAndIdNot(email, userId)) {
            errors.put("email", "User with this email already exists.");
        }
        String phoneNumber = request.phoneNumber() == null ? null : request.phoneNumber().trim();
        if (phoneNumber != null && appUserRepository.existsByPhoneNumberAndIdNot(phoneNumber, userId)) {
            errors.put("phoneNumber", "User with this phone number already exists.");
        }
        if (!errors.isEmpty()) {
            throw ProblemException.validation(errors);
        }

        if (request.firstName() != null) {
            user.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            user.setLastName(request.lastName().trim());
        }
        if (request.otherName() != null) {
            user.setOtherName(request.otherName().trim());
        }
        if (request.gender() != null) {
            user.setGender(request.gender());
        }
        if (email != null) {
            user.setEmail(email);
        }
        if (phoneNumber != null) {
            user.setPhoneNumber(phoneNumber);
        }
        if (request.birthDate() != null) {
            user.setBirthDate(request.birthDate());
        }
        if (request.address() != null) {
            user.setAddress(request.address().trim());
        }
        if (request.workingPlace() != null) {
            user.setWorkingPlace(request.workingPlace().trim());
        }
        return UserProfileResponse.from(appUserRepository.save(user));
    }

    /**
     * Closes the account. The row is kept because applications reference it.
     */
    public void closeAccount(UUID userId) {
        AppUser user = loadUser(userId);
        user.setActive(false);
        appUserRepository.save(user);
        authService.revokeAllSessions(userId, REASON_ACCOUNT_CLOSED);
        log.info("User {} closed their account", userId);
    }

    private AppUser loadUser(UUID userId) {
        return appUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND"));
    }
}
