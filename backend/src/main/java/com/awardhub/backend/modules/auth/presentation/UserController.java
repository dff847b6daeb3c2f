package com.awardhub.backend.modules.auth.presentation;

import java.util.UUID;

import com.awardhub.backend.global.security.SecurityUtils;
import com.awardhub.backend.modules.auth.application.UserAccountService;
import com.awardhub.backend.modules.auth.presentation.dto.UpdateProfileRequest;
import com.awardhub.backend.modules.auth.presentation.dto.UserListResponse;
import com.awardhub.backend.modules.auth.presentation.dto.UserProfileResponse;

import jakarta.validation.Valid;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class UserController {

    private static final int MAX_PAGE_SIZE = 100;

    private final UserAccountService userAccountService;

    public UserController(UserAccountService userAccountService) {
        this.userAccountService = userAccountService;
    }

    @GetMapping("/me")
    public ResponseEntity<UserProfileResponse> me() {
        return ResponseEntity.ok(userAccountService.getProfile(SecurityUtils.getCurrentUserId()));
    }

    @PatchMapping("/me")
    public ResponseEntity<UserProfileResponse> updateMe(@Valid @RequestBody UpdateProfileRequest request) {
        return ResponseEntity.ok(userAccountService.updateProfile(SecurityUtils.getCurrentUserId(), request));
    }

    @DeleteMapping("/me")
    public ResponseEntity<Void> deleteMe() {
        userAccountService.closeAccount(SecurityUtils.getCurrentUserId());
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public ResponseEntity<UserListResponse> listUsers(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return ResponseEntity.ok(userAccountService.listUsers(search, PageRequest.of(safePage, safeSize)));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserProfileResponse> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(userAccountService.getUser(SecurityUtils.getCurrentPrincipal(), userId));
    }
}
