package com.awardhub.backend.modules.auth.presentation;

import com.awardhub.backend.modules.auth.application.AuthService;
import com.awardhub.backend.modules.auth.application.PasswordResetService;
import com.awardhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.awardhub.backend.modules.auth.presentation.dto.LogoutRequest;
import com.awardhub.backend.modules.auth.presentation.dto.MessageResponse;
import com.awardhub.backend.modules.auth.presentation.dto.PasswordResetCodeRequest;
import com.awardhub.backend.modules.auth.presentation.dto.PasswordResetRequest;
import com.awardhub.backend.modules.auth.presentation.dto.RefreshRequest;
import com.awardhub.backend.modules.auth.presentation.dto.SigninRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final PasswordResetService passwordResetService;

    public AuthController(AuthService authService, PasswordResetService passwordResetService) {
        this.authService = authService;
        this.passwordResetService = passwordResetService;
    }

    @Operation(summary = "Sign in", description = "Exchanges phone number and password for a token pair.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Signed in"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "403", description = "Account inactive")
    })
    @PostMapping("/signin")
    public ResponseEntity<LoginResponse> signin(@Valid @RequestBody SigninRequest request) {
        return ResponseEntity.ok(authService.signin(request));
    }

    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        return ResponseEntity.ok(authService.refresh(request));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@Valid @RequestBody LogoutRequest request) {
        authService.logout(request);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Send password reset code")
    @PostMapping("/password/reset-code")
    public ResponseEntity<MessageResponse> sendResetCode(@Valid @RequestBody PasswordResetCodeRequest request) {
        passwordResetService.sendResetCode(request.phoneNumber());
        return ResponseEntity.ok(new MessageResponse("Password reset code sent"));
    }

    @Operation(summary = "Reset password with an SMS code")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password updated"),
            @ApiResponse(responseCode = "400", description = "Invalid or expired code")
    })
    @PostMapping("/password/reset")
    public ResponseEntity<MessageResponse> resetPassword(@Valid @RequestBody PasswordResetRequest request) {
        passwordResetService.resetPassword(request);
        return ResponseEntity.ok(new MessageResponse("Password has been reset successfully"));
    }
}
