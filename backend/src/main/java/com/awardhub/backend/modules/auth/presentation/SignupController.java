package com.awardhub.backend.modules.auth.presentation;

import com.awardhub.backend.modules.auth.application.SignupService;
import com.awardhub.backend.modules.auth.presentation.dto.LoginResponse;
import com.awardhub.backend.modules.auth.presentation.dto.SignupResendRequest;
import com.awardhub.backend.modules.auth.presentation.dto.SignupStartRequest;
import com.awardhub.backend.modules.auth.presentation.dto.SignupStartResponse;
import com.awardhub.backend.modules.auth.presentation.dto.SignupVerifyRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth/signup")
public class SignupController {

    private final SignupService signupService;

    public SignupController(SignupService signupService) {
        this.signupService = signupService;
    }

    @Operation(summary = "Start signup", description = "Validates the registration form and texts a verification code.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Code sent"),
            @ApiResponse(responseCode = "400", description = "Form invalid or user already exists")
    })
    @PostMapping("/start")
    public ResponseEntity<SignupStartResponse> start(@Valid @RequestBody SignupStartRequest request) {
        return ResponseEntity.ok(signupService.start(request));
    }

    @Operation(summary = "Verify signup code", description = "Creates the account from the pending form.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Account created"),
            @ApiResponse(responseCode = "400", description = "Wrong or expired code, or signup session expired")
    })
    @PostMapping("/verify")
    public ResponseEntity<LoginResponse> verify(@Valid @RequestBody SignupVerifyRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(signupService.verify(request));
    }

    @PostMapping("/resend")
    public ResponseEntity<SignupStartResponse> resend(@Valid @RequestBody SignupResendRequest request) {
        return ResponseEntity.ok(signupService.resend(request.verificationId()));
    }
}
