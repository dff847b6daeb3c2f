package com.awardhub.backend.modules.application.presentation;

import java.util.List;
import java.util.UUID;

import com.awardhub.backend.global.security.SecurityUtils;
import com.awardhub.backend.modules.application.application.ApplicationWizardService;
import com.awardhub.backend.modules.application.domain.ApplicationDraft.ActivityInfo;
import com.awardhub.backend.modules.application.domain.ApplicationDraft.PersonalInfo;
import com.awardhub.backend.modules.application.presentation.dto.ActivityInfoRequest;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationDetailResponse;
import com.awardhub.backend.modules.application.presentation.dto.DocumentsResponse;
import com.awardhub.backend.modules.application.presentation.dto.PersonalInfoRequest;
import com.awardhub.backend.modules.application.presentation.dto.WizardProgressResponse;
import com.awardhub.backend.modules.application.presentation.dto.WizardReviewResponse;
import com.awardhub.backend.modules.application.presentation.dto.WizardStepResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/applications/wizard/{rewardId}")
public class ApplicationWizardController {

    private final ApplicationWizardService wizardService;

    public ApplicationWizardController(ApplicationWizardService wizardService) {
        this.wizardService = wizardService;
    }

    @Operation(summary = "Step 1 data", description = "Returns the saved step or a prefill from the profile.")
    @GetMapping("/personal-info")
    public ResponseEntity<WizardStepResponse<PersonalInfo>> getPersonalInfo(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.ok(wizardService.getPersonalInfo(SecurityUtils.getCurrentUserId(), rewardId));
    }

    @PutMapping("/personal-info")
    public ResponseEntity<WizardStepResponse<PersonalInfo>> savePersonalInfo(
            @PathVariable("rewardId") UUID rewardId,
            @Valid @RequestBody PersonalInfoRequest request
    ) {
        return ResponseEntity.ok(wizardService.savePersonalInfo(SecurityUtils.getCurrentUserId(), rewardId, request));
    }

    @GetMapping("/activity-info")
    public ResponseEntity<WizardStepResponse<ActivityInfo>> getActivityInfo(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.ok(wizardService.getActivityInfo(SecurityUtils.getCurrentUserId(), rewardId));
    }

    @Operation(summary = "Save step 2", description = "Requires step 1. The description must be at least 50 characters.")
    @PutMapping("/activity-info")
    public ResponseEntity<WizardStepResponse<ActivityInfo>> saveActivityInfo(
            @PathVariable("rewardId") UUID rewardId,
            @Valid @RequestBody ActivityInfoRequest request
    ) {
        return ResponseEntity.ok(wizardService.saveActivityInfo(SecurityUtils.getCurrentUserId(), rewardId, request));
    }

    @GetMapping("/documents")
    public ResponseEntity<WizardStepResponse<DocumentsResponse>> getDocuments(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.ok(wizardService.getDocuments(SecurityUtils.getCurrentUserId(), rewardId));
    }

    @Operation(
            summary = "Save step 3",
            description = """
                    Stages the uploads in temporary storage. \
                    At most 10 certificates and 10 files, each up to 5 MB (pdf, doc, docx, jpg, jpeg, png).
                    """
    )
    @PostMapping(value = "/documents", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<WizardStepResponse<DocumentsResponse>> saveDocuments(
            @PathVariable("rewardId") UUID rewardId,
            @RequestParam(name = "recommendationLetter", required = false) MultipartFile recommendationLetter,
            @RequestParam(name = "certificates", required = false) List<MultipartFile> certificates,
            @RequestParam(name = "files", required = false) List<MultipartFile> files
    ) {
        return ResponseEntity.ok(wizardService.saveDocuments(
                SecurityUtils.getCurrentUserId(), rewardId, recommendationLetter, certificates, files));
    }

    @GetMapping("/review")
    public ResponseEntity<WizardReviewResponse> review(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.ok(wizardService.review(SecurityUtils.getCurrentUserId(), rewardId));
    }

    @GetMapping("/progress")
    public ResponseEntity<WizardProgressResponse> progress(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.ok(wizardService.progress(SecurityUtils.getCurrentUserId(), rewardId));
    }

    @Operation(summary = "Submit application", description = "Creates the application from a complete draft.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Application created"),
            @ApiResponse(responseCode = "400", description = "Draft incomplete, documents expired or already applied")
    })
    @PostMapping("/submit")
    public ResponseEntity<ApplicationDetailResponse> submit(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(wizardService.submit(SecurityUtils.getCurrentUserId(), rewardId));
    }

    @DeleteMapping
    public ResponseEntity<Void> clearDraft(@PathVariable("rewardId") UUID rewardId) {
        wizardService.clearDraft(SecurityUtils.getCurrentUserId(), rewardId);
        return ResponseEntity.noContent().build();
    }
}
