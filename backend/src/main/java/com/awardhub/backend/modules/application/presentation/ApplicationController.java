package com.awardhub.backend.modules.application.presentation;

import java.util.UUID;

import com.awardhub.backend.global.security.SecurityUtils;
import com.awardhub.backend.modules.application.application.ApplicationService;
import com.awardhub.backend.modules.application.domain.ApplicationStatus;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationDetailResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationListResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationStatsResponse;
import com.awardhub.backend.modules.application.presentation.dto.UpdateApplicationStatusRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/applications")
public class ApplicationController {

    static final int MAX_PAGE_SIZE = 100;

    private final ApplicationService applicationService;

    public ApplicationController(ApplicationService applicationService) {
        this.applicationService = applicationService;
    }

    @Operation(summary = "List applications", description = "Staff see all applications; other users see their own.")
    @GetMapping
    public ResponseEntity<ApplicationListResponse> list(
            @RequestParam(name = "rewardId", required = false) UUID rewardId,
            @RequestParam(name = "status", required = false) ApplicationStatus status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(applicationService.list(
                SecurityUtils.getCurrentPrincipal(), rewardId, status, search, pageable(page, size)));
    }

    @GetMapping("/mine")
    public ResponseEntity<ApplicationListResponse> mine(
            @RequestParam(name = "status", required = false) ApplicationStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(applicationService.listMine(SecurityUtils.getCurrentUserId(), status, pageable(page, size)));
    }

    @GetMapping("/stats")
    public ResponseEntity<ApplicationStatsResponse> stats() {
        return ResponseEntity.ok(applicationService.stats());
    }

    @GetMapping("/{applicationId}")
    public ResponseEntity<ApplicationDetailResponse> get(@PathVariable("applicationId") UUID applicationId) {
        return ResponseEntity.ok(applicationService.get(SecurityUtils.getCurrentPrincipal(), applicationId));
    }

    @Operation(summary = "Change status", description = "Staff only. Notifies the applicant when the status actually changes.")
    @PatchMapping("/{applicationId}/status")
    public ResponseEntity<ApplicationDetailResponse> updateStatus(
            @PathVariable("applicationId") UUID applicationId,
            @Valid @RequestBody UpdateApplicationStatusRequest request
    ) {
        return ResponseEntity.ok(applicationService.updateStatus(
                applicationId, request.status(), SecurityUtils.getCurrentUserId()));
    }

    static Pageable pageable(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    }
}
