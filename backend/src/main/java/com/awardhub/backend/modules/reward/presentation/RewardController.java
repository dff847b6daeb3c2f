package com.awardhub.backend.modules.reward.presentation;

import java.util.UUID;

import com.awardhub.backend.modules.application.application.ApplicationService;
import com.awardhub.backend.modules.application.domain.ApplicationStatus;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationListResponse;
import com.awardhub.backend.modules.reward.application.RewardService;
import com.awardhub.backend.modules.reward.presentation.dto.RewardDetailResponse;
import com.awardhub.backend.modules.reward.presentation.dto.RewardListResponse;
import com.awardhub.backend.modules.reward.presentation.dto.RewardStatsResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/rewards")
public class RewardController {

    private static final int MAX_PAGE_SIZE = 100;

    private final RewardService rewardService;
    private final ApplicationService applicationService;

    public RewardController(RewardService rewardService, ApplicationService applicationService) {
        this.rewardService = rewardService;
        this.applicationService = applicationService;
    }

    @Operation(summary = "List rewards", description = "Each row carries the number of applications received.")
    @GetMapping
    public ResponseEntity<RewardListResponse> list(
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(rewardService.listRewards(search, pageRequest(page, size)));
    }

    @GetMapping("/{rewardId}")
    public ResponseEntity<RewardDetailResponse> get(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.ok(rewardService.getReward(rewardId));
    }

    @Operation(summary = "Create reward", description = "Staff only. Multipart form with name, description and image.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Reward created"),
            @ApiResponse(responseCode = "400", description = "Missing field, bad image or duplicate name")
    })
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RewardDetailResponse> create(
            @RequestParam(name = "name", required = false) String name,
            @RequestParam(name = "description", required = false) String description,
            @RequestParam(name = "image", required = false) MultipartFile image
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(rewardService.createReward(name, description, image));
    }

    @PatchMapping(value = "/{rewardId}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<RewardDetailResponse> update(
            @PathVariable("rewardId") UUID rewardId,
            @RequestParam(name = "name", required = false) String name,
            @RequestParam(name = "description", required = false) String description,
            @RequestParam(name = "image", required = false) MultipartFile image
    ) {
        return ResponseEntity.ok(rewardService.updateReward(rewardId, name, description, image));
    }

    @DeleteMapping("/{rewardId}")
    public ResponseEntity<Void> delete(@PathVariable("rewardId") UUID rewardId) {
        rewardService.deleteReward(rewardId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{rewardId}/stats")
    public ResponseEntity<RewardStatsResponse> stats(@PathVariable("rewardId") UUID rewardId) {
        return ResponseEntity.ok(rewardService.getStats(rewardId));
    }

    @GetMapping("/{rewardId}/applications")
    public ResponseEntity<ApplicationListResponse> applications(
            @PathVariable("rewardId") UUID rewardId,
            @RequestParam(name = "status", required = false) ApplicationStatus status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(applicationService.listForReward(rewardId, status, search, pageRequest(page, size)));
    }

    private static PageRequest pageRequest(int page, int size) {
        return PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
    }
}
