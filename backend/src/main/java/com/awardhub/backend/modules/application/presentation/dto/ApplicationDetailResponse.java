package com.awardhub.backend.modules.application.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.awardhub.backend.modules.application.domain.ApplicationStatus;
import com.awardhub.backend.modules.application.domain.Area;

public record ApplicationDetailResponse(
        UUID id,
        UUID rewardId,
        String rewardName,
        ApplicationStatus status,
        String statusDisplay,
        Area area,
        String areaDisplay,
        String district,
        String neighborhood,
        String contactPhone,
        String activity,
        String activityDescription,
        String recommendationLetterUrl,
        String source,
        List<AttachmentResponse> certificates,
        List<AttachmentResponse> files,
        ApplicantResponse applicant,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
