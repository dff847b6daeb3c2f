package com.awardhub.backend.modules.application.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.awardhub.backend.modules.application.domain.ApplicationStatus;
import com.awardhub.backend.modules.application.domain.Area;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * List row. {@code applicant} is only filled for staff.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApplicationSummaryResponse(
        UUID id,
        UUID rewardId,
        String rewardName,
        ApplicationStatus status,
        String statusDisplay,
        Area area,
        String areaDisplay,
        String district,
        String activity,
        String source,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        ApplicantResponse applicant
) {
}
