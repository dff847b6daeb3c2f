package com.awardhub.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.awardhub.backend.modules.application.domain.Application;

/**
 * Current state of the application a notification points at.
 */
public record ApplicationSnapshotResponse(
        UUID id,
        String rewardName,
        String status,
        String statusDisplay,
        String area,
        String district,
        String activity,
        OffsetDateTime createdAt
) {

    public static ApplicationSnapshotResponse from(Application application) {
        return new ApplicationSnapshotResponse(
                application.getId(),
                application.getReward().getName(),
                application.getStatus().name(),
                application.getStatus().getDisplayName(),
                application.getArea().getDisplayName(),
                application.getDistrict(),
                application.getActivity(),
                application.getCreatedAt()
        );
    }
}
