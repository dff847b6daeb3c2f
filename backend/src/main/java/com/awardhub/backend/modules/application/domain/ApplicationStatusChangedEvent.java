package com.awardhub.backend.modules.application.domain;

public record ApplicationStatusChangedEvent(
        Application application,
        ApplicationStatus previousStatus,
        ApplicationStatus newStatus
) {
}
