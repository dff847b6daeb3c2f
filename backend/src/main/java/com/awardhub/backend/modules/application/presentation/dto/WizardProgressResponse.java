package com.awardhub.backend.modules.application.presentation.dto;

import java.util.UUID;

public record WizardProgressResponse(
        UUID rewardId,
        boolean personalInfoCompleted,
        boolean activityInfoCompleted,
        boolean documentsCompleted,
        int completedSteps,
        int currentStep,
        boolean readyToSubmit
) {
}
