package com.awardhub.backend.modules.application.presentation.dto;

import java.util.UUID;

import com.awardhub.backend.modules.application.domain.ApplicationDraft.ActivityInfo;
import com.awardhub.backend.modules.application.domain.ApplicationDraft.PersonalInfo;

public record WizardReviewResponse(
        UUID rewardId,
        String rewardName,
        PersonalInfo personalInfo,
        ActivityInfo activityInfo,
        DocumentsResponse documents
) {
}
