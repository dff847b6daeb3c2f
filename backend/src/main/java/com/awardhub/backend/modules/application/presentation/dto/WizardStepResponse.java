package com.awardhub.backend.modules.application.presentation.dto;

import java.util.UUID;

/**
 * One wizard step as stored in the draft. {@code saved} is false when {@code data} is a prefill or absent.
 */
public record WizardStepResponse<T>(UUID rewardId, int step, boolean saved, T data) {
}
