package com.awardhub.backend.modules.reward.presentation.dto;

import java.util.List;

public record RewardListResponse(List<RewardSummaryResponse> items, int page, int size, long totalElements) {
}
