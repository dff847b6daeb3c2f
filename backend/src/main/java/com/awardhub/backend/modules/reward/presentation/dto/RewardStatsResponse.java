package com.awardhub.backend.modules.reward.presentation.dto;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record RewardStatsResponse(
        UUID rewardId,
        String rewardName,
        long totalApplications,
        Map<String, Long> statusBreakdown,
        List<MonthlyCount> monthly
) {

    public record MonthlyCount(String month, long count) {
    }
}
