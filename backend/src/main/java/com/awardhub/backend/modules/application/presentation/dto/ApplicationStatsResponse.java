package com.awardhub.backend.modules.application.presentation.dto;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ApplicationStatsResponse(
        long totalApplications,
        Map<String, Long> statusBreakdown,
        Map<String, Long> sourceBreakdown,
        long lastSevenDays,
        List<TopRewardResponse> topRewards
) {

    public record TopRewardResponse(UUID rewardId, String rewardName, long applicationsCount) {
    }
}
