package com.awardhub.backend.modules.application.presentation.dto;

import java.util.List;

public record ApplicationListResponse(List<ApplicationSummaryResponse> items, int page, int size, long totalElements) {
}
