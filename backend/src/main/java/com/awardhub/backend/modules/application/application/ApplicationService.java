package com.awardhub.backend.modules.application.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.global.security.JwtAuthenticationPrincipal;
import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.domain.ApplicationStatus;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository.SourceCount;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository.StatusCount;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationDetailResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationListResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationStatsResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationStatsResponse.TopRewardResponse;
import com.awardhub.backend.modules.application.presentation.dto.ApplicationSummaryResponse;
import com.awardhub.backend.modules.reward.application.RewardService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional(readOnly = true)
public class ApplicationService {

    static final int TOP_REWARDS = 5;
    static final int RECENT_DAYS = 7;

    private static final Logger log = LoggerFactory.getLogger(ApplicationService.class);

    private final ApplicationRepository applicationRepository;
    private final RewardService rewardService;
    private final ApplicationResponseMapper responseMapper;
    private final Clock clock;

    public ApplicationService(
            ApplicationRepository applicationRepository,
            RewardService rewardService,
            ApplicationResponseMapper responseMapper,
            Clock clock
    ) {
        this.applicationRepository = applicationRepository;
        this.rewardService = rewardService;
        this.responseMapper = responseMapper;
        this.clock = clock;
    }

    /**
     * Staff see every application with applicant data; everyone else only their own.
     */
    public ApplicationListResponse list(
            JwtAuthenticationPrincipal principal,
            UUID rewardId,
            ApplicationStatus status,
            String search,
            Pageable pageable
    ) {
        boolean staff = principal.isStaff();
        UUID userFilter = staff ? null : principal.userId();
        return search(userFilter, rewardId, status, staff ? search : null, staff, pageable);
    }

    public ApplicationListResponse listMine(UUID userId, ApplicationStatus status, Pageable pageable) {
        return search(userId, null, status, null, false, pageable);
    }

    public ApplicationListResponse listForReward(UUID rewardId, ApplicationStatus status, String search, Pageable pageable) {
        rewardService.loadReward(rewardId);
        return search(null, rewardId, status, search, true, pageable);
    }

    public ApplicationDetailResponse get(JwtAuthenticationPrincipal principal, UUID applicationId) {
        Application application = applicationRepository.findDetailedById(applicationId)
                .filter(found -> principal.isStaff() || found.getUser().getId().equals(principal.userId()))
                .orElseThrow(() -> ProblemException.notFound("APPLICATION_NOT_FOUND"));
        return responseMapper.toDetail(application);
    }

    @Transactional
    public ApplicationDetailResponse updateStatus(UUID applicationId, ApplicationStatus newStatus, UUID actorId) {
        Application application = applicationRepository.findDetailedById(applicationId)
                .orElseThrow(() -> ProblemException.notFound("APPLICATION_NOT_FOUND"));
        ApplicationStatus previous = application.getStatus();
        if (application.changeStatus(newStatus)) {
            application = applicationRepository.saveAndFlush(application);
            log.info("Application {} moved from {} to {} by {}", applicationId, previous, newStatus, actorId);
        }
        return responseMapper.toDetail(application);
    }

    public ApplicationStatsResponse stats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (ApplicationStatus status : ApplicationStatus.values()) {
            byStatus.put(status.name(), 0L);
        }
        for (StatusCount count : applicationRepository.countByStatus(null)) {
            byStatus.put(count.getStatus().name(), count.getTotal());
        }

        Map<String, Long> bySource = new LinkedHashMap<>();
        for (SourceCount count : applicationRepository.countBySource()) {
            bySource.put(count.getSource(), count.getTotal());
        }

        OffsetDateTime since = OffsetDateTime.now(clock).minusDays(RECENT_DAYS);
        List<TopRewardResponse> topRewards = applicationRepository.findTopRewards(PageRequest.of(0, TOP_REWARDS))
                .stream()
                .map(top -> new TopRewardResponse(top.getRewardId(), top.getRewardName(), top.getTotal()))
                .toList();

        return new ApplicationStatsResponse(
                applicationRepository.count(),
                byStatus,
                bySource,
                applicationRepository.countByCreatedAtGreaterThanEqual(since),
                topRewards
        );
    }

    private ApplicationListResponse search(
            UUID userId,
            UUID rewardId,
            ApplicationStatus status,
            String search,
            boolean includeApplicant,
            Pageable pageable
    ) {
        String pattern = StringUtils.hasText(search) ? "%" + search.trim().toLowerCase(Locale.ROOT) + "%" : null;
        Page<Application> page = applicationRepository.search(userId, rewardId, status, pattern, pageable);
        List<ApplicationSummaryResponse> items = page.getContent().stream()
                .map(application -> responseMapper.toSummary(application, includeApplicant))
                .toList();
        return new ApplicationListResponse(items, page.getNumber(), page.getSize(), page.getTotalElements());
    }
}
