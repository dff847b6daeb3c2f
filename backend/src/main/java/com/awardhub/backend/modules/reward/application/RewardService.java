package com.awardhub.backend.modules.reward.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.global.storage.FileStorage;
import com.awardhub.backend.global.storage.MediaUrls;
import com.awardhub.backend.global.storage.UploadRule;
import com.awardhub.backend.modules.application.domain.ApplicationStatus;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository.RewardCount;
import com.awardhub.backend.modules.reward.domain.Reward;
import com.awardhub.backend.modules.reward.infrastructure.persistence.RewardRepository;
import com.awardhub.backend.modules.reward.presentation.dto.RewardDetailResponse;
import com.awardhub.backend.modules.reward.presentation.dto.RewardListResponse;
import com.awardhub.backend.modules.reward.presentation.dto.RewardStatsResponse;
import com.awardhub.backend.modules.reward.presentation.dto.RewardStatsResponse.MonthlyCount;
import com.awardhub.backend.modules.reward.presentation.dto.RewardSummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

@Service
@Transactional
public class RewardService {

    static final String IMAGE_DIRECTORY = "rewards";
    private static final int STATS_MONTHS = 12;

    private static final Logger log = LoggerFactory.getLogger(RewardService.class);

    private final RewardRepository rewardRepository;
    private final ApplicationRepository applicationRepository;
    private final FileStorage fileStorage;
    private final Clock clock;

    public RewardService(
            RewardRepository rewardRepository,
            ApplicationRepository applicationRepository,
            FileStorage fileStorage,
            Clock clock
    ) {
        this.rewardRepository = rewardRepository;
        this.applicationRepository = applicationRepository;
        this.fileStorage = fileStorage;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public RewardListResponse listRewards(String search, Pageable pageable) {
        String pattern = StringUtils.hasText(search) ? "%" + search.trim().toLowerCase(Locale.ROOT) + "%" : null;
        Page<Reward> page = rewardRepository.search(pattern, pageable);

        List<UUID> ids = page.getContent().stream().map(Reward::getId).toList();
        Map<UUID, Long> counts = ids.isEmpty()
                ? Map.of()
                : applicationRepository.countByRewardIds(ids).stream()
                        .collect(Collectors.toMap(RewardCount::getRewardId, RewardCount::getTotal));

        List<RewardSummaryResponse> items = page.getContent().stream()
                .map(reward -> new RewardSummaryResponse(
                        reward.getId(),
                        reward.getName(),
                        reward.getDescription(),
                        MediaUrls.of(reward.getImagePath()),
                        counts.getOrDefault(reward.getId(), 0L),
                        reward.getCreatedAt()
                ))
                .toList();
        return new RewardListResponse(items, page.getNumber(), page.getSize(), page.getTotalElements());
    }

    @Transactional(readOnly = true)
    public RewardDetailResponse getReward(UUID rewardId) {
        return toDetail(loadReward(rewardId));
    }

    @Transactional(readOnly = true)
    public Reward loadReward(UUID rewardId) {
        return rewardRepository.findById(rewardId)
                .orElseThrow(() -> ProblemException.notFound("REWARD_NOT_FOUND"));
    }

    public RewardDetailResponse createReward(String name, String description, MultipartFile image) {
        Map<String, String> errors = new LinkedHashMap<>();
        String trimmedName = validateName(name, null, errors);
        if (!StringUtils.hasText(description)) {
            errors.put("description", "description is required");
        }
        if (image == null || image.isEmpty()) {
            errors.put("image", "image is required");
        } else {
            UploadRule.IMAGE.check(image).ifPresent(message -> errors.put("image", message));
        }
        if (!errors.isEmpty()) {
            throw ProblemException.validation(errors);
        }

        Reward reward = new Reward(trimmedName, description.trim());
        String stored = fileStorage.store(IMAGE_DIRECTORY, image);
        reward.setImagePath(stored);
        Reward saved = withImageCleanup(null, stored, () -> rewardRepository.saveAndFlush(reward));
        log.info("Reward {} created", saved.getId());
        return toDetail(saved);
    }

    public RewardDetailResponse updateReward(UUID rewardId, String name, String description, MultipartFile image) {
        Reward reward = loadReward(rewardId);

        Map<String, String> errors = new LinkedHashMap<>();
        String trimmedName = name == null ? null : validateName(name, rewardId, errors);
        if (description != null && !StringUtils.hasText(description)) {
            errors.put("description", "description must not be blank");
        }
        boolean replaceImage = image != null && !image.isEmpty();
        if (replaceImage) {
            UploadRule.IMAGE.check(image).ifPresent(message -> errors.put("image", message));
        }
        if (!errors.isEmpty()) {
            throw ProblemException.validation(errors);
        }

        if (trimmedName != null) {
            reward.setName(trimmedName);
        }
        if (description != null) {
            reward.setDescription(description.trim());
        }
        if (!replaceImage) {
            return toDetail(rewardRepository.saveAndFlush(reward));
        }
        String previous = reward.getImagePath();
        String stored = fileStorage.store(IMAGE_DIRECTORY, image);
        reward.setImagePath(stored);
        return toDetail(withImageCleanup(previous, stored, () -> rewardRepository.saveAndFlush(reward)));
    }

    public void deleteReward(UUID rewardId) {
        Reward reward = loadReward(rewardId);
        if (applicationRepository.existsByRewardId(rewardId)) {
            throw ProblemException.badRequest("REWARD_HAS_APPLICATIONS",
                    "Cannot delete a reward that already has applications");
        }
        withImageCleanup(reward.getImagePath(), null, () -> {
            rewardRepository.delete(reward);
            rewardRepository.flush();
            return null;
        });
        log.info("Reward {} deleted", rewardId);
    }

    @Transactional(readOnly = true)
    public RewardStatsResponse getStats(UUID rewardId) {
        Reward reward = loadReward(rewardId);

        Map<ApplicationStatus, Long> byStatus = new EnumMap<>(ApplicationStatus.class);
        for (ApplicationStatus status : ApplicationStatus.values()) {
            byStatus.put(status, 0L);
        }
        applicationRepository.countByStatus(rewardId)
                .forEach(row -> byStatus.put(row.getStatus(), row.getTotal()));
        Map<String, Long> statusBreakdown = new LinkedHashMap<>();
        byStatus.forEach((status, count) -> statusBreakdown.put(status.name(), count));
        long total = byStatus.values().stream().mapToLong(Long::longValue).sum();

        YearMonth current = YearMonth.now(clock);
        YearMonth first = current.minusMonths(STATS_MONTHS - 1L);
        OffsetDateTime since = first.atDay(1).atStartOfDay().atOffset(OffsetDateTime.now(clock).getOffset());
        Map<YearMonth, Long> perMonth = applicationRepository.findCreationTimesSince(rewardId, since).stream()
                .collect(Collectors.groupingBy(YearMonth::from, Collectors.counting()));

        List<MonthlyCount> monthly = new ArrayList<>(STATS_MONTHS);
        for (YearMonth month = first; !month.isAfter(current); month = month.plusMonths(1)) {
            monthly.add(new MonthlyCount(month.toString(), perMonth.getOrDefault(month, 0L)));
        }
        return new RewardStatsResponse(reward.getId(), reward.getName(), total, statusBreakdown, monthly);
    }

    private RewardDetailResponse toDetail(Reward reward) {
        UUID id = reward.getId();
        return new RewardDetailResponse(
                id,
                reward.getName(),
                reward.getDescription(),
                MediaUrls.of(reward.getImagePath()),
                applicationRepository.countByRewardId(id),
                applicationRepository.countByRewardIdAndStatusIn(id, ApplicationStatus.PENDING),
                applicationRepository.countByRewardIdAndStatusIn(id, List.of(ApplicationStatus.AWARDED)),
                reward.getCreatedAt(),
                reward.getUpdatedAt()
        );
    }

    private String validateName(String name, UUID currentId, Map<String, String> errors) {
        if (!StringUtils.hasText(name)) {
            errors.put("name", "name is required");
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.length() > 100) {
            errors.put("name", "name must be at most 100 characters");
            return trimmed;
        }
        boolean duplicate = currentId == null
                ? rewardRepository.existsByNameIgnoreCase(trimmed)
                : rewardRepository.existsByNameIgnoreCaseAndIdNot(trimmed, currentId);
        if (duplicate) {
            errors.put("name", "Reward with this name already exists");
        }
        return trimmed;
    }

    /**
     * Runs a database write that swaps reward images on disk. {@code obsolete} is removed once the
     * write commits; {@code fresh} is removed if it rolls back. Without an active transaction the
     * outcome of {@code write} itself decides.
     */
    private <T> T withImageCleanup(String obsolete, String fresh, Supplier<T> write) {
        boolean deferred = TransactionSynchronizationManager.isSynchronizationActive();
        if (deferred) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    deleteQuietly(status == STATUS_COMMITTED ? obsolete : fresh);
                }
            });
        }
        T result;
        try {
            result = write.get();
        } catch (RuntimeException ex) {
            if (!deferred) {
                deleteQuietly(fresh);
            }
            throw ex;
        }
        if (!deferred) {
            deleteQuietly(obsolete);
        }
        return result;
    }

    private void deleteQuietly(String mediaPath) {
        if (mediaPath == null) {
            return;
        }
        try {
            fileStorage.delete(mediaPath);
        } catch (RuntimeException ex) {
            log.warn("Could not delete reward image {}", mediaPath, ex);
        }
    }
}
