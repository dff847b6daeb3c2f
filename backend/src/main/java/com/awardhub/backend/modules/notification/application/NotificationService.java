package com.awardhub.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository;
import com.awardhub.backend.modules.notification.domain.Notification;
import com.awardhub.backend.modules.notification.domain.NotificationType;
import com.awardhub.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.awardhub.backend.modules.notification.presentation.dto.ApplicationSnapshotResponse;
import com.awardhub.backend.modules.notification.presentation.dto.MarkAllReadResponse;
import com.awardhub.backend.modules.notification.presentation.dto.MarkReadResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationCountsResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationDetailResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationItemResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationListResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationStatsResponse;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;

@Service
@Transactional
public class NotificationService {

    static final int RECENT_LIMIT = 5;

    private final NotificationRepository notificationRepository;
    private final ApplicationRepository applicationRepository;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            ApplicationRepository applicationRepository,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.applicationRepository = applicationRepository;
        this.clock = clock;
    }

    /**
     * @param read {@code null} for both read and unread notifications
     */
    @Transactional(readOnly = true)
    public NotificationListResponse list(UUID userId, Boolean read, NotificationType type, Pageable pageable) {
        boolean includeUnread = read == null || !read;
        boolean includeRead = read == null || read;
        Page<Notification> page = notificationRepository.findFeed(userId, type, includeUnread, includeRead, pageable);

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<NotificationItemResponse> items = page.getContent().stream()
                .map(notification -> toItem(notification, now))
                .toList();
        return new NotificationListResponse(items, page.getNumber(), page.getSize(), page.getTotalElements(),
                counts(userId));
    }

    /**
     * Opening a notification marks it read. The source application is included when it still exists.
     */
    public NotificationDetailResponse get(UUID userId, UUID notificationId) {
        Notification notification = load(userId, notificationId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        boolean marked = notification.markRead(now);
        if (marked) {
            notificationRepository.save(notification);
        }

        ApplicationSnapshotResponse source = Notification.SOURCE_APPLICATION.equals(notification.getSourceType())
                ? applicationRepository.findDetailedById(notification.getSourceId())
                        .map(ApplicationSnapshotResponse::from)
                        .orElse(null)
                : null;

        return new NotificationDetailResponse(
                notification.getId(),
                notification.getType(),
                notification.getTitle(),
                notification.getStatus(),
                notification.getCreatedAt(),
                notification.getSentAt(),
                notification.getReadAt(),
                notification.isRead(),
                notification.getExtraData(),
                source,
                TimeSinceFormatter.format(notification.getCreatedAt(), now),
                marked
        );
    }

    public MarkReadResponse markRead(UUID userId, UUID notificationId) {
        Notification notification = load(userId, notificationId);
        boolean wasUnread = notification.markRead(OffsetDateTime.now(clock));
        if (wasUnread) {
            notificationRepository.save(notification);
        }
        return new MarkReadResponse(notification.getId(), true, wasUnread, notification.getReadAt());
    }

    public MarkAllReadResponse markAllRead(UUID userId, List<UUID> notificationIds) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        long unreadBefore;
        int updated;
        if (CollectionUtils.isEmpty(notificationIds)) {
            unreadBefore = notificationRepository.countByRecipientIdAndReadAtIsNull(userId);
            updated = notificationRepository.markAllRead(userId, now);
        } else {
            unreadBefore = notificationRepository.countByRecipientIdAndReadAtIsNullAndIdIn(userId, notificationIds);
            updated = notificationRepository.markRead(userId, notificationIds, now);
        }
        return new MarkAllReadResponse(updated + " notifications marked as read", updated, unreadBefore);
    }

    @Transactional(readOnly = true)
    public NotificationStatsResponse stats(UUID userId) {
        NotificationCountsResponse counts = counts(userId);

        Map<String, Long> byType = new LinkedHashMap<>();
        for (NotificationType type : NotificationType.values()) {
            byType.put(type.name(), 0L);
        }
        notificationRepository.countByType(userId)
                .forEach(row -> byType.put(row.getType().name(), row.getTotal()));

        OffsetDateTime now = OffsetDateTime.now(clock);
        List<NotificationItemResponse> recent = notificationRepository
                .findFeed(userId, null, true, true, PageRequest.of(0, RECENT_LIMIT))
                .getContent().stream()
                .map(notification -> toItem(notification, now))
                .toList();

        return new NotificationStatsResponse(counts.totalCount(), counts.unreadCount(), counts.readCount(), byType,
                recent);
    }

    private NotificationCountsResponse counts(UUID userId) {
        return NotificationCountsResponse.of(
                notificationRepository.countByRecipientId(userId),
                notificationRepository.countByRecipientIdAndReadAtIsNull(userId)
        );
    }

    private Notification load(UUID userId, UUID notificationId) {
        return notificationRepository.findByIdAndRecipientId(notificationId, userId)
                .orElseThrow(() -> ProblemException.notFound("NOTIFICATION_NOT_FOUND"));
    }

    private NotificationItemResponse toItem(Notification notification, OffsetDateTime now) {
        return new NotificationItemResponse(
                notification.getId(),
                notification.getType(),
                notification.getTitle(),
                notification.getCreatedAt(),
                notification.isRead(),
                TimeSinceFormatter.format(notification.getCreatedAt(), now)
        );
    }
}
