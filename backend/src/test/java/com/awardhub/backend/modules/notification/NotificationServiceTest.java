package com.awardhub.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.awardhub.backend.global.error.ProblemException;
import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.infrastructure.persistence.ApplicationRepository;
import com.awardhub.backend.modules.auth.domain.AppUser;
import com.awardhub.backend.modules.notification.application.NotificationService;
import com.awardhub.backend.modules.notification.domain.Notification;
import com.awardhub.backend.modules.notification.domain.NotificationType;
import com.awardhub.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.awardhub.backend.modules.notification.presentation.dto.MarkAllReadResponse;
import com.awardhub.backend.modules.notification.presentation.dto.MarkReadResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationDetailResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationListResponse;
import com.awardhub.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class NotificationServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private ApplicationRepository applicationRepository;

    private NotificationService notificationService;

    private AppUser user;
    private Application application;

    @BeforeEach
    void setUp() {
        notificationService = new NotificationService(notificationRepository, applicationRepository,
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC));
        user = TestEntities.user(UUID.randomUUID(), "+998901234567");
        application = TestEntities.application(UUID.randomUUID(), user,
                TestEntities.reward(UUID.randomUUID(), "Young Leader"));
    }

    @Test
    void unreadFilterOnlyIncludesUnread() {
        Pageable pageable = PageRequest.of(0, 20);
        Notification notification = notification(NOW.minusHours(3));
        when(notificationRepository.findFeed(user.getId(), null, true, false, pageable))
                .thenReturn(new PageImpl<>(List.of(notification), pageable, 1));
        when(notificationRepository.countByRecipientId(user.getId())).thenReturn(4L);
        when(notificationRepository.countByRecipientIdAndReadAtIsNull(user.getId())).thenReturn(1L);

        NotificationListResponse response = notificationService.list(user.getId(), false, null, pageable);

        assertThat(response.items()).singleElement().satisfies(item -> {
            assertThat(item.read()).isFalse();
            assertThat(item.timeSince()).isEqualTo("3 hours");
        });
        assertThat(response.stats().unreadCount()).isEqualTo(1);
        assertThat(response.stats().readCount()).isEqualTo(3);
    }

    @Test
    void openingNotificationMarksItReadAndAttachesApplication() {
        Notification notification = notification(NOW.minusDays(1));
        when(notificationRepository.findByIdAndRecipientId(notification.getId(), user.getId()))
                .thenReturn(Optional.of(notification));
        when(applicationRepository.findDetailedById(application.getId())).thenReturn(Optional.of(application));

        NotificationDetailResponse detail = notificationService.get(user.getId(), notification.getId());

        assertThat(detail.wasMarkedAsRead()).isTrue();
        assertThat(detail.read()).isTrue();
        assertThat(detail.readAt()).isEqualTo(NOW);
        assertThat(detail.source().rewardName()).isEqualTo("Young Leader");
        assertThat(detail.timeSince()).isEqualTo("1 day");
        verify(notificationRepository).save(notification);
    }

    @Test
    void reopeningKeepsOriginalReadTime() {
        Notification notification = notification(NOW.minusDays(1));
        notification.markRead(NOW.minusHours(2));
        when(notificationRepository.findByIdAndRecipientId(notification.getId(), user.getId()))
                .thenReturn(Optional.of(notification));
        when(applicationRepository.findDetailedById(application.getId())).thenReturn(Optional.empty());

        NotificationDetailResponse detail = notificationService.get(user.getId(), notification.getId());

        assertThat(detail.wasMarkedAsRead()).isFalse();
        assertThat(detail.readAt()).isEqualTo(NOW.minusHours(2));
        assertThat(detail.source()).isNull();
        verify(notificationRepository, never()).save(any());
    }

    @Test
    void foreignNotificationIsNotFound() {
        UUID id = UUID.randomUUID();
        UUID stranger = UUID.randomUUID();
        when(notificationRepository.findByIdAndRecipientId(id, stranger)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> notificationService.markRead(stranger, id))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("NOTIFICATION_NOT_FOUND"));
    }

    @Test
    void markReadReportsWhetherItWasUnread() {
        Notification notification = notification(NOW.minusMinutes(5));
        when(notificationRepository.findByIdAndRecipientId(notification.getId(), user.getId()))
                .thenReturn(Optional.of(notification));

        MarkReadResponse first = notificationService.markRead(user.getId(), notification.getId());
        MarkReadResponse second = notificationService.markRead(user.getId(), notification.getId());

        assertThat(first.wasUnread()).isTrue();
        assertThat(second.wasUnread()).isFalse();
        assertThat(second.readAt()).isEqualTo(NOW);
    }

    @Test
    void markAllReadWithoutIdsCoversEveryUnread() {
        when(notificationRepository.countByRecipientIdAndReadAtIsNull(user.getId())).thenReturn(3L);
        when(notificationRepository.markAllRead(user.getId(), NOW)).thenReturn(3);

        MarkAllReadResponse response = notificationService.markAllRead(user.getId(), null);

        assertThat(response.updatedCount()).isEqualTo(3);
        assertThat(response.totalUnreadBefore()).isEqualTo(3);
        assertThat(response.message()).isEqualTo("3 notifications marked as read");
    }

    @Test
    void markAllReadWithIdsIsLimitedToThem() {
        List<UUID> ids = List.of(UUID.randomUUID(), UUID.randomUUID());
        when(notificationRepository.countByRecipientIdAndReadAtIsNullAndIdIn(user.getId(), ids)).thenReturn(1L);
        when(notificationRepository.markRead(eq(user.getId()), eq(ids), eq(NOW))).thenReturn(1);

        MarkAllReadResponse response = notificationService.markAllRead(user.getId(), ids);

        assertThat(response.updatedCount()).isEqualTo(1);
        verify(notificationRepository, never()).markAllRead(any(), any());
    }

    @Test
    void statsFillMissingTypesWithZero() {
        NotificationRepository.TypeCount created = new NotificationRepository.TypeCount() {
            @Override
            public NotificationType getType() {
                return NotificationType.APPLICATION_CREATED;
            }

            @Override
            public long getTotal() {
                return 2;
            }
        };
        when(notificationRepository.countByRecipientId(user.getId())).thenReturn(2L);
        when(notificationRepository.countByRecipientIdAndReadAtIsNull(user.getId())).thenReturn(2L);
        when(notificationRepository.countByType(user.getId())).thenReturn(List.of(created));
        when(notificationRepository.findFeed(eq(user.getId()), isNull(), eq(true), eq(true), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        var stats = notificationService.stats(user.getId());

        assertThat(stats.byType())
                .containsEntry("APPLICATION_CREATED", 2L)
                .containsEntry("REWARD_WON", 0L)
                .hasSize(NotificationType.values().length);
        assertThat(stats.readCount()).isZero();
    }

    private Notification notification(OffsetDateTime createdAt) {
        Notification notification = new Notification(user, Notification.SOURCE_APPLICATION, application.getId(),
                NotificationType.APPLICATION_CREATED, "Submitted", null);
        TestEntities.withId(notification, UUID.randomUUID());
        return TestEntities.withCreatedAt(notification, createdAt);
    }
}
