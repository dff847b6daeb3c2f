package com.awardhub.backend.modules.notification.domain;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.support.TestEntities;

import org.junit.jupiter.api.Test;

class NotificationTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-01T10:00:00Z");

    @Test
    void firstReadTimestampIsKept() {
        Notification notification = notification();

        assertThat(notification.markRead(NOW)).isTrue();
        assertThat(notification.markRead(NOW.plusHours(1))).isFalse();

        assertThat(notification.isRead()).isTrue();
        assertThat(notification.getReadAt()).isEqualTo(NOW);
    }

    @Test
    void extraDataIsCopied() {
        Map<String, Object> extra = new HashMap<>(Map.of("reward_name", "Young Leader"));
        Notification notification = new Notification(TestEntities.user(UUID.randomUUID(), "+998901234567"),
                Notification.SOURCE_APPLICATION, UUID.randomUUID(), NotificationType.APPLICATION_CREATED, "title", extra);

        extra.put("reward_name", "changed");

        assertThat(notification.getExtraData()).containsEntry("reward_name", "Young Leader");
        assertThat(notification.isRead()).isFalse();
    }

    private static Notification notification() {
        return new Notification(TestEntities.user(UUID.randomUUID(), "+998901234567"), Notification.SOURCE_APPLICATION,
                UUID.randomUUID(), NotificationType.APPLICATION_UPDATED, "title", null);
    }
}
