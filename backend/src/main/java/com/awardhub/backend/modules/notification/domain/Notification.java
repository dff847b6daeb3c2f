package com.awardhub.backend.modules.notification.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.awardhub.backend.global.jpa.AbstractTimestampedEntity;
import com.awardhub.backend.modules.auth.domain.AppUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * A message in a user's feed. The source is referenced by type and id so that other aggregates can
 * raise notifications later.
 */
@Entity
@Table(name = "notification")
public class Notification extends AbstractTimestampedEntity {

    public static final String SOURCE_APPLICATION = "APPLICATION";

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipient_id", nullable = false)
    private AppUser recipient;

    @Column(name = "source_type", nullable = false, length = 30)
    private String sourceType;

    @Column(name = "source_id", nullable = false, columnDefinition = "uuid")
    private UUID sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 30)
    private NotificationType type;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 10)
    private NotificationStatus status = NotificationStatus.SENT;

    @Column(name = "sent_at")
    private OffsetDateTime sentAt;

    @Column(name = "read_at")
    private OffsetDateTime readAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extra_data", columnDefinition = "jsonb", nullable = false)
    private Map<String, Object> extraData = new LinkedHashMap<>();

    protected Notification() {
    }

    public Notification(AppUser recipient, String sourceType, UUID sourceId, NotificationType type, String title,
                        Map<String, Object> extraData) {
        this.recipient = recipient;
        this.sourceType = sourceType;
        this.sourceId = sourceId;
        this.type = type;
        this.title = title;
        this.extraData = extraData == null ? new LinkedHashMap<>() : new LinkedHashMap<>(extraData);
    }

    public void markSent(OffsetDateTime now) {
        this.status = NotificationStatus.SENT;
        this.sentAt = now;
    }

    /**
     * Sets {@code readAt} the first time only.
     *
     * @return {@code true} when this call changed the notification
     */
    public boolean markRead(OffsetDateTime now) {
        if (readAt != null) {
            return false;
        }
        this.readAt = now;
        return true;
    }

    public boolean isRead() {
        return readAt != null;
    }

    public UUID getId() {
        return id;
    }

    public AppUser getRecipient() {
        return recipient;
    }

    public String getSourceType() {
        return sourceType;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public NotificationType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public NotificationStatus getStatus() {
        return status;
    }

    public OffsetDateTime getSentAt() {
        return sentAt;
    }

    public OffsetDateTime getReadAt() {
        return readAt;
    }

    public Map<String, Object> getExtraData() {
        return extraData;
    }
}
