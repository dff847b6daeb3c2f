package com.awardhub.backend.modules.notification.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.awardhub.backend.modules.notification.domain.Notification;
import com.awardhub.backend.modules.notification.domain.NotificationType;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Optional<Notification> findByIdAndRecipientId(UUID id, UUID recipientId);

    long countByRecipientId(UUID recipientId);

    long countByRecipientIdAndReadAtIsNull(UUID recipientId);

    long countByRecipientIdAndReadAtIsNullAndIdIn(UUID recipientId, Collection<UUID> ids);

    List<Notification> findBySourceTypeAndSourceIdOrderByCreatedAtAsc(String sourceType, UUID sourceId);

    @Query("""
            select n
              from Notification n
             where n.recipient.id = :recipientId
               and (:type is null or n.type = :type)
               and (
                     (:includeUnread = true and n.readAt is null)
                  or (:includeRead = true and n.readAt is not null)
                )
             order by n.createdAt desc
            """)
    Page<Notification> findFeed(
            @Param("recipientId") UUID recipientId,
            @Param("type") NotificationType type,
            @Param("includeUnread") boolean includeUnread,
            @Param("includeRead") boolean includeRead,
            Pageable pageable
    );

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Notification n
               set n.readAt = :now,
                   n.updatedAt = :now
             where n.recipient.id = :recipientId
               and n.readAt is null
            """)
    int markAllRead(@Param("recipientId") UUID recipientId, @Param("now") OffsetDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update Notification n
               set n.readAt = :now,
                   n.updatedAt = :now
             where n.recipient.id = :recipientId
               and n.readAt is null
               and n.id in :ids
            """)
    int markRead(@Param("recipientId") UUID recipientId, @Param("ids") Collection<UUID> ids,
                 @Param("now") OffsetDateTime now);

    @Query("""
            select n.type as type, count(n) as total
              from Notification n
             where n.recipient.id = :recipientId
             group by n.type
            """)
    List<TypeCount> countByType(@Param("recipientId") UUID recipientId);

    interface TypeCount {
        NotificationType getType();

        long getTotal();
    }
}
