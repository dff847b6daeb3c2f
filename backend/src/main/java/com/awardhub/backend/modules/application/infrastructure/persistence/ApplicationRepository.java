package com.awardhub.backend.modules.application.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.awardhub.backend.modules.application.domain.Application;
import com.awardhub.backend.modules.application.domain.ApplicationStatus;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApplicationRepository extends JpaRepository<Application, UUID> {

    boolean existsByUserIdAndRewardId(UUID userId, UUID rewardId);

    boolean existsByRewardId(UUID rewardId);

    long countByRewardId(UUID rewardId);

    long countByRewardIdAndStatusIn(UUID rewardId, Collection<ApplicationStatus> statuses);

    long countByCreatedAtGreaterThanEqual(OffsetDateTime since);

    @EntityGraph(attributePaths = {"user", "reward"})
    @Query("select a from Application a where a.id = :id")
    Optional<Application> findDetailedById(@Param("id") UUID id);

    @EntityGraph(attributePaths = {"user", "reward"})
    @Query("""
            select a
              from Application a
             where (:userId is null or a.user.id = :userId)
               and (:rewardId is null or a.reward.id = :rewardId)
               and (:status is null or a.status = :status)
               and (
                     :searchPattern is null
                  or lower(a.user.firstName) like :searchPattern
                  or lower(a.user.lastName) like :searchPattern
                  or a.user.pinfl like :searchPattern
                  or lower(a.activity) like :searchPattern
                  or lower(a.reward.name) like :searchPattern
                )
             order by a.createdAt desc
            """)
    Page<Application> search(
            @Param("userId") UUID userId,
            @Param("rewardId") UUID rewardId,
            @Param("status") ApplicationStatus status,
            @Param("searchPattern") String searchPattern,
            Pageable pageable
    );

    @Query("""
            select a.reward.id as rewardId, count(a) as total
              from Application a
             where a.reward.id in :rewardIds
             group by a.reward.id
            """)
    List<RewardCount> countByRewardIds(@Param("rewardIds") Collection<UUID> rewardIds);

    @Query("""
            select a.status as status, count(a) as total
              from Application a
             where (:rewardId is null or a.reward.id = :rewardId)
             group by a.status
            """)
    List<StatusCount> countByStatus(@Param("rewardId") UUID rewardId);

    @Query("""
            select coalesce(a.source, 'unknown') as source, count(a) as total
              from Application a
             group by coalesce(a.source, 'unknown')
            """)
    List<SourceCount> countBySource();

    @Query("""
            select a.reward.id as rewardId, a.reward.name as rewardName, count(a) as total
              from Application a
             group by a.reward.id, a.reward.name
             order by count(a) desc
            """)
    List<TopReward> findTopRewards(Pageable pageable);

    @Query("""
            select a.createdAt
              from Application a
             where a.reward.id = :rewardId
               and a.createdAt >= :since
            """)
    List<OffsetDateTime> findCreationTimesSince(@Param("rewardId") UUID rewardId, @Param("since") OffsetDateTime since);

    interface RewardCount {
        UUID getRewardId();

        long getTotal();
    }

    interface StatusCount {
        ApplicationStatus getStatus();

        long getTotal();
    }

    interface SourceCount {
        String getSource();

        long getTotal();
    }

    interface TopReward {
        UUID getRewardId();

        String getRewardName();

        long getTotal();
    }
}
