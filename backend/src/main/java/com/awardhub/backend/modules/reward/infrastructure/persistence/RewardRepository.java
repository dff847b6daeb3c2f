package com.awardhub.backend.modules.reward.infrastructure.persistence;

import java.util.UUID;

import com.awardhub.backend.modules.reward.domain.Reward;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface RewardRepository extends JpaRepository<Reward, UUID> {

    boolean existsByNameIgnoreCase(String name);

    boolean existsByNameIgnoreCaseAndIdNot(String name, UUID id);

    @Query("""
            select r
              from Reward r
             where (:searchPattern is null
                    or lower(r.name) like :searchPattern
                    or lower(r.description) like :searchPattern)
             order by r.createdAt asc
            """)
    Page<Reward> search(@Param("searchPattern") String searchPattern, Pageable pageable);
}
