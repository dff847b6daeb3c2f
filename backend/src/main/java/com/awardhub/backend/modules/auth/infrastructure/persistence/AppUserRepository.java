package com.awardhub.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.awardhub.backend.modules.auth.domain.AppUser;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {

    Optional<AppUser> findByPhoneNumber(String phoneNumber);

    boolean existsByPhoneNumber(String phoneNumber);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByPinfl(String pinfl);

    boolean existsByPassportNumberIgnoreCase(String passportNumber);

    boolean existsByEmailIgnoreCaseAndIdNot(String email, UUID id);

    boolean existsByPhoneNumberAndIdNot(String phoneNumber, UUID id);

    @Query("""
            select u
              from AppUser u
             where (:searchPattern is null
                    or lower(u.firstName) like :searchPattern
                    or lower(u.lastName) like :searchPattern
                    or lower(u.email) like :searchPattern
                    or u.phoneNumber like :searchPattern)
             order by u.createdAt desc
            """)
    Page<AppUser> search(@Param("searchPattern") String searchPattern, Pageable pageable);
}
