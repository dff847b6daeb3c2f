package com.awardhub.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.awardhub.backend.modules.auth.domain.PhoneVerification;
import com.awardhub.backend.modules.auth.domain.VerificationPurpose;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PhoneVerificationRepository extends JpaRepository<PhoneVerification, UUID> {

    @Modifying
    @Query("""
            update PhoneVerification pv
               set pv.used = true
             where pv.phoneNumber = :phoneNumber
               and pv.purpose = :purpose
               and pv.used = false
            """)
    int invalidateUnused(@Param("phoneNumber") String phoneNumber,
                         @Param("purpose") VerificationPurpose purpose);
}
