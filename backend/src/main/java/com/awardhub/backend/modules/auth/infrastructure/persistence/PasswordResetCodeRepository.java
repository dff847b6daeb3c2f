package com.awardhub.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.awardhub.backend.modules.auth.domain.PasswordResetCode;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PasswordResetCodeRepository extends JpaRepository<PasswordResetCode, UUID> {

    Optional<PasswordResetCode> findFirstByPhoneNumberAndCodeOrderByCreatedAtDesc(String phoneNumber, String code);
}
