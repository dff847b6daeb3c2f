package com.awardhub.backend.modules.auth.domain;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.awardhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "password_reset_code")
public class PasswordResetCode extends AbstractTimestampedEntity {

    public static final Duration VALIDITY = Duration.ofSeconds(300);

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Column(name = "code", nullable = false, length = 6)
    private String code;

    protected PasswordResetCode() {
    }

    public PasswordResetCode(String phoneNumber, String code) {
        this.phoneNumber = phoneNumber;
        this.code = code;
    }

    public UUID getId() {
        return id;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getCode() {
        return code;
    }

    // Window is measured from the audited creation time.
    public boolean isValid(OffsetDateTime now) {
        OffsetDateTime createdAt = getCreatedAt();
        return createdAt != null && Duration.between(createdAt, now).compareTo(VALIDITY) < 0;
    }
}
