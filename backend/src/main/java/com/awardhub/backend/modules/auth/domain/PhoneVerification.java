package com.awardhub.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.awardhub.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One SMS code issued for a phone number. Its id doubles as the verification id handed to the client.
 */
@Entity
@Table(name = "phone_verification")
public class PhoneVerification extends AbstractTimestampedEntity {

    public static final long VALIDITY_MINUTES = 5;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id")
    private AppUser user;

    @Column(name = "phone_number", nullable = false, length = 20)
    private String phoneNumber;

    @Column(name = "code", nullable = false, length = 6)
    private String code;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, length = 10)
    private VerificationPurpose purpose;

    @Column(name = "expires_at", nullable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "used", nullable = false)
    private boolean used;

    protected PhoneVerification() {
    }

    public PhoneVerification(String phoneNumber, String code, VerificationPurpose purpose, OffsetDateTime issuedAt) {
        this.phoneNumber = phoneNumber;
        this.code = code;
        this.purpose = purpose;
        this.expiresAt = issuedAt.plusMinutes(VALIDITY_MINUTES);
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public String getPhoneNumber() {
        return phoneNumber;
    }

    public String getCode() {
        return code;
    }

    public VerificationPurpose getPurpose() {
        return purpose;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public boolean isUsed() {
        return used;
    }

    public boolean isValid(OffsetDateTime now) {
        return !used && now.isBefore(expiresAt);
    }

    public boolean matches(String candidate) {
        return code.equals(candidate);
    }

    public void markUsed() {
        this.used = true;
    }

    public void consumeFor(AppUser owner) {
        this.used = true;
        this.user = owner;
    }
}
