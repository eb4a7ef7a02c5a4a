package com.latchkey.backend.modules.auth.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.latchkey.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Credential and confirmation record. Emails are normalized by every method that writes them.
 */
@Entity
@Table(name = "app_user")
public class AppUser extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "email", nullable = false, unique = true, length = EmailAddresses.MAX_LENGTH)
    private String email;

    @Column(name = "unconfirmed_email", length = EmailAddresses.MAX_LENGTH)
    private String unconfirmedEmail;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "confirmed_at")
    private OffsetDateTime confirmedAt;

    protected AppUser() {
    }

    public AppUser(String email, String passwordHash) {
        this.email = EmailAddresses.normalize(email);
        this.passwordHash = passwordHash;
    }

    public UUID getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getUnconfirmedEmail() {
        return unconfirmedEmail;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public OffsetDateTime getConfirmedAt() {
        return confirmedAt;
    }

    public ConfirmationState getConfirmationState() {
        if (confirmedAt == null) {
            return ConfirmationState.UNCONFIRMED;
        }
        return unconfirmedEmail != null ? ConfirmationState.RECONFIRMING : ConfirmationState.CONFIRMED;
    }

    public boolean isConfirmed() {
        return confirmedAt != null;
    }

    public boolean isConfirmable() {
        return getConfirmationState().isConfirmable();
    }

    /**
     * Address a confirmation link must be sent to: the pending one while reconfirming.
     */
    public String getConfirmableEmail() {
        return unconfirmedEmail != null ? unconfirmedEmail : email;
    }

    public void changePasswordHash(String passwordHash) {
        this.passwordHash = passwordHash;
    }

    /**
     * Stores {@code newEmail} as pending until it is confirmed. Passing the current email is rejected.
     */
    public void requestEmailChange(String newEmail) {
        String normalized = EmailAddresses.normalize(newEmail);
        if (normalized.equals(email)) {
            throw new IllegalArgumentException("pending email must differ from the current email");
        }
        this.unconfirmedEmail = normalized;
    }

    /**
     * Promotes a pending email, if any, and stamps the confirmation time.
     * Callers check that the pending email is still free before calling this.
     */
    public void confirm(OffsetDateTime confirmedAt) {
        if (!isConfirmable()) {
            throw new IllegalStateException("user is already confirmed");
        }
        if (unconfirmedEmail != null) {
            this.email = unconfirmedEmail;
            this.unconfirmedEmail = null;
        }
        this.confirmedAt = confirmedAt;
    }
}
