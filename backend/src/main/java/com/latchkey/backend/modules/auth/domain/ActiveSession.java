package com.latchkey.backend.modules.auth.domain;

import java.util.UUID;

import com.latchkey.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * One logged-in device. Rows never expire on their own; they are only ever deleted.
 */
@Entity
@Table(name = "active_session")
public class ActiveSession extends AbstractTimestampedEntity {

    public static final int USER_AGENT_MAX_LENGTH = 255;
    public static final int IP_ADDRESS_MAX_LENGTH = 64;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false, updatable = false)
    private AppUser user;

    @Column(name = "remember_token", nullable = false, unique = true, updatable = false, length = 64)
    private String rememberToken;

    @Column(name = "user_agent", updatable = false, length = USER_AGENT_MAX_LENGTH)
    private String userAgent;

    @Column(name = "ip_address", updatable = false, length = IP_ADDRESS_MAX_LENGTH)
    private String ipAddress;

    protected ActiveSession() {
    }

    public ActiveSession(AppUser user, String rememberToken, String userAgent, String ipAddress) {
        this.user = user;
        this.rememberToken = rememberToken;
        this.userAgent = truncate(userAgent, USER_AGENT_MAX_LENGTH);
        this.ipAddress = truncate(ipAddress, IP_ADDRESS_MAX_LENGTH);
    }

    public UUID getId() {
        return id;
    }

    public AppUser getUser() {
        return user;
    }

    public String getRememberToken() {
        return rememberToken;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    private static String truncate(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength) : trimmed;
    }
}
