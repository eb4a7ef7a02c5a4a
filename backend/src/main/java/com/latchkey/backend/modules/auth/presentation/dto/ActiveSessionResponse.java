package com.latchkey.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.ActiveSession;

public record ActiveSessionResponse(
        UUID id,
        String userAgent,
        String ipAddress,
        OffsetDateTime createdAt,
        boolean current
) {

    public static ActiveSessionResponse from(ActiveSession activeSession, boolean current) {
        return new ActiveSessionResponse(
                activeSession.getId(),
                activeSession.getUserAgent(),
                activeSession.getIpAddress(),
                activeSession.getCreatedAt(),
                current
        );
    }
}
