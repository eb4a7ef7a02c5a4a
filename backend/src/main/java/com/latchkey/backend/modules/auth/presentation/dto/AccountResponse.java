package com.latchkey.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.domain.ConfirmationState;

public record AccountResponse(
        UUID userId,
        String email,
        String unconfirmedEmail,
        ConfirmationState confirmationState,
        OffsetDateTime confirmedAt,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static AccountResponse from(AppUser user) {
        return new AccountResponse(
                user.getId(),
                user.getEmail(),
                user.getUnconfirmedEmail(),
                user.getConfirmationState(),
                user.getConfirmedAt(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
