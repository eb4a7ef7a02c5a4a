package com.latchkey.backend.modules.auth.presentation.dto;

/**
 * Blank {@code email} or {@code password} leaves that attribute unchanged.
 */
public record AccountUpdateRequest(
        String currentPassword,
        String email,
        String password,
        String passwordConfirmation
) {
}
