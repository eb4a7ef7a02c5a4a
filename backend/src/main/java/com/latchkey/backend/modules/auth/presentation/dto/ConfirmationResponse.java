package com.latchkey.backend.modules.auth.presentation.dto;

public record ConfirmationResponse(String message, AccountResponse user, boolean loggedIn) {
}
