package com.latchkey.backend.modules.auth.presentation.dto;

public record PasswordUpdateRequest(String password, String passwordConfirmation) {
}
