package com.latchkey.backend.modules.auth.presentation.dto;

public record SignUpRequest(String email, String password, String passwordConfirmation) {
}
