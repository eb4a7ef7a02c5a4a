package com.latchkey.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank(message = "can't be blank") String email,
        @NotBlank(message = "can't be blank") String password,
        boolean rememberMe
) {
}
