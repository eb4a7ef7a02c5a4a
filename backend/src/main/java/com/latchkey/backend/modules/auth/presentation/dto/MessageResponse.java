package com.latchkey.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
