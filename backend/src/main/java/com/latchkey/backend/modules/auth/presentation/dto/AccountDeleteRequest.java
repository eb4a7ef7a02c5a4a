package com.latchkey.backend.modules.auth.presentation.dto;

public record AccountDeleteRequest(String currentPassword) {
}
