package com.latchkey.backend.modules.auth.presentation.dto;

public record EmailRequest(String email) {
}
