package com.latchkey.backend.modules.auth.presentation.dto;

public record CsrfTokenResponse(String headerName, String parameterName, String token) {
}
