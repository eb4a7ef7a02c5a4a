package com.latchkey.backend.modules.auth.presentation.dto;

/**
 * {@code signedOut} is true when the caller's own session was among those revoked.
 */
public record RevocationResponse(boolean signedOut) {
}
