package com.latchkey.backend.modules.auth.domain;

/**
 * Derived from {@code confirmed_at} and {@code unconfirmed_email}; never persisted.
 */
public enum ConfirmationState {
    UNCONFIRMED,
    RECONFIRMING,
    CONFIRMED;

    public boolean isConfirmable() {
        return this != CONFIRMED;
    }
}
