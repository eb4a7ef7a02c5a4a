package com.latchkey.backend.modules.auth.application;

public enum TokenPurpose {
    CONFIRM_EMAIL("confirm_email"),
    RESET_PASSWORD("reset_password");

    private final String claimValue;

    TokenPurpose(String claimValue) {
        this.claimValue = claimValue;
    }

    public String claimValue() {
        return claimValue;
    }
}
