package com.latchkey.backend.modules.auth.presentation.dto;

import java.util.UUID;

public record LoginResponse(AccountResponse user, UUID activeSessionId, boolean remembered) {
}
