package com.latchkey.backend.global.security;

import java.util.UUID;

public record AuthenticatedUserPrincipal(UUID userId, UUID activeSessionId) {
}
