package com.latchkey.backend.modules.auth.application;

import com.latchkey.backend.modules.auth.domain.AppUser;

/**
 * Outbound mail collaborator. Delivers a message whose link embeds {@code token}.
 * Dispatch is fire-and-forget: implementations must not throw on delivery failure.
 */
public interface AccountMailer {

    void deliver(AppUser user, String token, TokenPurpose purpose);
}
