package com.latchkey.backend.modules.auth.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.ActiveSession;
import com.latchkey.backend.modules.auth.domain.AppUser;

/**
 * Request-facing authentication operations. Every call takes the request's
 * {@link AuthRequestContext}; nothing here keeps per-request state of its own.
 */
public interface AuthenticationService {

    /**
     * Rotates the request's session identifier and records a new {@link ActiveSession} for
     * {@code user}. Returns the new session so callers can {@link #remember} it.
     */
    ActiveSession login(AuthRequestContext context, AppUser user);

    /**
     * Clears request state and deletes the active session the request was bound to, if any.
     */
    void logout(AuthRequestContext context);

    /**
     * Stores the session's remember token in the long-lived cookie.
     */
    void remember(AuthRequestContext context, ActiveSession activeSession);

    /**
     * Deletes the long-lived cookie. Leaves every active session row alone.
     */
    void forgetActiveSession(AuthRequestContext context);

    Optional<AppUser> resolveCurrentUser(AuthRequestContext context);

    Optional<ActiveSession> resolveCurrentSession(AuthRequestContext context);

    AppUser requireAuthenticated(AuthRequestContext context);

    void requireAnonymous(AuthRequestContext context);

    List<ActiveSession> listActiveSessions(AppUser user);

    /**
     * Deletes one of {@code user}'s active sessions. Revoking the request's own session leaves
     * the request anonymous.
     */
    void revoke(AuthRequestContext context, AppUser user, UUID activeSessionId);

    /**
     * Deletes every active session of {@code user}, then clears the request's own state.
     */
    void revokeAll(AuthRequestContext context, AppUser user);

    /**
     * Clears the request's state without touching any active session row.
     */
    void resetRequestState(AuthRequestContext context);
}
