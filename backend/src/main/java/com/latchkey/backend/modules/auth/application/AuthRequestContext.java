package com.latchkey.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.ActiveSession;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;

import org.springframework.http.HttpHeaders;

/**
 * Authentication state of one HTTP request: the servlet session that points at an
 * {@link ActiveSession}, the response that carries cookies back, and the memoized lookup of
 * the current session. One instance per request, shared through a request attribute.
 */
public final class AuthRequestContext {

    static final String ACTIVE_SESSION_ATTRIBUTE = "current_active_session_id";
    private static final String REQUEST_ATTRIBUTE = AuthRequestContext.class.getName();

    private final HttpServletRequest request;
    private final HttpServletResponse response;

    private boolean resolved;
    private ActiveSession currentSession;

    private AuthRequestContext(HttpServletRequest request, HttpServletResponse response) {
        this.request = request;
        this.response = response;
    }

    public static AuthRequestContext of(HttpServletRequest request, HttpServletResponse response) {
        Object existing = request.getAttribute(REQUEST_ATTRIBUTE);
        if (existing instanceof AuthRequestContext context) {
            return context;
        }
        AuthRequestContext created = new AuthRequestContext(request, response);
        request.setAttribute(REQUEST_ATTRIBUTE, created);
        return created;
    }

    public HttpServletRequest request() {
        return request;
    }

    public HttpServletResponse response() {
        return response;
    }

    public String userAgent() {
        return request.getHeader(HttpHeaders.USER_AGENT);
    }

    public String ipAddress() {
        return request.getRemoteAddr();
    }

    /**
     * Id of the {@link ActiveSession} bound to the servlet session, if the request carries one.
     */
    Optional<UUID> boundActiveSessionId() {
        HttpSession session = request.getSession(false);
        if (session == null) {
            return Optional.empty();
        }
        Object value = session.getAttribute(ACTIVE_SESSION_ATTRIBUTE);
        if (!(value instanceof String raw)) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(raw));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    void bind(ActiveSession activeSession) {
        request.getSession(true).setAttribute(ACTIVE_SESSION_ATTRIBUTE, activeSession.getId().toString());
        cache(activeSession);
    }

    /**
     * Drops the servlet session (and with it the session identifier) and forgets the cached lookup.
     */
    void reset() {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }
        cache(null);
    }

    boolean isResolved() {
        return resolved;
    }

    Optional<ActiveSession> cachedSession() {
        return Optional.ofNullable(currentSession);
    }

    void cache(ActiveSession activeSession) {
        this.currentSession = activeSession;
        this.resolved = true;
    }
}
