package com.latchkey.backend.modules.auth.application;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.ActiveSession;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.infrastructure.persistence.ActiveSessionRepository;
import com.latchkey.backend.modules.auth.infrastructure.web.RememberMeCookies;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps the servlet session and the remember-me cookie onto {@link ActiveSession} rows.
 *
 * <p>A request bound to a session id is resolved through that id only. When the row has been
 * deleted the request is anonymous, even if it also carries a remember-me cookie.
 */
@Service
public class SessionLifecycleManager implements AuthenticationService {

    private static final Logger log = LoggerFactory.getLogger(SessionLifecycleManager.class);
    private static final int REMEMBER_TOKEN_BYTES = 24;

    private final ActiveSessionRepository activeSessionRepository;
    private final RememberMeCookies rememberMeCookies;
    private final SecureRandom secureRandom = new SecureRandom();

    public SessionLifecycleManager(ActiveSessionRepository activeSessionRepository, RememberMeCookies rememberMeCookies) {
        this.activeSessionRepository = activeSessionRepository;
        this.rememberMeCookies = rememberMeCookies;
    }

    @Override
    @Transactional
    public ActiveSession login(AuthRequestContext context, AppUser user) {
        context.reset();
        ActiveSession activeSession = activeSessionRepository.save(
                new ActiveSession(user, generateRememberToken(), context.userAgent(), context.ipAddress())
        );
        context.bind(activeSession);
        log.info("User {} logged in with active session {}", user.getId(), activeSession.getId());
        return activeSession;
    }

    @Override
    @Transactional
    public void logout(AuthRequestContext context) {
        Optional<UUID> activeSessionId = context.boundActiveSessionId();
        context.reset();
        activeSessionId.ifPresent(id -> {
            // zero rows when another device already revoked it
            if (activeSessionRepository.deleteActiveSession(id) > 0) {
                log.info("Active session {} logged out", id);
            }
        });
    }

    @Override
    public void remember(AuthRequestContext context, ActiveSession activeSession) {
        rememberMeCookies.write(context.response(), activeSession.getRememberToken());
    }

    @Override
    public void forgetActiveSession(AuthRequestContext context) {
        rememberMeCookies.clear(context.response());
    }

    @Override
    public Optional<AppUser> resolveCurrentUser(AuthRequestContext context) {
        return resolveCurrentSession(context).map(ActiveSession::getUser);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ActiveSession> resolveCurrentSession(AuthRequestContext context) {
        if (context.isResolved()) {
            return context.cachedSession();
        }
        Optional<UUID> boundId = context.boundActiveSessionId();
        Optional<ActiveSession> resolved = boundId.isPresent()
                ? activeSessionRepository.findWithUserById(boundId.get())
                : rememberMeCookies.read(context.request())
                        .flatMap(activeSessionRepository::findWithUserByRememberToken);
        context.cache(resolved.orElse(null));
        return resolved;
    }

    @Override
    public AppUser requireAuthenticated(AuthRequestContext context) {
        return resolveCurrentUser(context).orElseThrow(AuthProblems::unauthenticated);
    }

    @Override
    public void requireAnonymous(AuthRequestContext context) {
        if (resolveCurrentUser(context).isPresent()) {
            throw AuthProblems.alreadyAuthenticated();
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<ActiveSession> listActiveSessions(AppUser user) {
        return activeSessionRepository.findAllByUserIdNewestFirst(user.getId());
    }

    @Override
    @Transactional
    public void revoke(AuthRequestContext context, AppUser user, UUID activeSessionId) {
        ActiveSession activeSession = activeSessionRepository.findOwnedBy(activeSessionId, user.getId())
                .orElseThrow(AuthProblems::activeSessionNotFound);
        activeSessionRepository.deleteActiveSession(activeSession.getId());
        log.info("User {} revoked active session {}", user.getId(), activeSession.getId());

        boolean boundToRevoked = context.boundActiveSessionId()
                .map(activeSessionId::equals)
                .orElse(false);
        boolean resolvedToRevoked = context.isResolved() && context.cachedSession()
                .map(current -> activeSessionId.equals(current.getId()))
                .orElse(false);
        if (boundToRevoked || resolvedToRevoked) {
            context.reset();
        }
    }

    @Override
    @Transactional
    public void revokeAll(AuthRequestContext context, AppUser user) {
        int deleted = activeSessionRepository.deleteAllOwnedBy(user.getId());
        log.info("User {} revoked all {} active sessions", user.getId(), deleted);
        context.reset();
    }

    @Override
    public void resetRequestState(AuthRequestContext context) {
        context.reset();
    }

    private String generateRememberToken() {
        byte[] bytes = new byte[REMEMBER_TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
