package com.latchkey.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.latchkey.backend.global.error.ProblemException;
import com.latchkey.backend.modules.auth.domain.ActiveSession;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.infrastructure.persistence.ActiveSessionRepository;
import com.latchkey.backend.support.AbstractIntegrationTest;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpSession;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class SessionLifecycleManagerIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private AuthenticationService authenticationService;

    @Autowired
    private ActiveSessionRepository activeSessionRepository;

    private AppUser user;

    @BeforeEach
    void setUp() {
        user = testUserFactory.createConfirmed("alice@example.com");
    }

    @Test
    void loginBindsTheNewSessionToAFreshServletSession() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        HttpSession before = request.getSession(true);
        AuthRequestContext context = AuthRequestContext.of(request, new MockHttpServletResponse());

        ActiveSession activeSession = authenticationService.login(context, user);

        HttpSession after = request.getSession(false);
        assertThat(after).isNotNull().isNotSameAs(before);
        assertThat(after.getAttribute(AuthRequestContext.ACTIVE_SESSION_ATTRIBUTE))
                .isEqualTo(activeSession.getId().toString());
        assertThat(authenticationService.resolveCurrentUser(context))
                .hasValueSatisfying(resolved -> assertThat(resolved.getId()).isEqualTo(user.getId()));
    }

    @Test
    void resolutionIsReadOncePerRequest() {
        HttpSession session = loggedInSession();
        AuthRequestContext context = contextWith(session, null);

        assertThat(authenticationService.resolveCurrentUser(context)).isPresent();
        activeSessionRepository.deleteAll();

        assertThat(authenticationService.resolveCurrentUser(context)).isPresent();
        assertThat(authenticationService.resolveCurrentUser(contextWith(session, null))).isEmpty();
    }

    @Test
    void revokingTheRequestsOwnSessionMakesTheRestOfTheRequestAnonymous() {
        HttpSession session = loggedInSession();
        AuthRequestContext context = contextWith(session, null);
        ActiveSession current = authenticationService.resolveCurrentSession(context).orElseThrow();

        authenticationService.revoke(context, current.getUser(), current.getId());

        assertThat(authenticationService.resolveCurrentUser(context)).isEmpty();
        assertThatThrownBy(() -> authenticationService.requireAuthenticated(context))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo(AuthProblems.UNAUTHENTICATED));
    }

    @Test
    void revokingAnotherSessionLeavesTheRequestAuthenticated() {
        HttpSession mine = loggedInSession();
        AuthRequestContext otherLogin = AuthRequestContext.of(new MockHttpServletRequest(), new MockHttpServletResponse());
        ActiveSession other = authenticationService.login(otherLogin, user);
        AuthRequestContext context = contextWith(mine, null);
        AppUser current = authenticationService.requireAuthenticated(context);

        authenticationService.revoke(context, current, other.getId());

        assertThat(authenticationService.resolveCurrentUser(context)).isPresent();
        assertThat(activeSessionRepository.findById(other.getId())).isEmpty();
    }

    @Test
    void rememberedRequestBecomesAnonymousWhenItsSessionIsRevoked() {
        AuthRequestContext loginContext = AuthRequestContext.of(new MockHttpServletRequest(), new MockHttpServletResponse());
        ActiveSession activeSession = authenticationService.login(loginContext, user);
        authenticationService.remember(loginContext, activeSession);
        Cookie rememberCookie = ((MockHttpServletResponse) loginContext.response()).getCookie(REMEMBER_COOKIE);

        AuthRequestContext context = contextWith(null, rememberCookie);
        AppUser current = authenticationService.requireAuthenticated(context);
        authenticationService.revoke(context, current, activeSession.getId());

        assertThat(authenticationService.resolveCurrentUser(context)).isEmpty();
        assertThat(authenticationService.resolveCurrentUser(contextWith(null, rememberCookie))).isEmpty();
    }

    @Test
    void logoutDeletesTheBoundSessionAndToleratesItsPriorRevocation() {
        HttpSession session = loggedInSession();
        AuthRequestContext context = contextWith(session, null);

        authenticationService.logout(context);

        assertThat(activeSessionRepository.count()).isZero();
        assertThat(authenticationService.resolveCurrentUser(context)).isEmpty();

        HttpSession stale = loggedInSession();
        activeSessionRepository.deleteAll();
        AuthRequestContext staleContext = contextWith(stale, null);
        authenticationService.logout(staleContext);
        assertThat(authenticationService.resolveCurrentUser(staleContext)).isEmpty();
    }

    @Test
    void forgetLeavesTheSessionRowInPlace() {
        HttpSession session = loggedInSession();
        AuthRequestContext context = contextWith(session, null);

        authenticationService.forgetActiveSession(context);

        assertThat(activeSessionRepository.count()).isEqualTo(1);
        assertThat(((MockHttpServletResponse) context.response()).getCookie(REMEMBER_COOKIE).getMaxAge()).isZero();
        assertThat(authenticationService.resolveCurrentUser(contextWith(session, null))).isPresent();
    }

    @Test
    void revokeAllClearsEverySessionAndTheRequest() {
        HttpSession session = loggedInSession();
        loggedInSession();
        AuthRequestContext context = contextWith(session, null);
        AppUser current = authenticationService.requireAuthenticated(context);

        authenticationService.revokeAll(context, current);

        assertThat(activeSessionRepository.countByUserId(user.getId())).isZero();
        assertThat(authenticationService.resolveCurrentUser(context)).isEmpty();
    }

    private HttpSession loggedInSession() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        authenticationService.login(AuthRequestContext.of(request, new MockHttpServletResponse()), user);
        return request.getSession(false);
    }

    private AuthRequestContext contextWith(HttpSession session, Cookie cookie) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        if (session != null) {
            request.setSession(session);
        }
        if (cookie != null) {
            request.setCookies(cookie);
        }
        return AuthRequestContext.of(request, new MockHttpServletResponse());
    }
}
