package com.latchkey.backend.modules.auth.application;

import com.latchkey.backend.modules.auth.domain.ActiveSession;
import com.latchkey.backend.modules.auth.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class SignInService {

    private static final Logger log = LoggerFactory.getLogger(SignInService.class);

    private final CredentialAuthenticator credentialAuthenticator;
    private final AuthenticationService authenticationService;

    public SignInService(CredentialAuthenticator credentialAuthenticator, AuthenticationService authenticationService) {
        this.credentialAuthenticator = credentialAuthenticator;
        this.authenticationService = authenticationService;
    }

    /**
     * Checks the password before the confirmation state, so an unconfirmed account is only
     * reported to someone who knows its password.
     */
    public ActiveSession signIn(AuthRequestContext context, String email, String password, boolean rememberMe) {
        AppUser user = credentialAuthenticator.authenticate(email, password)
                .orElseThrow(() -> {
                    log.info("Rejected login attempt");
                    return AuthProblems.incorrectCredentials();
                });
        if (!user.isConfirmed()) {
            throw AuthProblems.accountUnconfirmed();
        }

        ActiveSession activeSession = authenticationService.login(context, user);
        if (rememberMe) {
            authenticationService.remember(context, activeSession);
        } else {
            authenticationService.forgetActiveSession(context);
        }
        return activeSession;
    }

    public void signOut(AuthRequestContext context) {
        authenticationService.forgetActiveSession(context);
        authenticationService.logout(context);
    }
}
