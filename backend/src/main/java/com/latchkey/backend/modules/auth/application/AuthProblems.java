package com.latchkey.backend.modules.auth.application;

import com.latchkey.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * User-visible failure signals of the authentication flows.
 */
public final class AuthProblems {

    public static final String INCORRECT_CREDENTIALS = "INCORRECT_CREDENTIALS";
    public static final String ACCOUNT_UNCONFIRMED = "ACCOUNT_UNCONFIRMED";
    public static final String INVALID_OR_EXPIRED_TOKEN = "INVALID_OR_EXPIRED_TOKEN";
    public static final String EMAIL_NO_LONGER_AVAILABLE = "EMAIL_NO_LONGER_AVAILABLE";
    public static final String UNAUTHENTICATED = "UNAUTHENTICATED";
    public static final String ALREADY_AUTHENTICATED = "ALREADY_AUTHENTICATED";
    public static final String ACTIVE_SESSION_NOT_FOUND = "ACTIVE_SESSION_NOT_FOUND";

    private AuthProblems() {
    }

    public static ProblemException incorrectCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, INCORRECT_CREDENTIALS, "Incorrect email or password.");
    }

    public static ProblemException accountUnconfirmed() {
        return new ProblemException(HttpStatus.FORBIDDEN, ACCOUNT_UNCONFIRMED, "You must confirm your email before you can sign in.");
    }

    public static ProblemException invalidOrExpiredToken() {
        return new ProblemException(HttpStatus.BAD_REQUEST, INVALID_OR_EXPIRED_TOKEN, "Invalid or expired token.");
    }

    public static ProblemException emailNoLongerAvailable() {
        return new ProblemException(HttpStatus.CONFLICT, EMAIL_NO_LONGER_AVAILABLE, "That email address is no longer available.");
    }

    public static ProblemException unauthenticated() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, UNAUTHENTICATED, "You need to login to access that page.");
    }

    public static ProblemException alreadyAuthenticated() {
        return new ProblemException(HttpStatus.CONFLICT, ALREADY_AUTHENTICATED, "You are already logged in.");
    }

    public static ProblemException activeSessionNotFound() {
        return new ProblemException(HttpStatus.NOT_FOUND, ACTIVE_SESSION_NOT_FOUND, "Session not found.");
    }
}
