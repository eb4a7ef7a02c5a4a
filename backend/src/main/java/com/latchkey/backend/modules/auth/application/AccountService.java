package com.latchkey.backend.modules.auth.application;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.latchkey.backend.global.error.ValidationProblemException;
import com.latchkey.backend.global.error.ValidationProblemException.FieldViolation;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.domain.EmailAddresses;
import com.latchkey.backend.modules.auth.infrastructure.persistence.ActiveSessionRepository;
import com.latchkey.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    static final String EMAIL_TAKEN = "has already been taken";

    private final AppUserRepository appUserRepository;
    private final ActiveSessionRepository activeSessionRepository;
    private final PasswordPolicy passwordPolicy;
    private final PasswordEncoder passwordEncoder;
    private final CredentialAuthenticator credentialAuthenticator;
    private final ConfirmationService confirmationService;
    private final AuthenticationService authenticationService;

    public AccountService(
            AppUserRepository appUserRepository,
            ActiveSessionRepository activeSessionRepository,
            PasswordPolicy passwordPolicy,
            PasswordEncoder passwordEncoder,
            CredentialAuthenticator credentialAuthenticator,
            ConfirmationService confirmationService,
            AuthenticationService authenticationService
    ) {
        this.appUserRepository = appUserRepository;
        this.activeSessionRepository = activeSessionRepository;
        this.passwordPolicy = passwordPolicy;
        this.passwordEncoder = passwordEncoder;
        this.credentialAuthenticator = credentialAuthenticator;
        this.confirmationService = confirmationService;
        this.authenticationService = authenticationService;
    }

    /**
     * Creates an unconfirmed user and mails the confirmation link.
     */
    @Transactional
    public AppUser signUp(String email, String password, String passwordConfirmation) {
        String normalizedEmail = EmailAddresses.normalize(email);
        List<FieldViolation> violations = new ArrayList<>(checkEmail(normalizedEmail));
        if (violations.isEmpty() && appUserRepository.existsByEmail(normalizedEmail)) {
            violations.add(new FieldViolation("email", EMAIL_TAKEN));
        }
        violations.addAll(passwordPolicy.check(password, passwordConfirmation));
        if (!violations.isEmpty()) {
            throw new ValidationProblemException(violations);
        }

        AppUser user;
        try {
            user = appUserRepository.saveAndFlush(new AppUser(normalizedEmail, passwordEncoder.encode(password)));
        } catch (DataIntegrityViolationException ex) {
            throw ValidationProblemException.of("email", EMAIL_TAKEN);
        }
        log.info("User {} signed up", user.getId());
        confirmationService.sendConfirmation(user);
        return user;
    }

    /**
     * Applies an email change (kept pending until confirmed) and/or a password change.
     * Both require the current password.
     */
    @Transactional
    public AppUser updateAccount(
            UUID userId,
            String currentPassword,
            String newEmail,
            String newPassword,
            String newPasswordConfirmation
    ) {
        AppUser user = appUserRepository.findById(userId).orElseThrow(AuthProblems::unauthenticated);
        requireCurrentPassword(user, currentPassword);

        List<FieldViolation> violations = new ArrayList<>();
        String normalizedEmail = EmailAddresses.normalize(newEmail);
        boolean emailChanged = !normalizedEmail.isEmpty() && !normalizedEmail.equals(user.getEmail());
        if (emailChanged) {
            violations.addAll(checkEmail(normalizedEmail));
        }
        boolean passwordChanged = StringUtils.hasText(newPassword);
        if (passwordChanged) {
            violations.addAll(passwordPolicy.check(newPassword, newPasswordConfirmation));
        }
        if (!violations.isEmpty()) {
            throw new ValidationProblemException(violations);
        }

        if (emailChanged) {
            user.requestEmailChange(normalizedEmail);
        }
        if (passwordChanged) {
            user.changePasswordHash(passwordEncoder.encode(newPassword));
        }
        AppUser saved = appUserRepository.save(user);
        if (emailChanged) {
            log.info("User {} requested an email change", saved.getId());
            confirmationService.sendConfirmation(saved);
        }
        if (passwordChanged) {
            log.info("User {} changed their password", saved.getId());
        }
        return saved;
    }

    /**
     * Deletes the user with every active session and leaves the request anonymous.
     */
    @Transactional
    public void deleteAccount(AuthRequestContext context, UUID userId, String currentPassword) {
        AppUser user = appUserRepository.findById(userId).orElseThrow(AuthProblems::unauthenticated);
        requireCurrentPassword(user, currentPassword);

        activeSessionRepository.deleteAllOwnedBy(user.getId());
        appUserRepository.delete(user);
        authenticationService.forgetActiveSession(context);
        authenticationService.resetRequestState(context);
        log.info("User {} deleted their account", user.getId());
    }

    private void requireCurrentPassword(AppUser user, String currentPassword) {
        if (!credentialAuthenticator.verifyPassword(user, currentPassword)) {
            throw ValidationProblemException.of("currentPassword", "is incorrect");
        }
    }

    private static List<FieldViolation> checkEmail(String normalizedEmail) {
        if (normalizedEmail.isEmpty()) {
            return List.of(new FieldViolation("email", "can't be blank"));
        }
        if (!EmailAddresses.isValid(normalizedEmail)) {
            return List.of(new FieldViolation("email", "is invalid"));
        }
        return List.of();
    }
}
