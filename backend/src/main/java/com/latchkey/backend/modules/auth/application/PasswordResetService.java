package com.latchkey.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.domain.EmailAddresses;
import com.latchkey.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class PasswordResetService {

    private static final Logger log = LoggerFactory.getLogger(PasswordResetService.class);

    public enum RequestOutcome {
        SENT,
        NO_ACCOUNT,
        ACCOUNT_UNCONFIRMED
    }

    private final AppUserRepository appUserRepository;
    private final SignedTokenCodec tokenCodec;
    private final AccountMailer accountMailer;
    private final PasswordPolicy passwordPolicy;
    private final PasswordEncoder passwordEncoder;

    public PasswordResetService(
            AppUserRepository appUserRepository,
            SignedTokenCodec tokenCodec,
            AccountMailer accountMailer,
            PasswordPolicy passwordPolicy,
            PasswordEncoder passwordEncoder
    ) {
        this.appUserRepository = appUserRepository;
        this.tokenCodec = tokenCodec;
        this.accountMailer = accountMailer;
        this.passwordPolicy = passwordPolicy;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * Mails reset instructions to confirmed accounts only. The outcome is for logging and tests;
     * the HTTP layer answers every outcome identically.
     */
    @Transactional(readOnly = true)
    public RequestOutcome requestReset(String email) {
        String normalizedEmail = EmailAddresses.normalize(email);
        Optional<AppUser> user = normalizedEmail.isEmpty()
                ? Optional.empty()
                : appUserRepository.findByEmail(normalizedEmail);
        if (user.isEmpty()) {
            return RequestOutcome.NO_ACCOUNT;
        }
        if (!user.get().isConfirmed()) {
            return RequestOutcome.ACCOUNT_UNCONFIRMED;
        }
        String token = tokenCodec.issue(user.get().getId(), TokenPurpose.RESET_PASSWORD);
        accountMailer.deliver(user.get(), token, TokenPurpose.RESET_PASSWORD);
        return RequestOutcome.SENT;
    }

    /**
     * Resolves the user behind a reset link without changing anything.
     */
    @Transactional(readOnly = true)
    public AppUser verifyResetToken(String token) {
        UUID userId;
        try {
            userId = tokenCodec.verify(token, TokenPurpose.RESET_PASSWORD);
        } catch (TokenVerificationException ex) {
            log.debug("Rejected password reset token: {}", ex.getReason());
            throw AuthProblems.invalidOrExpiredToken();
        }
        AppUser user = appUserRepository.findById(userId)
                .orElseThrow(AuthProblems::invalidOrExpiredToken);
        if (!user.isConfirmed()) {
            throw AuthProblems.accountUnconfirmed();
        }
        return user;
    }

    /**
     * Replaces the password of the token's user. Does not sign anybody in.
     */
    @Transactional
    public AppUser consumeReset(String token, String newPassword, String newPasswordConfirmation) {
        AppUser user = verifyResetToken(token);
        passwordPolicy.validate(newPassword, newPasswordConfirmation);
        user.changePasswordHash(passwordEncoder.encode(newPassword));
        AppUser saved = appUserRepository.save(user);
        log.info("Password reset for user {}", saved.getId());
        return saved;
    }
}
