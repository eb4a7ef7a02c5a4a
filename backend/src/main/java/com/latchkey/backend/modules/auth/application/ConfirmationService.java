package com.latchkey.backend.modules.auth.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.domain.EmailAddresses;
import com.latchkey.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Moves users between unconfirmed, reconfirming and confirmed.
 */
@Service
public class ConfirmationService {

    private static final Logger log = LoggerFactory.getLogger(ConfirmationService.class);

    private final AppUserRepository appUserRepository;
    private final SignedTokenCodec tokenCodec;
    private final AccountMailer accountMailer;
    private final Clock clock;

    public ConfirmationService(
            AppUserRepository appUserRepository,
            SignedTokenCodec tokenCodec,
            AccountMailer accountMailer,
            Clock clock
    ) {
        this.appUserRepository = appUserRepository;
        this.tokenCodec = tokenCodec;
        this.accountMailer = accountMailer;
        this.clock = clock;
    }

    /**
     * Re-sends confirmation instructions. Unknown and already-confirmed emails are ignored
     * silently so the caller can answer every request the same way.
     */
    @Transactional(readOnly = true)
    public void requestConfirmation(String email) {
        String normalizedEmail = EmailAddresses.normalize(email);
        if (normalizedEmail.isEmpty()) {
            return;
        }
        appUserRepository.findByEmail(normalizedEmail)
                .filter(AppUser::isConfirmable)
                .ifPresent(this::sendConfirmation);
    }

    public void sendConfirmation(AppUser user) {
        String token = tokenCodec.issue(user.getId(), TokenPurpose.CONFIRM_EMAIL);
        accountMailer.deliver(user, token, TokenPurpose.CONFIRM_EMAIL);
    }

    /**
     * Confirms the user the token was issued for, promoting a pending email change if there is one.
     *
     * @return the confirmed user
     */
    @Transactional
    public AppUser confirm(String token) {
        UUID userId;
        try {
            userId = tokenCodec.verify(token, TokenPurpose.CONFIRM_EMAIL);
        } catch (TokenVerificationException ex) {
            log.debug("Rejected confirmation token: {}", ex.getReason());
            throw AuthProblems.invalidOrExpiredToken();
        }

        AppUser user = appUserRepository.findByIdForUpdate(userId)
                .orElseThrow(AuthProblems::invalidOrExpiredToken);
        if (!user.isConfirmable()) {
            throw AuthProblems.invalidOrExpiredToken();
        }

        String pendingEmail = user.getUnconfirmedEmail();
        if (pendingEmail != null && appUserRepository.existsByEmailOnOtherUser(pendingEmail, user.getId())) {
            log.info("Confirmation for user {} rejected: pending email already taken", user.getId());
            throw AuthProblems.emailNoLongerAvailable();
        }

        user.confirm(OffsetDateTime.now(clock));
        try {
            appUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            // another account claimed the address between the check and the write
            log.info("Confirmation for user {} lost the race for its pending email", user.getId());
            throw AuthProblems.emailNoLongerAvailable();
        }
        log.info("User {} confirmed", user.getId());
        return user;
    }
}
