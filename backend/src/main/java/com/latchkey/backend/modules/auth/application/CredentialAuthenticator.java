package com.latchkey.backend.modules.auth.application;

import java.util.Optional;
import java.util.UUID;

import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.domain.EmailAddresses;
import com.latchkey.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Email + password verification that costs one password-hash comparison whether or not the
 * email belongs to an account, so response time does not reveal registered addresses.
 */
@Component
public class CredentialAuthenticator {

    private final AppUserRepository appUserRepository;
    private final PasswordEncoder passwordEncoder;

    private volatile String decoyPasswordHash;

    public CredentialAuthenticator(AppUserRepository appUserRepository, PasswordEncoder passwordEncoder) {
        this.appUserRepository = appUserRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional(readOnly = true)
    public Optional<AppUser> authenticate(String email, String password) {
        String candidate = password == null ? "" : password;
        String normalizedEmail = EmailAddresses.normalize(email);
        Optional<AppUser> user = normalizedEmail.isEmpty()
                ? Optional.empty()
                : appUserRepository.findByEmail(normalizedEmail);

        if (user.isEmpty()) {
            passwordEncoder.matches(candidate, decoyPasswordHash());
            return Optional.empty();
        }
        return passwordEncoder.matches(candidate, user.get().getPasswordHash()) ? user : Optional.empty();
    }

    public boolean verifyPassword(AppUser user, String password) {
        return password != null && passwordEncoder.matches(password, user.getPasswordHash());
    }

    private String decoyPasswordHash() {
        String hash = decoyPasswordHash;
        if (hash == null) {
            synchronized (this) {
                hash = decoyPasswordHash;
                if (hash == null) {
                    hash = passwordEncoder.encode(UUID.randomUUID().toString());
                    decoyPasswordHash = hash;
                }
            }
        }
        return hash;
    }
}
