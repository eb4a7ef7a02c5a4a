package com.latchkey.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.infrastructure.persistence.AppUserRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@ExtendWith(MockitoExtension.class)
class CredentialAuthenticatorTest {

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    private CredentialAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        authenticator = new CredentialAuthenticator(appUserRepository, passwordEncoder);
    }

    @Test
    void matchingPasswordReturnsTheUser() {
        AppUser user = new AppUser("alice@example.com", "stored-hash");
        when(appUserRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("secret1", "stored-hash")).thenReturn(true);

        assertThat(authenticator.authenticate("  Alice@Example.com ", "secret1")).containsSame(user);
    }

    @Test
    void wrongPasswordReturnsEmpty() {
        AppUser user = new AppUser("alice@example.com", "stored-hash");
        when(appUserRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("wrong", "stored-hash")).thenReturn(false);

        assertThat(authenticator.authenticate("alice@example.com", "wrong")).isEmpty();
    }

    @Test
    @DisplayName("an unknown email still costs one hash comparison")
    void unknownEmailComparesAgainstADecoyHash() {
        when(appUserRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        when(passwordEncoder.encode(anyString())).thenReturn("decoy-hash");

        assertThat(authenticator.authenticate("nobody@example.com", "secret1")).isEmpty();
        assertThat(authenticator.authenticate("nobody@example.com", "secret2")).isEmpty();

        verify(passwordEncoder, times(1)).encode(anyString());
        verify(passwordEncoder).matches("secret1", "decoy-hash");
        verify(passwordEncoder).matches("secret2", "decoy-hash");
    }

    @Test
    void blankEmailSkipsTheLookupButNotTheComparison() {
        when(passwordEncoder.encode(anyString())).thenReturn("decoy-hash");

        assertThat(authenticator.authenticate("   ", "secret1")).isEmpty();

        verify(appUserRepository, never()).findByEmail(anyString());
        verify(passwordEncoder).matches(eq("secret1"), eq("decoy-hash"));
    }

    @Test
    void verifyPasswordRejectsNull() {
        AppUser user = new AppUser("alice@example.com", "stored-hash");

        assertThat(authenticator.verifyPassword(user, null)).isFalse();
        verify(passwordEncoder, never()).matches(anyString(), anyString());
    }

    @Test
    @DisplayName("unknown and known emails take comparable time with a real BCrypt encoder")
    void responseTimeDoesNotRevealRegisteredEmails() {
        BCryptPasswordEncoder bcrypt = new BCryptPasswordEncoder(8);
        AppUser user = new AppUser("alice@example.com", bcrypt.encode("secret1"));
        when(appUserRepository.findByEmail("alice@example.com")).thenReturn(Optional.of(user));
        when(appUserRepository.findByEmail("nobody@example.com")).thenReturn(Optional.empty());
        CredentialAuthenticator timed = new CredentialAuthenticator(appUserRepository, bcrypt);

        // warm up, including the one-off decoy hash
        for (int i = 0; i < 3; i++) {
            timed.authenticate("alice@example.com", "wrong");
            timed.authenticate("nobody@example.com", "wrong");
        }

        List<Long> known = new ArrayList<>();
        List<Long> unknown = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            known.add(elapsed(() -> timed.authenticate("alice@example.com", "wrong")));
            unknown.add(elapsed(() -> timed.authenticate("nobody@example.com", "wrong")));
        }

        double ratio = (double) median(unknown) / median(known);
        assertThat(ratio).isBetween(0.5, 2.0);
    }

    private static long elapsed(Runnable action) {
        long start = System.nanoTime();
        action.run();
        return System.nanoTime() - start;
    }

    private static long median(List<Long> samples) {
        List<Long> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        return sorted.get(sorted.size() / 2);
    }
}
