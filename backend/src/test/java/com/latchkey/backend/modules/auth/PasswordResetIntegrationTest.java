package com.latchkey.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.csrf;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Duration;
import java.util.Map;

import com.latchkey.backend.modules.auth.application.SignedTokenCodec;
import com.latchkey.backend.modules.auth.application.TokenPurpose;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.infrastructure.persistence.ActiveSessionRepository;
import com.latchkey.backend.support.AbstractIntegrationTest;
import com.latchkey.backend.support.TestUserFactory;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.ResultActions;

class PasswordResetIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private SignedTokenCodec tokenCodec;

    @Autowired
    private ActiveSessionRepository activeSessionRepository;

    @Test
    void unknownAndUnconfirmedEmailsGetTheGenericAnswerAndNoMail() throws Exception {
        testUserFactory.createUnconfirmed("pending@example.com");
        testUserFactory.createConfirmed("alice@example.com");

        String unknown = requestReset("nobody@example.com");
        String unconfirmed = requestReset("pending@example.com");
        assertThat(mailer.deliveries()).isEmpty();

        String confirmed = requestReset("alice@example.com");
        assertThat(confirmed).isEqualTo(unknown).isEqualTo(unconfirmed);
        assertThat(mailer.deliveries(TokenPurpose.RESET_PASSWORD))
                .singleElement()
                .satisfies(delivery -> assertThat(delivery.recipient()).isEqualTo("alice@example.com"));
    }

    @Test
    void resetChangesThePasswordWithoutLoggingIn() throws Exception {
        testUserFactory.createConfirmed("alice@example.com");
        requestReset("alice@example.com");
        String token = mailer.lastToken(TokenPurpose.RESET_PASSWORD);

        mockMvc.perform(get("/passwords/{token}", token)).andExpect(status().isOk());
        MvcResult result = reset(token, "brand-new-1")
                .andExpect(status().isOk())
                .andReturn();

        assertThat(result.getResponse().getCookie(REMEMBER_COOKIE)).isNull();
        assertThat(activeSessionRepository.count()).isZero();

        login("alice@example.com", "brand-new-1", false);
        mockMvc.perform(post("/auth/login")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("email", "alice@example.com", "password", TestUserFactory.DEFAULT_PASSWORD))))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void mismatchedConfirmationLeavesThePasswordAlone() throws Exception {
        testUserFactory.createConfirmed("alice@example.com");
        requestReset("alice@example.com");
        String token = mailer.lastToken(TokenPurpose.RESET_PASSWORD);

        mockMvc.perform(put("/passwords/{token}", token)
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(passwordBody("brand-new-1", "brand-new-2")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.errors.passwordConfirmation[0]").value("doesn't match password"));

        login("alice@example.com");
    }

    @Test
    void sameResetTokenStaysUsableUntilItExpires() throws Exception {
        testUserFactory.createConfirmed("alice@example.com");
        requestReset("alice@example.com");
        String token = mailer.lastToken(TokenPurpose.RESET_PASSWORD);

        reset(token, "first-new-1").andExpect(status().isOk());
        clock.advance(Duration.ofMinutes(5));
        reset(token, "second-new-1").andExpect(status().isOk());
        login("alice@example.com", "second-new-1", false);

        clock.advance(Duration.ofMinutes(6));
        reset(token, "third-new-1")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OR_EXPIRED_TOKEN"));
    }

    @Test
    void confirmationTokensCannotResetPasswords() throws Exception {
        AppUser alice = testUserFactory.createConfirmed("alice@example.com");
        String confirmationToken = tokenCodec.issue(alice.getId(), TokenPurpose.CONFIRM_EMAIL);

        reset(confirmationToken, "brand-new-1")
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_OR_EXPIRED_TOKEN"));
    }

    @Test
    void resetLinkOfAnUnconfirmedAccountIsRefusedWithASpecificSignal() throws Exception {
        AppUser pending = testUserFactory.createUnconfirmed("pending@example.com");
        String token = tokenCodec.issue(pending.getId(), TokenPurpose.RESET_PASSWORD);

        mockMvc.perform(get("/passwords/{token}", token))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCOUNT_UNCONFIRMED"));
        reset(token, "brand-new-1")
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("ACCOUNT_UNCONFIRMED"));
    }

    @Test
    void loggedInCallersCannotUseTheResetFlow() throws Exception {
        testUserFactory.createConfirmed("alice@example.com");
        Device alice = login("alice@example.com");

        mockMvc.perform(post("/passwords")
                        .with(as(alice))
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("email", "alice@example.com"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ALREADY_AUTHENTICATED"));
    }

    private String requestReset(String email) throws Exception {
        return mockMvc.perform(post("/passwords")
                        .with(csrf())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(toJson(Map.of("email", email))))
                .andExpect(status().isAccepted())
                .andReturn()
                .getResponse()
                .getContentAsString();
    }

    private ResultActions reset(String token, String password) throws Exception {
        return mockMvc.perform(put("/passwords/{token}", token)
                .with(csrf())
                .contentType(MediaType.APPLICATION_JSON)
                .content(passwordBody(password, password)));
    }

    private String passwordBody(String password, String confirmation) throws Exception {
        return toJson(Map.of("password", password, "passwordConfirmation", confirmation));
    }
}
