package com.latchkey.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import com.latchkey.backend.global.error.ValidationProblemException.FieldViolation;

import org.junit.jupiter.api.Test;

class PasswordPolicyTest {

    private final PasswordPolicy policy = new PasswordPolicy(6);

    @Test
    void acceptsAMatchingPasswordOfMinimumLength() {
        assertThat(policy.check("abcdef", "abcdef")).isEmpty();
    }

    @Test
    void blankPasswordReportsOnlyBlank() {
        assertThat(policy.check(" ", " "))
                .containsExactly(new FieldViolation("password", "can't be blank"));
    }

    @Test
    void reportsLengthAndConfirmationTogether() {
        List<FieldViolation> violations = policy.check("abc", "abd");

        assertThat(violations).extracting(FieldViolation::field)
                .containsExactly("password", "passwordConfirmation");
    }

    @Test
    void rejectsPasswordsBeyondTheHashInputLimit() {
        String tooLong = "a".repeat(PasswordPolicy.MAX_BYTES + 1);

        assertThat(policy.check(tooLong, tooLong)).extracting(FieldViolation::message)
                .containsExactly("is too long (maximum is 72 bytes)");
    }
}
