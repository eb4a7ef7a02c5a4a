package com.latchkey.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.latchkey.backend.global.error.ValidationProblemException;
import com.latchkey.backend.global.error.ValidationProblemException.FieldViolation;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class PasswordPolicy {

    // BCrypt ignores everything past 72 bytes
    static final int MAX_BYTES = 72;

    private final int minLength;

    public PasswordPolicy(@Value("${latchkey.password.min-length:6}") int minLength) {
        this.minLength = minLength;
    }

    public List<FieldViolation> check(String password, String passwordConfirmation) {
        List<FieldViolation> violations = new ArrayList<>();
        if (password == null || password.isBlank()) {
            violations.add(new FieldViolation("password", "can't be blank"));
            return violations;
        }
        if (password.length() < minLength) {
            violations.add(new FieldViolation("password", "is too short (minimum is " + minLength + " characters)"));
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > MAX_BYTES) {
            violations.add(new FieldViolation("password", "is too long (maximum is " + MAX_BYTES + " bytes)"));
        }
        if (passwordConfirmation == null || !password.equals(passwordConfirmation)) {
            violations.add(new FieldViolation("passwordConfirmation", "doesn't match password"));
        }
        return violations;
    }

    public void validate(String password, String passwordConfirmation) {
        List<FieldViolation> violations = check(password, passwordConfirmation);
        if (!violations.isEmpty()) {
            throw new ValidationProblemException(violations);
        }
    }
}
