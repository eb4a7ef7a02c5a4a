package com.latchkey.backend.modules.auth.presentation;

import com.latchkey.backend.modules.auth.application.AuthRequestContext;
import com.latchkey.backend.modules.auth.application.AuthenticationService;
import com.latchkey.backend.modules.auth.application.PasswordResetService;
import com.latchkey.backend.modules.auth.presentation.dto.EmailRequest;
import com.latchkey.backend.modules.auth.presentation.dto.MessageResponse;
import com.latchkey.backend.modules.auth.presentation.dto.PasswordUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Passwords")
public class PasswordController {

    static final String REQUESTED_MESSAGE =
            "If that account exists and is confirmed, you will receive an email with password reset instructions shortly.";
    static final String VALID_TOKEN_MESSAGE = "Choose a new password.";
    static final String RESET_MESSAGE = "Password updated. Please log in.";

    private final PasswordResetService passwordResetService;
    private final AuthenticationService authenticationService;

    public PasswordController(PasswordResetService passwordResetService, AuthenticationService authenticationService) {
        this.passwordResetService = passwordResetService;
        this.authenticationService = authenticationService;
    }

    @Operation(summary = "Request a password reset", description = "Answers 202 whatever the state of the account.")
    @PostMapping("/passwords")
    public ResponseEntity<MessageResponse> request(AuthRequestContext context, @RequestBody EmailRequest request) {
        authenticationService.requireAnonymous(context);
        passwordResetService.requestReset(request.email());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse(REQUESTED_MESSAGE));
    }

    @GetMapping("/passwords/{token}")
    public ResponseEntity<MessageResponse> check(AuthRequestContext context, @PathVariable String token) {
        authenticationService.requireAnonymous(context);
        passwordResetService.verifyResetToken(token);
        return ResponseEntity.ok(new MessageResponse(VALID_TOKEN_MESSAGE));
    }

    @Operation(summary = "Reset the password", description = "Does not log the user in.")
    @PutMapping("/passwords/{token}")
    public ResponseEntity<MessageResponse> reset(
            AuthRequestContext context,
            @PathVariable String token,
            @RequestBody PasswordUpdateRequest request
    ) {
        authenticationService.requireAnonymous(context);
        passwordResetService.consumeReset(token, request.password(), request.passwordConfirmation());
        return ResponseEntity.ok(new MessageResponse(RESET_MESSAGE));
    }
}
