package com.latchkey.backend.modules.auth.presentation;

import com.latchkey.backend.modules.auth.application.AuthRequestContext;
import com.latchkey.backend.modules.auth.application.AuthenticationService;
import com.latchkey.backend.modules.auth.application.ConfirmationService;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.presentation.dto.AccountResponse;
import com.latchkey.backend.modules.auth.presentation.dto.ConfirmationResponse;
import com.latchkey.backend.modules.auth.presentation.dto.EmailRequest;
import com.latchkey.backend.modules.auth.presentation.dto.MessageResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Confirmations")
public class ConfirmationController {

    static final String RESEND_MESSAGE =
            "If that account exists and is unconfirmed, you will receive an email with confirmation instructions shortly.";
    static final String CONFIRMED_MESSAGE = "Your account has been confirmed.";

    private final ConfirmationService confirmationService;
    private final AuthenticationService authenticationService;

    public ConfirmationController(ConfirmationService confirmationService, AuthenticationService authenticationService) {
        this.confirmationService = confirmationService;
        this.authenticationService = authenticationService;
    }

    @Operation(summary = "Resend confirmation instructions", description = "Answers 202 whether or not the email belongs to an account.")
    @PostMapping("/confirmations")
    public ResponseEntity<MessageResponse> resend(AuthRequestContext context, @RequestBody EmailRequest request) {
        authenticationService.requireAnonymous(context);
        confirmationService.requestConfirmation(request.email());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new MessageResponse(RESEND_MESSAGE));
    }

    @Operation(summary = "Confirm an email address", description = "Logs the confirmed user in unless the caller already is that user.")
    @GetMapping("/confirmations/{token}")
    public ResponseEntity<ConfirmationResponse> confirm(AuthRequestContext context, @PathVariable String token) {
        AppUser confirmed = confirmationService.confirm(token);
        boolean alreadyLoggedIn = authenticationService.resolveCurrentUser(context)
                .map(current -> current.getId().equals(confirmed.getId()))
                .orElse(false);
        if (!alreadyLoggedIn) {
            authenticationService.forgetActiveSession(context);
            authenticationService.login(context, confirmed);
        }
        return ResponseEntity.ok(new ConfirmationResponse(CONFIRMED_MESSAGE, AccountResponse.from(confirmed), !alreadyLoggedIn));
    }
}
