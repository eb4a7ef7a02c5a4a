package com.latchkey.backend.modules.auth.presentation;

import com.latchkey.backend.modules.auth.application.AccountService;
import com.latchkey.backend.modules.auth.application.AuthRequestContext;
import com.latchkey.backend.modules.auth.application.AuthenticationService;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.presentation.dto.AccountResponse;
import com.latchkey.backend.modules.auth.presentation.dto.SignUpRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Account")
public class UserController {

    private final AccountService accountService;
    private final AuthenticationService authenticationService;

    public UserController(AccountService accountService, AuthenticationService authenticationService) {
        this.accountService = accountService;
        this.authenticationService = authenticationService;
    }

    @Operation(summary = "Sign up", description = "Creates an unconfirmed account and mails confirmation instructions.")
    @PostMapping("/users")
    public ResponseEntity<AccountResponse> signUp(AuthRequestContext context, @RequestBody SignUpRequest request) {
        authenticationService.requireAnonymous(context);
        AppUser user = accountService.signUp(request.email(), request.password(), request.passwordConfirmation());
        return ResponseEntity.status(HttpStatus.CREATED).body(AccountResponse.from(user));
    }
}
