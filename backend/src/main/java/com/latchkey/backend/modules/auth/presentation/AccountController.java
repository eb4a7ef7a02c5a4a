package com.latchkey.backend.modules.auth.presentation;

import com.latchkey.backend.modules.auth.application.AccountService;
import com.latchkey.backend.modules.auth.application.AuthRequestContext;
import com.latchkey.backend.modules.auth.application.AuthenticationService;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.presentation.dto.AccountDeleteRequest;
import com.latchkey.backend.modules.auth.presentation.dto.AccountResponse;
import com.latchkey.backend.modules.auth.presentation.dto.AccountUpdateRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Account")
public class AccountController {

    private final AccountService accountService;
    private final AuthenticationService authenticationService;

    public AccountController(AccountService accountService, AuthenticationService authenticationService) {
        this.accountService = accountService;
        this.authenticationService = authenticationService;
    }

    @GetMapping("/account")
    public ResponseEntity<AccountResponse> show(AuthRequestContext context) {
        AppUser user = authenticationService.requireAuthenticated(context);
        return ResponseEntity.ok(AccountResponse.from(user));
    }

    @Operation(
            summary = "Update account",
            description = "A new email stays pending until confirmed from the link mailed to it. Requires the current password."
    )
    @PutMapping("/account")
    public ResponseEntity<AccountResponse> update(AuthRequestContext context, @RequestBody AccountUpdateRequest request) {
        AppUser user = authenticationService.requireAuthenticated(context);
        AppUser updated = accountService.updateAccount(
                user.getId(),
                request.currentPassword(),
                request.email(),
                request.password(),
                request.passwordConfirmation()
        );
        return ResponseEntity.ok(AccountResponse.from(updated));
    }

    @Operation(summary = "Delete account", description = "Deletes the account with all of its active sessions.")
    @DeleteMapping("/account")
    public ResponseEntity<Void> delete(AuthRequestContext context, @RequestBody AccountDeleteRequest request) {
        AppUser user = authenticationService.requireAuthenticated(context);
        accountService.deleteAccount(context, user.getId(), request.currentPassword());
        return ResponseEntity.noContent().build();
    }
}
