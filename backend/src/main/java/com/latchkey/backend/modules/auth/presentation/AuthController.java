package com.latchkey.backend.modules.auth.presentation;

import com.latchkey.backend.modules.auth.application.AuthRequestContext;
import com.latchkey.backend.modules.auth.application.AuthenticationService;
import com.latchkey.backend.modules.auth.application.SignInService;
import com.latchkey.backend.modules.auth.domain.ActiveSession;
import com.latchkey.backend.modules.auth.presentation.dto.AccountResponse;
import com.latchkey.backend.modules.auth.presentation.dto.CsrfTokenResponse;
import com.latchkey.backend.modules.auth.presentation.dto.LoginRequest;
import com.latchkey.backend.modules.auth.presentation.dto.LoginResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.security.web.csrf.CsrfToken;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final SignInService signInService;
    private final AuthenticationService authenticationService;

    public AuthController(SignInService signInService, AuthenticationService authenticationService) {
        this.signInService = signInService;
        this.authenticationService = authenticationService;
    }

    @Operation(summary = "CSRF token", description = "Also sets the XSRF-TOKEN cookie that state-changing requests echo back.")
    @GetMapping("/auth/csrf")
    public ResponseEntity<CsrfTokenResponse> csrf(CsrfToken csrfToken) {
        return ResponseEntity.ok(new CsrfTokenResponse(
                csrfToken.getHeaderName(),
                csrfToken.getParameterName(),
                csrfToken.getToken()
        ));
    }

    @Operation(summary = "Log in", description = "Rotates the session and records a new active session for this device.")
    @PostMapping("/auth/login")
    public ResponseEntity<LoginResponse> login(AuthRequestContext context, @Valid @RequestBody LoginRequest request) {
        authenticationService.requireAnonymous(context);
        ActiveSession activeSession = signInService.signIn(context, request.email(), request.password(), request.rememberMe());
        return ResponseEntity.ok(new LoginResponse(
                AccountResponse.from(activeSession.getUser()),
                activeSession.getId(),
                request.rememberMe()
        ));
    }

    @DeleteMapping("/auth/logout")
    public ResponseEntity<Void> logout(AuthRequestContext context) {
        authenticationService.requireAuthenticated(context);
        signInService.signOut(context);
        return ResponseEntity.noContent().build();
    }
}
