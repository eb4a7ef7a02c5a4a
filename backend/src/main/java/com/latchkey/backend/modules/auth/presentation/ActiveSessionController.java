package com.latchkey.backend.modules.auth.presentation;

import java.util.List;
import java.util.UUID;

import com.latchkey.backend.modules.auth.application.AuthRequestContext;
import com.latchkey.backend.modules.auth.application.AuthenticationService;
import com.latchkey.backend.modules.auth.domain.ActiveSession;
import com.latchkey.backend.modules.auth.domain.AppUser;
import com.latchkey.backend.modules.auth.presentation.dto.ActiveSessionResponse;
import com.latchkey.backend.modules.auth.presentation.dto.RevocationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Active sessions")
public class ActiveSessionController {

    private final AuthenticationService authenticationService;

    public ActiveSessionController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @Operation(summary = "List the caller's devices", description = "Newest first; the caller's own session is flagged.")
    @GetMapping("/active-sessions")
    public ResponseEntity<List<ActiveSessionResponse>> list(AuthRequestContext context) {
        AppUser user = authenticationService.requireAuthenticated(context);
        UUID currentId = authenticationService.resolveCurrentSession(context)
                .map(ActiveSession::getId)
                .orElse(null);
        List<ActiveSessionResponse> sessions = authenticationService.listActiveSessions(user).stream()
                .map(activeSession -> ActiveSessionResponse.from(activeSession, activeSession.getId().equals(currentId)))
                .toList();
        return ResponseEntity.ok(sessions);
    }

    @Operation(summary = "Revoke one device", description = "Revoking the caller's own session signs the caller out.")
    @DeleteMapping("/active-sessions/{activeSessionId}")
    public ResponseEntity<RevocationResponse> revoke(AuthRequestContext context, @PathVariable UUID activeSessionId) {
        AppUser user = authenticationService.requireAuthenticated(context);
        authenticationService.revoke(context, user, activeSessionId);
        boolean signedOut = authenticationService.resolveCurrentUser(context).isEmpty();
        if (signedOut) {
            authenticationService.forgetActiveSession(context);
        }
        return ResponseEntity.ok(new RevocationResponse(signedOut));
    }

    @Operation(summary = "Sign out everywhere")
    @DeleteMapping("/active-sessions")
    public ResponseEntity<RevocationResponse> revokeAll(AuthRequestContext context) {
        AppUser user = authenticationService.requireAuthenticated(context);
        authenticationService.revokeAll(context, user);
        authenticationService.forgetActiveSession(context);
        return ResponseEntity.ok(new RevocationResponse(true));
    }
}
