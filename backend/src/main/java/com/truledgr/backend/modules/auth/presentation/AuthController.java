package com.truledgr.backend.modules.auth.presentation;

import java.util.List;
import java.util.UUID;

import com.truledgr.backend.global.security.SecurityUtils;
import com.truledgr.backend.modules.auth.application.ClientInfo;
import com.truledgr.backend.modules.auth.application.IssuedTokens;
import com.truledgr.backend.modules.auth.application.RefreshedAccess;
import com.truledgr.backend.modules.auth.application.SessionLifecycleService;
import com.truledgr.backend.modules.auth.domain.RegularSession;
import com.truledgr.backend.modules.auth.presentation.dto.LoginRequest;
import com.truledgr.backend.modules.auth.presentation.dto.MessageResponse;
import com.truledgr.backend.modules.auth.presentation.dto.RefreshRequest;
import com.truledgr.backend.modules.auth.presentation.dto.SessionInfoResponse;
import com.truledgr.backend.modules.auth.presentation.dto.TokenResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final SessionLifecycleService sessionLifecycleService;

    public AuthController(SessionLifecycleService sessionLifecycleService) {
        this.sessionLifecycleService = sessionLifecycleService;
    }

    @Operation(summary = "Log in", description = "Verifies credentials and opens a regular session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session opened"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials"),
            @ApiResponse(responseCode = "403", description = "User is inactive")
    })
    @PostMapping("/login")
    public ResponseEntity<TokenResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        IssuedTokens<RegularSession> issued = sessionLifecycleService.login(
                request.username(),
                request.password(),
                clientInfo(httpRequest)
        );
        return ResponseEntity.ok(TokenResponse.bearer(
                issued.accessToken(),
                issued.refreshToken(),
                issued.expiresIn(),
                issued.session().getUserId()
        ));
    }

    @Operation(summary = "Refresh access token", description = "Issues a new access token. The refresh token is returned unchanged.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "New access token issued"),
            @ApiResponse(responseCode = "401", description = "Token invalid, session revoked or expired")
    })
    @PostMapping("/refresh")
    public ResponseEntity<TokenResponse> refresh(@Valid @RequestBody RefreshRequest request) {
        RefreshedAccess refreshed = sessionLifecycleService.refresh(request.refreshToken());
        return ResponseEntity.ok(TokenResponse.bearer(
                refreshed.accessToken(),
                request.refreshToken(),
                refreshed.expiresIn(),
                refreshed.subjectId()
        ));
    }

    @Operation(summary = "Log out", description = "Ends the session behind the presented access token.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Session ended"),
            @ApiResponse(responseCode = "401", description = "Not authenticated")
    })
    @PostMapping("/logout")
    public ResponseEntity<Void> logout() {
        sessionLifecycleService.logout(SecurityUtils.getCurrentIdentity());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List active sessions", description = "Returns the caller's sessions that are neither revoked nor expired.")
    @GetMapping("/sessions")
    public ResponseEntity<List<SessionInfoResponse>> listSessions() {
        return ResponseEntity.ok(sessionLifecycleService.listActiveSessions(SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Revoke a session")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session revoked"),
            @ApiResponse(responseCode = "404", description = "No such session for the caller")
    })
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<MessageResponse> revokeSession(@PathVariable("sessionId") UUID sessionId) {
        sessionLifecycleService.revokeOwned(SecurityUtils.getCurrentUserId(), sessionId);
        return ResponseEntity.ok(new MessageResponse("Session revoked successfully"));
    }

    @Operation(summary = "Revoke all sessions")
    @DeleteMapping("/sessions")
    public ResponseEntity<MessageResponse> revokeAllSessions() {
        int revoked = sessionLifecycleService.revokeAll(SecurityUtils.getCurrentUserId());
        return ResponseEntity.ok(new MessageResponse("Revoked " + revoked + " sessions"));
    }

    static ClientInfo clientInfo(HttpServletRequest request) {
        return ClientInfo.of(request.getRemoteAddr(), request.getHeader(HttpHeaders.USER_AGENT));
    }
}
