package com.truledgr.backend.modules.auth.presentation;

import java.util.List;

import com.truledgr.backend.global.security.SecurityUtils;
import com.truledgr.backend.modules.auth.application.AuthException;
import com.truledgr.backend.modules.auth.application.AuthFailure;
import com.truledgr.backend.modules.auth.application.ImpersonationService;
import com.truledgr.backend.modules.auth.application.ResolvedIdentity;
import com.truledgr.backend.modules.auth.presentation.dto.EndImpersonationRequest;
import com.truledgr.backend.modules.auth.presentation.dto.ImpersonationSessionResponse;
import com.truledgr.backend.modules.auth.presentation.dto.ImpersonationTokenResponse;
import com.truledgr.backend.modules.auth.presentation.dto.MessageResponse;
import com.truledgr.backend.modules.auth.presentation.dto.StartImpersonationRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Administrator impersonation. All routes act as the administrator's own identity, so they are
 * refused for requests that are themselves impersonating.
 */
@RestController
@RequestMapping("/auth/impersonations")
public class ImpersonationController {

    private final ImpersonationService impersonationService;

    public ImpersonationController(ImpersonationService impersonationService) {
        this.impersonationService = impersonationService;
    }

    @Operation(summary = "Start impersonation", description = "Issues tokens that act as the target user for a fixed period.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Impersonation started"),
            @ApiResponse(responseCode = "400", description = "Reason missing or too long"),
            @ApiResponse(responseCode = "403", description = "Admin required or self impersonation"),
            @ApiResponse(responseCode = "404", description = "Target user missing or inactive")
    })
    @PostMapping
    public ResponseEntity<ImpersonationTokenResponse> start(
            @RequestBody StartImpersonationRequest request,
            HttpServletRequest httpRequest
    ) {
        ResolvedIdentity admin = requireOwnIdentity();
        ImpersonationTokenResponse response = ImpersonationTokenResponse.from(impersonationService.start(
                admin.userId(),
                request.targetUserId(),
                request.reason(),
                AuthController.clientInfo(httpRequest)
        ));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "End impersonation", description = "Only the administrator who started the session may end it.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session ended, or already ended"),
            @ApiResponse(responseCode = "403", description = "Session belongs to another administrator"),
            @ApiResponse(responseCode = "404", description = "Session not found")
    })
    @DeleteMapping
    public ResponseEntity<MessageResponse> end(@Valid @RequestBody EndImpersonationRequest request) {
        ResolvedIdentity admin = requireOwnIdentity();
        impersonationService.end(admin.userId(), request.impersonationSessionId());
        return ResponseEntity.ok(new MessageResponse("Impersonation session ended successfully"));
    }

    @Operation(summary = "List impersonation sessions", description = "Sessions started by the calling administrator, newest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Listed"),
            @ApiResponse(responseCode = "401", description = "Not authenticated"),
            @ApiResponse(responseCode = "403", description = "Admin required")
    })
    @GetMapping
    public ResponseEntity<List<ImpersonationSessionResponse>> list() {
        ResolvedIdentity admin = requireOwnIdentity();
        return ResponseEntity.ok(impersonationService.listForAdmin(admin.userId()));
    }

    private static ResolvedIdentity requireOwnIdentity() {
        ResolvedIdentity identity = SecurityUtils.getCurrentIdentity();
        if (identity.impersonating()) {
            throw new AuthException(AuthFailure.ADMIN_REQUIRED);
        }
        return identity;
    }
}
