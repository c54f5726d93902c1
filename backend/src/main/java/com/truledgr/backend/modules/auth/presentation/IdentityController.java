package com.truledgr.backend.modules.auth.presentation;

import com.truledgr.backend.global.security.SecurityUtils;
import com.truledgr.backend.modules.auth.presentation.dto.WhoAmIResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class IdentityController {

    @Operation(summary = "Resolve the current identity", description = "Shows who the bearer token acts as, including impersonation details.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Resolved"),
            @ApiResponse(responseCode = "401", description = "Token invalid or session no longer valid")
    })
    @GetMapping("/auth/whoami")
    public ResponseEntity<WhoAmIResponse> whoami() {
        return ResponseEntity.ok(WhoAmIResponse.from(SecurityUtils.getCurrentIdentity()));
    }
}
