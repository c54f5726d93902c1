package com.truledgr.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
