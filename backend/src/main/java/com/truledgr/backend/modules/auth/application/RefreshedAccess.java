package com.truledgr.backend.modules.auth.application;

import java.util.UUID;

public record RefreshedAccess(String accessToken, long expiresIn, UUID subjectId) {
}
