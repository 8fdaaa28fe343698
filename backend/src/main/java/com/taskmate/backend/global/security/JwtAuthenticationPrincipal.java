package com.taskmate.backend.global.security;

import java.time.OffsetDateTime;
import java.util.UUID;

public record JwtAuthenticationPrincipal(UUID userId, OffsetDateTime tokenExpiresAt) {
}
