package com.taskmate.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskmate.backend.modules.auth.domain.AppUser;

public record UserResponse(UUID id, String email, OffsetDateTime createdAt) {

    public static UserResponse from(AppUser user) {
        return new UserResponse(user.getId(), user.getEmail(), user.getCreatedAt());
    }
}
