package com.taskmate.backend.modules.auth.presentation.dto;

public record AuthResponse(String token, UserResponse user) {
}
