package com.taskmate.backend.modules.auth.presentation.dto;

public record SignoutResponse(String message) {
}
