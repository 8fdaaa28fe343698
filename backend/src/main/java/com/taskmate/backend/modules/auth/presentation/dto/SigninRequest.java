package com.taskmate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record SigninRequest(
        @NotBlank(message = "email is required") String email,
        @NotBlank(message = "password is required") String password
) {

    @Override
    public String toString() {
        return "SigninRequest[email=" + email + "]";
    }
}
