package com.taskmate.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank(message = "email is required")
        @Email(regexp = "[^@\\s]+@[^@\\s]+\\.[^@\\s]+", message = "email must be a valid address")
        @Size(max = 255, message = "email must be at most 255 characters")
        String email,
        @NotBlank(message = "password is required")
        @Size(min = 8, max = 72, message = "password must be 8-72 characters")
        String password
) {

    @Override
    public String toString() {
        return "SignupRequest[email=" + email + "]";
    }
}
