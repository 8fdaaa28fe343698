package com.taskmate.backend.modules.task.presentation.dto;

import jakarta.validation.constraints.NotNull;

import io.swagger.v3.oas.annotations.media.Schema;

public record CreateTaskRequest(
        @Schema(description = "Trimmed before storage; 1-200 characters after trimming")
        @NotNull(message = "title is required") String title,
        @Schema(description = "Up to 1000 characters. A blank value is stored as null", nullable = true)
        String description
) {
}
