package com.taskmate.backend.modules.task.presentation.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Partial update: {@code null} fields are left unchanged. A blank description clears it.
 */
public record UpdateTaskRequest(
        @Schema(description = "Omit to keep the current title; otherwise trimmed, 1-200 characters", nullable = true)
        String title,
        @Schema(description = "Omit to keep the current description; a blank value clears it to null", nullable = true)
        String description
) {
}
