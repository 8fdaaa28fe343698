package com.taskmate.backend.modules.task.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record TaskResponse(
        UUID id,
        String title,
        String description,
        boolean completed,
        UUID userId,
        OffsetDateTime createdAt,
        OffsetDateTime completedAt
) {
}
