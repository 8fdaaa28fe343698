package com.taskmate.backend.modules.task.presentation.dto;

import java.util.List;

public record TaskListResponse(
        List<TaskResponse> tasks,
        long total,
        long completed,
        long pending
) {
}
