package com.taskmate.backend.modules.task.presentation.dto;

import com.taskmate.backend.modules.task.domain.Task;

public final class TaskDtoMapper {

    private TaskDtoMapper() {
    }

    public static TaskResponse toResponse(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.isCompleted(),
                task.getOwnerId(),
                task.getCreatedAt(),
                task.getCompletedAt()
        );
    }
}
