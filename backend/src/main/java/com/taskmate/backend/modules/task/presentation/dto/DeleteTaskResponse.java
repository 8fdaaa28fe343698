package com.taskmate.backend.modules.task.presentation.dto;

import java.util.UUID;

public record DeleteTaskResponse(String message, UUID id) {
}
