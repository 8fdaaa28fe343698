package com.taskmate.backend.modules.task.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.taskmate.backend.global.error.ProblemException;
import com.taskmate.backend.modules.task.domain.Task;
import com.taskmate.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskmate.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskmate.backend.modules.task.presentation.dto.DeleteTaskResponse;
import com.taskmate.backend.modules.task.presentation.dto.TaskDtoMapper;
import com.taskmate.backend.modules.task.presentation.dto.TaskListResponse;
import com.taskmate.backend.modules.task.presentation.dto.TaskResponse;
import com.taskmate.backend.modules.task.presentation.dto.UpdateTaskRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 100;
    static final String INVALID_PAGINATION = "INVALID_PAGINATION";
    static final String DELETED_MESSAGE = "Task deleted successfully";

    private final TaskRepository taskRepository;
    private final OwnershipGuard ownershipGuard;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository, OwnershipGuard ownershipGuard, Clock clock) {
        this.taskRepository = taskRepository;
        this.ownershipGuard = ownershipGuard;
        this.clock = clock;
    }

    public TaskResponse createTask(UUID userId, CreateTaskRequest request) {
        String title = TaskFieldValidator.normalizeTitle(request.title());
        String description = TaskFieldValidator.normalizeDescription(request.description());

        Task saved = taskRepository.saveAndFlush(new Task(userId, title, description));
        log.debug("User {} created task {}", userId, saved.getId());
        return TaskDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public TaskListResponse listTasks(UUID userId, Integer limit, Integer offset) {
        int resolvedLimit = limit == null ? DEFAULT_LIMIT : limit;
        int resolvedOffset = offset == null ? 0 : offset;
        if (resolvedLimit < 1 || resolvedLimit > MAX_LIMIT) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, INVALID_PAGINATION,
                    "limit must be between 1 and " + MAX_LIMIT);
        }
        if (resolvedOffset < 0) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, INVALID_PAGINATION,
                    "offset must be 0 or greater");
        }

        List<TaskResponse> tasks = taskRepository.findPageByOwner(userId, resolvedOffset, resolvedLimit).stream()
                .map(TaskDtoMapper::toResponse)
                .toList();
        long total = taskRepository.countByOwnerId(userId);
        long completed = taskRepository.countByOwnerIdAndCompletedTrue(userId);
        return new TaskListResponse(tasks, total, completed, total - completed);
    }

    @Transactional(readOnly = true)
    public TaskResponse getTask(UUID userId, UUID taskId) {
        return TaskDtoMapper.toResponse(ownershipGuard.requireOwnedTask(userId, taskId));
    }

    public TaskResponse updateTask(UUID userId, UUID taskId, UpdateTaskRequest request) {
        Task task = ownershipGuard.requireOwnedTask(userId, taskId);

        // validate both fields before touching the entity so a rejected update changes nothing
        String title = request.title() != null ? TaskFieldValidator.normalizeTitle(request.title()) : null;
        String description = request.description() != null
                ? TaskFieldValidator.normalizeDescription(request.description())
                : null;

        if (title != null) {
            task.setTitle(title);
        }
        if (request.description() != null) {
            task.setDescription(description);
        }
        return TaskDtoMapper.toResponse(taskRepository.saveAndFlush(task));
    }

    public DeleteTaskResponse deleteTask(UUID userId, UUID taskId) {
        Task task = ownershipGuard.requireOwnedTask(userId, taskId);
        taskRepository.delete(task);
        log.debug("User {} deleted task {}", userId, taskId);
        return new DeleteTaskResponse(DELETED_MESSAGE, taskId);
    }

    public TaskResponse toggleTask(UUID userId, UUID taskId) {
        Task task = ownershipGuard.requireOwnedTask(userId, taskId);
        task.toggleCompleted(OffsetDateTime.now(clock));
        return TaskDtoMapper.toResponse(taskRepository.saveAndFlush(task));
    }
}
