package com.taskmate.backend.modules.task.application;

import java.util.Optional;
import java.util.UUID;

import com.taskmate.backend.global.error.ProblemException;
import com.taskmate.backend.modules.task.domain.AccessDecision;
import com.taskmate.backend.modules.task.domain.Task;
import com.taskmate.backend.modules.task.infrastructure.persistence.TaskRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides whether a caller may touch a task.
 * <p>
 * A missing task and a task owned by someone else are reported differently (404 vs 403).
 */
@Component
public class OwnershipGuard {

    private static final Logger log = LoggerFactory.getLogger(OwnershipGuard.class);

    public static final String TASK_NOT_FOUND = "TASK_NOT_FOUND";
    public static final String TASK_FORBIDDEN = "TASK_FORBIDDEN";

    private final TaskRepository taskRepository;

    public OwnershipGuard(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    public static AccessDecision authorize(UUID userId, Optional<UUID> ownerId) {
        if (ownerId.isEmpty()) {
            return AccessDecision.NOT_FOUND;
        }
        return ownerId.get().equals(userId) ? AccessDecision.ALLOW : AccessDecision.FORBIDDEN;
    }

    /**
     * Loads the task once and checks it against the caller. Joins the caller's transaction so the
     * returned entity stays managed for the mutation that follows.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Task requireOwnedTask(UUID userId, UUID taskId) {
        Optional<Task> task = taskRepository.findById(taskId);
        AccessDecision decision = authorize(userId, task.map(Task::getOwnerId));
        if (decision == AccessDecision.NOT_FOUND) {
            throw new ProblemException(HttpStatus.NOT_FOUND, TASK_NOT_FOUND, "Task not found");
        }
        if (decision == AccessDecision.FORBIDDEN) {
            log.warn("User {} denied access to task {}", userId, taskId);
            throw new ProblemException(HttpStatus.FORBIDDEN, TASK_FORBIDDEN,
                    "You do not have permission to access this task");
        }
        return task.get();
    }
}
