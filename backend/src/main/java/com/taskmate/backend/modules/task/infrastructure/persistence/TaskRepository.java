package com.taskmate.backend.modules.task.infrastructure.persistence;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.taskmate.backend.modules.task.domain.Task;

public interface TaskRepository extends JpaRepository<Task, UUID>, TaskRepositoryCustom {

    long countByOwnerId(UUID ownerId);

    long countByOwnerIdAndCompletedTrue(UUID ownerId);
}
