package com.taskmate.backend.modules.task.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.taskmate.backend.modules.task.domain.Task;

public interface TaskRepositoryCustom {

    /**
     * Owner's tasks, newest first with id as tie-break, using raw offset/limit instead of page numbers.
     */
    List<Task> findPageByOwner(UUID ownerId, int offset, int limit);
}
