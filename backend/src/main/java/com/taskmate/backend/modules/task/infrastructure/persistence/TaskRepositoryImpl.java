package com.taskmate.backend.modules.task.infrastructure.persistence;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Repository;

import com.taskmate.backend.modules.task.domain.Task;

@Repository
public class TaskRepositoryImpl implements TaskRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Task> findPageByOwner(UUID ownerId, int offset, int limit) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        if (offset < 0 || limit < 1) {
            throw new IllegalArgumentException("offset must be >= 0 and limit >= 1");
        }

        return entityManager.createQuery("""
                        select t
                          from Task t
                         where t.ownerId = :ownerId
                         order by t.createdAt desc, t.id desc
                        """, Task.class)
                .setParameter("ownerId", ownerId)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }
}
