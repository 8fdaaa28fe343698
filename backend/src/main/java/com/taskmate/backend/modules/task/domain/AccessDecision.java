package com.taskmate.backend.modules.task.domain;

public enum AccessDecision {
    ALLOW,
    FORBIDDEN,
    NOT_FOUND
}
