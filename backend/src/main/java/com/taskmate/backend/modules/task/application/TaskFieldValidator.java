package com.taskmate.backend.modules.task.application;

import com.taskmate.backend.global.error.ProblemException;
import com.taskmate.backend.modules.task.domain.Task;

import org.springframework.http.HttpStatus;
import org.springframework.util.StringUtils;

final class TaskFieldValidator {

    static final String TITLE_REQUIRED = "TITLE_REQUIRED";
    static final String TITLE_TOO_LONG = "TITLE_TOO_LONG";
    static final String DESCRIPTION_TOO_LONG = "DESCRIPTION_TOO_LONG";

    private TaskFieldValidator() {
    }

    /**
     * @return the trimmed title
     */
    static String normalizeTitle(String title) {
        if (!StringUtils.hasText(title)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, TITLE_REQUIRED, "Title cannot be empty");
        }
        String trimmed = title.trim();
        if (characterCount(trimmed) > Task.TITLE_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, TITLE_TOO_LONG,
                    "Title must be " + Task.TITLE_MAX_LENGTH + " characters or less");
        }
        return trimmed;
    }

    /**
     * @return the description, or {@code null} when blank
     */
    static String normalizeDescription(String description) {
        if (!StringUtils.hasText(description)) {
            return null;
        }
        if (characterCount(description) > Task.DESCRIPTION_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, DESCRIPTION_TOO_LONG,
                    "Description must be " + Task.DESCRIPTION_MAX_LENGTH + " characters or less");
        }
        return description;
    }

    // code points, so a surrogate pair counts once, as it does in the VARCHAR columns
    private static int characterCount(String value) {
        return value.codePointCount(0, value.length());
    }
}
