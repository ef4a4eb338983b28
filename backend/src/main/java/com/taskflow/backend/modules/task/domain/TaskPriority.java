package com.taskflow.backend.modules.task.domain;

import java.util.Locale;

import com.taskflow.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Priority labels accepted at task creation. Tasks store the label itself.
 */
public enum TaskPriority {
    LOW("low"),
    NORMAL("normal"),
    HIGH("high");

    private final String label;

    TaskPriority(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static TaskPriority fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return NORMAL;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskPriority priority : values()) {
            if (priority.label.equals(normalized)) {
                return priority;
            }
        }
        throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_PRIORITY",
                "unknown task priority: " + value);
    }
}
