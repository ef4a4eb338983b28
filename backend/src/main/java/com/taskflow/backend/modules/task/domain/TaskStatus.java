package com.taskflow.backend.modules.task.domain;

import java.util.EnumSet;
import java.util.Set;

import com.taskflow.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

public enum TaskStatus {
    NEW("new", "was created"),
    IN_PROGRESS("in-progress", "was taken into work"),
    COMPLETED("completed", "was completed"),
    CANCELLED("cancelled", "was cancelled");

    private final String label;
    private final String notificationPhrase;

    TaskStatus(String label, String notificationPhrase) {
        this.label = label;
        this.notificationPhrase = notificationPhrase;
    }

    public String label() {
        return label;
    }

    public String notificationPhrase() {
        return notificationPhrase;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public static Set<TaskStatus> terminalStatuses() {
        Set<TaskStatus> terminal = EnumSet.noneOf(TaskStatus.class);
        for (TaskStatus status : values()) {
            if (status.isTerminal()) {
                terminal.add(status);
            }
        }
        return terminal;
    }

    /**
     * Resolves a status from its exact lowercase label; no trimming or case folding.
     */
    public static TaskStatus fromLabel(String value) {
        for (TaskStatus status : values()) {
            if (status.label.equals(value)) {
                return status;
            }
        }
        throw invalid(value);
    }

    private static ProblemException invalid(String value) {
        return new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_STATUS",
                "unknown task status: " + value);
    }
}
