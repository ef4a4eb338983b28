package com.taskflow.backend.modules.notification.domain;

public enum NotificationCategory {
    TASK_ASSIGNMENT("task-assignment"),
    STATUS_CHANGE("status-change"),
    NEW_COMMENT("new-comment");

    private final String label;

    NotificationCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
