package com.taskflow.backend.modules.task.application;

import java.time.OffsetDateTime;
import java.util.UUID;

public record CreateTaskCommand(
        String title,
        String description,
        UUID departmentId,
        UUID assigneeId,
        OffsetDateTime deadline,
        String priority
) {

    public static CreateTaskCommand personal(String title, String description) {
        return new CreateTaskCommand(title, description, null, null, null, null);
    }
}
