package com.taskflow.backend.modules.task.domain.event;

import java.util.List;
import java.util.UUID;

import com.taskflow.backend.modules.task.domain.TaskStatus;

public record TaskStatusChangedEvent(
        UUID taskId,
        String taskTitle,
        TaskStatus status,
        List<UUID> recipientIds
) {
}
