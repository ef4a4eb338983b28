package com.taskflow.backend.modules.task.domain.event;

import java.util.List;
import java.util.UUID;

public record TaskAssignedEvent(
        UUID taskId,
        String taskTitle,
        String creatorName,
        List<UUID> recipientIds
) {
}
