package com.taskflow.backend.modules.task.domain.event;

import java.util.List;
import java.util.UUID;

public record TaskCommentedEvent(
        UUID taskId,
        UUID commentId,
        String taskTitle,
        String authorName,
        String commentText,
        List<UUID> recipientIds
) {
}
