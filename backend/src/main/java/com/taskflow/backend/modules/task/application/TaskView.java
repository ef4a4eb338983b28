package com.taskflow.backend.modules.task.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskflow.backend.modules.task.domain.Task;

public record TaskView(
        UUID id,
        String title,
        String description,
        UUID creatorId,
        String creatorName,
        UUID assigneeId,
        String assigneeName,
        UUID departmentId,
        String departmentName,
        OffsetDateTime createdAt,
        OffsetDateTime deadline,
        String status,
        String priority,
        long version
) {

    public static TaskView from(Task task) {
        return new TaskView(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getCreatorId(),
                task.getCreator().getDisplayName(),
                task.getAssigneeId(),
                task.getAssignee() != null ? task.getAssignee().getDisplayName() : null,
                task.getDepartmentId(),
                task.getDepartment() != null ? task.getDepartment().getName() : null,
                task.getCreatedAt(),
                task.getDeadline(),
                task.getStatus().label(),
                task.getPriority(),
                task.getVersion() != null ? task.getVersion() : 0L
        );
    }
}
