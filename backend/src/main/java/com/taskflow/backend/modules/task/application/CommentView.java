package com.taskflow.backend.modules.task.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskflow.backend.modules.task.domain.TaskComment;

public record CommentView(
        UUID id,
        UUID taskId,
        UUID authorId,
        String authorName,
        String text,
        OffsetDateTime createdAt
) {

    public static CommentView from(TaskComment comment) {
        return new CommentView(
                comment.getId(),
                comment.getTask().getId(),
                comment.getAuthor().getId(),
                comment.getAuthor().getDisplayName(),
                comment.getBody(),
                comment.getCreatedAt()
        );
    }
}
