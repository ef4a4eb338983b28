package com.taskflow.backend.modules.task.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.taskflow.backend.modules.task.domain.TaskComment;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TaskCommentRepository extends JpaRepository<TaskComment, UUID> {

    @EntityGraph(attributePaths = "author")
    List<TaskComment> findByTaskIdOrderByCreatedAtAscIdAsc(UUID taskId);
}
