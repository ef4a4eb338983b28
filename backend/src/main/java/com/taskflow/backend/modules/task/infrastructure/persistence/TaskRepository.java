package com.taskflow.backend.modules.task.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.taskflow.backend.modules.task.domain.Task;
import com.taskflow.backend.modules.task.domain.TaskStatus;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, UUID> {

    /**
     * Shared row lock so the task cannot be deleted or rewritten while a comment is attached.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select t from Task t where t.id = :taskId")
    Optional<Task> findByIdForShare(@Param("taskId") UUID taskId);

    @EntityGraph(attributePaths = {"creator", "assignee", "department"})
    @Query("""
            select t
              from Task t
              left join t.assignee a
             where (t.creator.id = :userId or a.id = :userId)
               and (:status is null or t.status = :status)
             order by t.createdAt desc, t.id
            """)
    List<Task> findInvolvingUser(
            @Param("userId") UUID userId,
            @Param("status") TaskStatus status,
            Pageable pageable
    );

    @EntityGraph(attributePaths = {"creator", "assignee", "department"})
    @Query("""
            select t
              from Task t
             where t.department.id = :departmentId
               and (:status is null or t.status = :status)
             order by t.createdAt desc, t.id
            """)
    List<Task> findInDepartment(
            @Param("departmentId") UUID departmentId,
            @Param("status") TaskStatus status,
            Pageable pageable
    );
}
