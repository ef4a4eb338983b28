package com.taskflow.backend.modules.statistics.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.taskflow.backend.modules.task.domain.Task;
import com.taskflow.backend.modules.task.domain.TaskStatus;

import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.Repository;
import org.springframework.data.repository.query.Param;

/**
 * Read-only aggregates over the task table.
 */
public interface TaskStatisticsRepository extends Repository<Task, UUID> {

    @Query("""
            select t.status as status, count(t) as total
              from Task t
             where t.assignee.id = :userId
             group by t.status
            """)
    List<TaskStatusCount> countAssignedByStatus(@Param("userId") UUID userId);

    @Query("""
            select t.status as status, count(t) as total
              from Task t
             where t.creator.id = :userId
             group by t.status
            """)
    List<TaskStatusCount> countCreatedByStatus(@Param("userId") UUID userId);

    @Query("""
            select count(t)
              from Task t
             where t.assignee.id = :userId
               and t.deadline < :now
               and t.status not in :excluded
            """)
    long countOverdue(
            @Param("userId") UUID userId,
            @Param("now") OffsetDateTime now,
            @Param("excluded") Collection<TaskStatus> excluded
    );

    @Query("""
            select count(t)
              from Task t
             where t.assignee.id = :userId
               and t.deadline between :from and :to
               and t.status not in :excluded
            """)
    long countDueBetween(
            @Param("userId") UUID userId,
            @Param("from") OffsetDateTime from,
            @Param("to") OffsetDateTime to,
            @Param("excluded") Collection<TaskStatus> excluded
    );
}
