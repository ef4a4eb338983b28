package com.taskflow.backend.modules.statistics.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Set;
import java.util.UUID;

import com.taskflow.backend.modules.access.application.AccessPolicy;
import com.taskflow.backend.modules.access.domain.AccessAction;
import com.taskflow.backend.modules.access.domain.AccessContext;
import com.taskflow.backend.modules.auth.application.PrincipalSessionRegistry;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;
import com.taskflow.backend.modules.statistics.infrastructure.persistence.TaskStatisticsRepository;
import com.taskflow.backend.modules.task.domain.TaskStatus;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class TaskStatisticsService {

    private static final Set<TaskStatus> TERMINAL = TaskStatus.terminalStatuses();

    private final TaskStatisticsRepository taskStatisticsRepository;
    private final AccessPolicy accessPolicy;
    private final PrincipalSessionRegistry sessionRegistry;
    private final Clock clock;

    public TaskStatisticsService(
            TaskStatisticsRepository taskStatisticsRepository,
            AccessPolicy accessPolicy,
            PrincipalSessionRegistry sessionRegistry,
            Clock clock
    ) {
        this.taskStatisticsRepository = taskStatisticsRepository;
        this.accessPolicy = accessPolicy;
        this.sessionRegistry = sessionRegistry;
        this.clock = clock;
    }

    /**
     * Counts for {@code userId}, or for the principal when it is null. Overdue and due-today
     * only consider open tasks assigned to the user; due-today means within the next 24 hours.
     */
    public UserTaskStatistics userStatistics(TaskPrincipal principal, UUID userId) {
        sessionRegistry.requireActive(principal);
        UUID target = userId != null ? userId : principal.userId();
        accessPolicy.require(principal, AccessAction.VIEW_USER_STATISTICS, AccessContext.forTargetUser(target));

        OffsetDateTime now = OffsetDateTime.now(clock);
        return new UserTaskStatistics(
                target,
                StatusCounts.of(taskStatisticsRepository.countAssignedByStatus(target)),
                StatusCounts.of(taskStatisticsRepository.countCreatedByStatus(target)),
                taskStatisticsRepository.countOverdue(target, now, TERMINAL),
                taskStatisticsRepository.countDueBetween(target, now, now.plusHours(24), TERMINAL)
        );
    }
}
