package com.taskflow.backend.modules.statistics.application;

import java.util.UUID;

public record UserTaskStatistics(
        UUID userId,
        StatusCounts assigned,
        StatusCounts created,
        long overdue,
        long dueToday
) {
}
