package com.taskflow.backend.modules.statistics.application;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.taskflow.backend.modules.statistics.infrastructure.persistence.TaskStatusCount;
import com.taskflow.backend.modules.task.domain.TaskStatus;

/**
 * Per-status task counts with every status present, plus their sum.
 */
public record StatusCounts(Map<TaskStatus, Long> byStatus, long total) {

    public static StatusCounts of(List<TaskStatusCount> rows) {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        long total = 0;
        for (TaskStatusCount row : rows) {
            counts.merge(row.getStatus(), row.getTotal(), Long::sum);
            total += row.getTotal();
        }
        return new StatusCounts(Collections.unmodifiableMap(counts), total);
    }

    public long count(TaskStatus status) {
        return byStatus.getOrDefault(status, 0L);
    }
}
