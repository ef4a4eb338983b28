package com.taskflow.backend.modules.statistics.infrastructure.persistence;

import com.taskflow.backend.modules.task.domain.TaskStatus;

public interface TaskStatusCount {

    TaskStatus getStatus();

    long getTotal();
}
