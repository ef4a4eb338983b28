package com.taskflow.backend.modules.task.domain;

/**
 * Single gate for status changes. Every transition between the four statuses is
 * currently permitted, including leaving a terminal status and re-entering the same one.
 */
public final class TaskTransitionPolicy {

    private TaskTransitionPolicy() {
    }

    public static boolean isAllowed(TaskStatus from, TaskStatus to) {
        return to != null;
    }
}
