package com.taskflow.backend.modules.access.domain;

public enum AccessAction {
    CREATE_DEPARTMENT,
    ADD_DEPARTMENT_MEMBER,
    REMOVE_DEPARTMENT_MEMBER,
    CREATE_TASK,
    CREATE_DEPARTMENT_TASK,
    ASSIGN_TASK,
    CHANGE_TASK_STATUS,
    ADD_COMMENT,
    VIEW_TASK_COMMENTS,
    VIEW_USER_TASKS,
    VIEW_USER_STATISTICS,
    VIEW_DEPARTMENT_TASKS;

    public String forbiddenCode() {
        return name() + "_FORBIDDEN";
    }
}
