package com.taskflow.backend.modules.task.application;

import java.util.List;
import java.util.UUID;

import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.modules.access.application.AccessPolicy;
import com.taskflow.backend.modules.access.domain.AccessAction;
import com.taskflow.backend.modules.access.domain.AccessContext;
import com.taskflow.backend.modules.auth.application.PrincipalSessionRegistry;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;
import com.taskflow.backend.modules.department.domain.Department;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentMemberRepository;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentRepository;
import com.taskflow.backend.modules.task.domain.Task;
import com.taskflow.backend.modules.task.domain.TaskStatus;
import com.taskflow.backend.modules.task.infrastructure.persistence.TaskCommentRepository;
import com.taskflow.backend.modules.task.infrastructure.persistence.TaskRepository;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class TaskQueryService {

    static final int MAX_PAGE_SIZE = 100;

    private final TaskRepository taskRepository;
    private final TaskCommentRepository taskCommentRepository;
    private final DepartmentRepository departmentRepository;
    private final DepartmentMemberRepository departmentMemberRepository;
    private final AccessPolicy accessPolicy;
    private final PrincipalSessionRegistry sessionRegistry;

    public TaskQueryService(
            TaskRepository taskRepository,
            TaskCommentRepository taskCommentRepository,
            DepartmentRepository departmentRepository,
            DepartmentMemberRepository departmentMemberRepository,
            AccessPolicy accessPolicy,
            PrincipalSessionRegistry sessionRegistry
    ) {
        this.taskRepository = taskRepository;
        this.taskCommentRepository = taskCommentRepository;
        this.departmentRepository = departmentRepository;
        this.departmentMemberRepository = departmentMemberRepository;
        this.accessPolicy = accessPolicy;
        this.sessionRegistry = sessionRegistry;
    }

    /**
     * Tasks the user created or is assigned to, newest first. {@code userId} defaults to the principal.
     */
    public List<TaskView> listTasksFor(TaskPrincipal principal, UUID userId, String statusFilter, int page, int pageSize) {
        sessionRegistry.requireActive(principal);
        UUID target = userId != null ? userId : principal.userId();
        accessPolicy.require(principal, AccessAction.VIEW_USER_TASKS, AccessContext.forTargetUser(target));
        TaskStatus status = parseFilter(statusFilter);

        return taskRepository.findInvolvingUser(target, status, pageRequest(page, pageSize)).stream()
                .map(TaskView::from)
                .toList();
    }

    public List<TaskView> listDepartmentTasks(TaskPrincipal principal, UUID departmentId, String statusFilter, int page, int pageSize) {
        sessionRegistry.requireActive(principal);
        if (departmentId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "DEPARTMENT_NOT_FOUND");
        }
        Department department = departmentRepository.findById(departmentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DEPARTMENT_NOT_FOUND"));
        boolean member = departmentMemberRepository.isMember(departmentId, principal.userId());
        accessPolicy.require(principal, AccessAction.VIEW_DEPARTMENT_TASKS,
                AccessContext.forDepartment(department.getHeadId(), member));
        TaskStatus status = parseFilter(statusFilter);

        return taskRepository.findInDepartment(departmentId, status, pageRequest(page, pageSize)).stream()
                .map(TaskView::from)
                .toList();
    }

    public List<CommentView> listComments(TaskPrincipal principal, UUID taskId) {
        sessionRegistry.requireActive(principal);
        if (taskId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND");
        }
        Task task = taskRepository.findById(taskId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND"));

        Department department = task.getDepartment();
        AccessContext context = department == null
                ? AccessContext.forTask(task.getCreatorId(), task.getAssigneeId(), null, false)
                : AccessContext.forTask(task.getCreatorId(), task.getAssigneeId(), department.getHeadId(),
                        departmentMemberRepository.isMember(department.getId(), principal.userId()));
        accessPolicy.require(principal, AccessAction.VIEW_TASK_COMMENTS, context);

        return taskCommentRepository.findByTaskIdOrderByCreatedAtAscIdAsc(taskId).stream()
                .map(CommentView::from)
                .toList();
    }

    private TaskStatus parseFilter(String statusFilter) {
        return statusFilter == null || statusFilter.isBlank() ? null : TaskStatus.fromLabel(statusFilter);
    }

    static Pageable pageRequest(int page, int pageSize) {
        int safePage = Math.max(page, 1);
        int safeSize = Math.min(Math.max(pageSize, 1), MAX_PAGE_SIZE);
        return PageRequest.of(safePage - 1, safeSize);
    }
}
