package com.taskflow.backend.modules.task.application;

import java.util.UUID;

import com.taskflow.backend.global.error.PersistenceFailures;
import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.modules.access.application.AccessPolicy;
import com.taskflow.backend.modules.access.domain.AccessAction;
import com.taskflow.backend.modules.access.domain.AccessContext;
import com.taskflow.backend.modules.auth.application.PrincipalSessionRegistry;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;
import com.taskflow.backend.modules.auth.domain.TaskUser;
import com.taskflow.backend.modules.auth.infrastructure.persistence.TaskUserRepository;
import com.taskflow.backend.modules.department.domain.Department;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentMemberRepository;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentRepository;
import com.taskflow.backend.modules.task.domain.NotificationRecipients;
import com.taskflow.backend.modules.task.domain.Task;
import com.taskflow.backend.modules.task.domain.TaskComment;
import com.taskflow.backend.modules.task.domain.TaskPriority;
import com.taskflow.backend.modules.task.domain.TaskStatus;
import com.taskflow.backend.modules.task.domain.event.TaskAssignedEvent;
import com.taskflow.backend.modules.task.domain.event.TaskCommentedEvent;
import com.taskflow.backend.modules.task.domain.event.TaskStatusChangedEvent;
import com.taskflow.backend.modules.task.infrastructure.persistence.TaskCommentRepository;
import com.taskflow.backend.modules.task.infrastructure.persistence.TaskRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Mutating task operations. Each call is one unit of work: permission and validation
 * checks run before the task is touched, the change is flushed inside the unit so a lost
 * version race surfaces as a retryable conflict, and notification events are handed to
 * listeners that only run once the unit has committed.
 */
@Service
@Transactional
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final TaskCommentRepository taskCommentRepository;
    private final TaskUserRepository taskUserRepository;
    private final DepartmentRepository departmentRepository;
    private final DepartmentMemberRepository departmentMemberRepository;
    private final AccessPolicy accessPolicy;
    private final PrincipalSessionRegistry sessionRegistry;
    private final ApplicationEventPublisher eventPublisher;

    public TaskService(
            TaskRepository taskRepository,
            TaskCommentRepository taskCommentRepository,
            TaskUserRepository taskUserRepository,
            DepartmentRepository departmentRepository,
            DepartmentMemberRepository departmentMemberRepository,
            AccessPolicy accessPolicy,
            PrincipalSessionRegistry sessionRegistry,
            ApplicationEventPublisher eventPublisher
    ) {
        this.taskRepository = taskRepository;
        this.taskCommentRepository = taskCommentRepository;
        this.taskUserRepository = taskUserRepository;
        this.departmentRepository = departmentRepository;
        this.departmentMemberRepository = departmentMemberRepository;
        this.accessPolicy = accessPolicy;
        this.sessionRegistry = sessionRegistry;
        this.eventPublisher = eventPublisher;
    }

    public UUID createTask(TaskPrincipal principal, CreateTaskCommand command) {
        sessionRegistry.requireActive(principal);
        String title = normalizeTitle(command.title());
        TaskPriority priority = TaskPriority.fromLabel(command.priority());

        Department department = null;
        if (command.departmentId() != null) {
            department = departmentRepository.findById(command.departmentId())
                    .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DEPARTMENT_NOT_FOUND"));
            boolean member = departmentMemberRepository.isMember(department.getId(), principal.userId());
            accessPolicy.require(principal, AccessAction.CREATE_DEPARTMENT_TASK,
                    AccessContext.forDepartment(department.getHeadId(), member));
        } else {
            accessPolicy.require(principal, AccessAction.CREATE_TASK, AccessContext.none());
        }

        TaskUser assignee = null;
        if (command.assigneeId() != null) {
            assignee = requireUser(command.assigneeId());
            requireDepartmentMember(department, assignee);
        }

        Task task = new Task();
        task.setTitle(title);
        task.setDescription(command.description());
        task.setCreator(taskUserRepository.getReferenceById(principal.userId()));
        task.setAssignee(assignee);
        task.setDepartment(department);
        task.setDeadline(command.deadline());
        task.setPriority(priority);

        Task saved = persist(task);
        log.info("Task {} created by {} (department={}, assignee={})",
                saved.getId(), principal.userId(), saved.getDepartmentId(), saved.getAssigneeId());

        if (assignee != null) {
            eventPublisher.publishEvent(new TaskAssignedEvent(
                    saved.getId(), saved.getTitle(), principal.displayName(),
                    NotificationRecipients.assignment(assignee.getId())));
        }
        return saved.getId();
    }

    public void assignTask(TaskPrincipal principal, UUID taskId, UUID userId) {
        assignTask(principal, taskId, userId, null);
    }

    /**
     * Assigns the task and moves it to in-progress. When {@code expectedVersion} is given the
     * call fails with a conflict if the task changed since the caller read it.
     */
    public void assignTask(TaskPrincipal principal, UUID taskId, UUID userId, Long expectedVersion) {
        sessionRegistry.requireActive(principal);
        Task task = requireTask(taskId);
        accessPolicy.require(principal, AccessAction.ASSIGN_TASK, taskContext(principal, task));

        TaskUser assignee = requireUser(userId);
        requireDepartmentMember(task.getDepartment(), assignee);
        requireVersion(task, expectedVersion);

        task.assignTo(assignee);
        Task saved = persist(task);
        log.info("Task {} assigned to {} by {}", saved.getId(), assignee.getId(), principal.userId());

        eventPublisher.publishEvent(new TaskAssignedEvent(
                saved.getId(), saved.getTitle(), saved.getCreator().getDisplayName(),
                NotificationRecipients.assignment(assignee.getId())));
    }

    public void updateStatus(TaskPrincipal principal, UUID taskId, String newStatus) {
        updateStatus(principal, taskId, newStatus, null);
    }

    public void updateStatus(TaskPrincipal principal, UUID taskId, String newStatus, Long expectedVersion) {
        sessionRegistry.requireActive(principal);
        TaskStatus target = TaskStatus.fromLabel(newStatus);
        Task task = requireTask(taskId);
        accessPolicy.require(principal, AccessAction.CHANGE_TASK_STATUS, taskContext(principal, task));
        requireVersion(task, expectedVersion);

        TaskStatus previous = task.getStatus();
        task.changeStatus(target);
        Task saved = persist(task);
        log.info("Task {} status {} -> {} by {}", saved.getId(), previous.label(), target.label(), principal.userId());

        eventPublisher.publishEvent(new TaskStatusChangedEvent(
                saved.getId(), saved.getTitle(), target,
                NotificationRecipients.statusChange(saved.getCreatorId(), saved.getAssigneeId())));
    }

    public UUID addComment(TaskPrincipal principal, UUID taskId, String text) {
        sessionRegistry.requireActive(principal);
        if (!StringUtils.hasText(text)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "COMMENT_TEXT_REQUIRED");
        }
        Task task = taskRepository.findByIdForShare(taskId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND"));
        accessPolicy.require(principal, AccessAction.ADD_COMMENT, AccessContext.none());

        TaskComment comment = new TaskComment(task, taskUserRepository.getReferenceById(principal.userId()), text);
        TaskComment saved;
        try {
            saved = taskCommentRepository.saveAndFlush(comment);
        } catch (DataAccessException ex) {
            throw PersistenceFailures.translate(ex);
        }
        log.info("Comment {} added to task {} by {}", saved.getId(), task.getId(), principal.userId());

        eventPublisher.publishEvent(new TaskCommentedEvent(
                task.getId(), saved.getId(), task.getTitle(), principal.displayName(), text,
                NotificationRecipients.newComment(task.getCreatorId(), task.getAssigneeId(), principal.userId())));
        return saved.getId();
    }

    private Task requireTask(UUID taskId) {
        if (taskId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND");
        }
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "TASK_NOT_FOUND"));
    }

    private TaskUser requireUser(UUID userId) {
        if (userId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND");
        }
        return taskUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
    }

    private void requireDepartmentMember(Department department, TaskUser user) {
        if (department != null && !departmentMemberRepository.isMember(department.getId(), user.getId())) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "ASSIGNEE_NOT_DEPARTMENT_MEMBER",
                    "assignee is not a member of the task's department");
        }
    }

    private void requireVersion(Task task, Long expectedVersion) {
        if (expectedVersion != null && !expectedVersion.equals(task.getVersion())) {
            throw PersistenceFailures.conflict("task " + task.getId() + " is at version "
                    + task.getVersion() + ", expected " + expectedVersion);
        }
    }

    private AccessContext taskContext(TaskPrincipal principal, Task task) {
        Department department = task.getDepartment();
        if (department == null) {
            return AccessContext.forTask(task.getCreatorId(), task.getAssigneeId(), null, false);
        }
        boolean member = departmentMemberRepository.isMember(department.getId(), principal.userId());
        return AccessContext.forTask(task.getCreatorId(), task.getAssigneeId(), department.getHeadId(), member);
    }

    private String normalizeTitle(String rawTitle) {
        if (!StringUtils.hasText(rawTitle)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "TITLE_REQUIRED");
        }
        String trimmed = rawTitle.trim();
        if (trimmed.length() > Task.TITLE_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "TITLE_TOO_LONG",
                    "title must be at most " + Task.TITLE_MAX_LENGTH + " characters");
        }
        return trimmed;
    }

    private Task persist(Task task) {
        try {
            return taskRepository.saveAndFlush(task);
        } catch (DataAccessException ex) {
            throw PersistenceFailures.translate(ex);
        }
    }
}
