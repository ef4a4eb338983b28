package com.taskflow.backend.modules.task;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.UUID;

import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.global.error.RetryableProblemException;
import com.taskflow.backend.modules.access.application.AccessPolicy;
import com.taskflow.backend.modules.auth.application.PrincipalSessionRegistry;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;
import com.taskflow.backend.modules.auth.domain.TaskUser;
import com.taskflow.backend.modules.auth.infrastructure.persistence.TaskUserRepository;
import com.taskflow.backend.modules.department.domain.Department;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentMemberRepository;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentRepository;
import com.taskflow.backend.modules.task.application.CreateTaskCommand;
import com.taskflow.backend.modules.task.application.TaskService;
import com.taskflow.backend.modules.task.domain.Task;
import com.taskflow.backend.modules.task.domain.TaskComment;
import com.taskflow.backend.modules.task.domain.TaskStatus;
import com.taskflow.backend.modules.task.domain.event.TaskAssignedEvent;
import com.taskflow.backend.modules.task.domain.event.TaskCommentedEvent;
import com.taskflow.backend.modules.task.domain.event.TaskStatusChangedEvent;
import com.taskflow.backend.modules.task.infrastructure.persistence.TaskCommentRepository;
import com.taskflow.backend.modules.task.infrastructure.persistence.TaskRepository;
import com.taskflow.backend.support.TestFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TaskServiceTest {

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private TaskCommentRepository taskCommentRepository;

    @Mock
    private TaskUserRepository taskUserRepository;

    @Mock
    private DepartmentRepository departmentRepository;

    @Mock
    private DepartmentMemberRepository departmentMemberRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private PrincipalSessionRegistry sessionRegistry;
    private TaskService taskService;

    private TaskUser creator;
    private TaskUser assignee;
    private TaskUser outsider;

    @BeforeEach
    void setUp() {
        sessionRegistry = new PrincipalSessionRegistry();
        taskService = new TaskService(
                taskRepository,
                taskCommentRepository,
                taskUserRepository,
                departmentRepository,
                departmentMemberRepository,
                new AccessPolicy(),
                sessionRegistry,
                eventPublisher
        );
        creator = TestFixtures.user("carol", false);
        assignee = TestFixtures.user("dave", false);
        outsider = TestFixtures.user("erin", false);
    }

    @Test
    @DisplayName("a personal task starts as new and emits no notification")
    void createTask_personalTask() {
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        when(taskUserRepository.getReferenceById(creator.getId())).thenReturn(creator);
        stubTaskSave();

        UUID taskId = taskService.createTask(principal, CreateTaskCommand.personal("Write report", "quarterly"));

        ArgumentCaptor<Task> captor = ArgumentCaptor.forClass(Task.class);
        verify(taskRepository).saveAndFlush(captor.capture());
        Task saved = captor.getValue();
        assertThat(saved.getId()).isEqualTo(taskId);
        assertThat(saved.getStatus()).isEqualTo(TaskStatus.NEW);
        assertThat(saved.getPriority()).isEqualTo("normal");
        assertThat(saved.getAssignee()).isNull();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("an initial assignee keeps the task new and receives an assignment event")
    void createTask_withAssigneePublishesAssignment() {
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        when(taskUserRepository.findById(assignee.getId())).thenReturn(Optional.of(assignee));
        when(taskUserRepository.getReferenceById(creator.getId())).thenReturn(creator);
        stubTaskSave();

        taskService.createTask(principal, new CreateTaskCommand("Fix login", null, null, assignee.getId(), null, "high"));

        ArgumentCaptor<TaskAssignedEvent> event = ArgumentCaptor.forClass(TaskAssignedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().recipientIds()).containsExactly(assignee.getId());
        assertThat(event.getValue().creatorName()).isEqualTo("Carol");
        assertThat(event.getValue().taskTitle()).isEqualTo("Fix login");
    }

    @Test
    @DisplayName("a department head cannot hand a department task to a non-member")
    void createTask_assigneeOutsideDepartment() {
        TaskUser head = TestFixtures.user("hank", true);
        Department department = TestFixtures.department("Ops", head);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, head);
        when(departmentRepository.findById(department.getId())).thenReturn(Optional.of(department));
        when(departmentMemberRepository.isMember(department.getId(), head.getId())).thenReturn(false);
        when(taskUserRepository.findById(outsider.getId())).thenReturn(Optional.of(outsider));
        when(departmentMemberRepository.isMember(department.getId(), outsider.getId())).thenReturn(false);

        CreateTaskCommand command = new CreateTaskCommand("Rotate keys", null, department.getId(), outsider.getId(), null, null);

        assertThatThrownBy(() -> taskService.createTask(principal, command))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("ASSIGNEE_NOT_DEPARTMENT_MEMBER");
                });
        verify(taskRepository, never()).saveAndFlush(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("a plain member cannot create department tasks")
    void createTask_departmentTaskByMember() {
        TaskUser head = TestFixtures.user("hank", true);
        Department department = TestFixtures.department("Ops", head);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        when(departmentRepository.findById(department.getId())).thenReturn(Optional.of(department));
        when(departmentMemberRepository.isMember(department.getId(), creator.getId())).thenReturn(true);

        CreateTaskCommand command = new CreateTaskCommand("Rotate keys", null, department.getId(), null, null, null);

        assertThatThrownBy(() -> taskService.createTask(principal, command))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("CREATE_DEPARTMENT_TASK_FORBIDDEN"));
        verify(taskRepository, never()).saveAndFlush(any());
    }

    @Test
    void createTask_rejectsBlankTitleAndUnknownPriority() {
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);

        assertThatThrownBy(() -> taskService.createTask(principal, CreateTaskCommand.personal("  ", null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("TITLE_REQUIRED"));
        assertThatThrownBy(() -> taskService.createTask(principal,
                new CreateTaskCommand("Title", null, null, null, null, "urgent")))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("INVALID_PRIORITY"));
        verifyNoInteractions(taskRepository);
    }

    @Test
    @DisplayName("an ended session cannot create tasks")
    void createTask_requiresActiveSession() {
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        sessionRegistry.revoke(principal);

        assertThatThrownBy(() -> taskService.createTask(principal, CreateTaskCommand.personal("Title", null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(ex.getCode()).isEqualTo("UNAUTHENTICATED");
                });
    }

    @ParameterizedTest
    @EnumSource(TaskStatus.class)
    @DisplayName("assignment always moves the task into work")
    void assignTask_setsInProgressFromAnyStatus(TaskStatus initial) {
        Task task = TestFixtures.task("Deploy", creator, null, null, initial);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskUserRepository.findById(assignee.getId())).thenReturn(Optional.of(assignee));
        stubTaskSave();

        taskService.assignTask(principal, task.getId(), assignee.getId());

        assertThat(task.getStatus()).isEqualTo(TaskStatus.IN_PROGRESS);
        assertThat(task.getAssignee()).isSameAs(assignee);
        ArgumentCaptor<TaskAssignedEvent> event = ArgumentCaptor.forClass(TaskAssignedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().recipientIds()).containsExactly(assignee.getId());
    }

    @Test
    @DisplayName("the assignee may not reassign a task they did not create")
    void assignTask_deniedForAssignee() {
        Task task = TestFixtures.task("Deploy", creator, assignee, null);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, assignee);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> taskService.assignTask(principal, task.getId(), outsider.getId()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(ex.getCode()).isEqualTo("ASSIGN_TASK_FORBIDDEN");
                });
        assertThat(task.getAssignee()).isSameAs(assignee);
        verify(taskRepository, never()).saveAndFlush(any());
    }

    @Test
    void assignTask_unknownTaskOrUser() {
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        UUID missing = UUID.randomUUID();
        when(taskRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> taskService.assignTask(principal, missing, assignee.getId()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("TASK_NOT_FOUND"));

        Task task = TestFixtures.task("Deploy", creator, null, null);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskUserRepository.findById(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> taskService.assignTask(principal, task.getId(), missing))
                .isInstanceOfSatisfying(ProblemException.class, ex -> assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND"));
    }

    @Test
    @DisplayName("a stale expected version is rejected as a retryable conflict before mutation")
    void assignTask_staleExpectedVersion() {
        Task task = TestFixtures.task("Deploy", creator, null, null);
        ReflectionTestUtils.setField(task, "version", 3L);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskUserRepository.findById(assignee.getId())).thenReturn(Optional.of(assignee));

        assertThatThrownBy(() -> taskService.assignTask(principal, task.getId(), assignee.getId(), 2L))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("TASK_CONFLICT");
                    assertThat(ex.isRetryable()).isTrue();
                });
        assertThat(task.getStatus()).isEqualTo(TaskStatus.NEW);
        verify(taskRepository, never()).saveAndFlush(any());
    }

    @ParameterizedTest
    @ValueSource(strings = {"done", "COMPLETED", " new ", "In-Progress"})
    @DisplayName("a status label that is not an exact lowercase label leaves the task untouched")
    void updateStatus_invalidLabel(String label) {
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);

        assertThatThrownBy(() -> taskService.updateStatus(principal, UUID.randomUUID(), label))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("INVALID_STATUS");
                });
        verifyNoInteractions(taskRepository, eventPublisher);
    }

    @Test
    @DisplayName("the assignee completes a task and both parties are notified")
    void updateStatus_byAssignee() {
        Task task = TestFixtures.task("Deploy", creator, assignee, null, TaskStatus.IN_PROGRESS);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, assignee);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        stubTaskSave();

        taskService.updateStatus(principal, task.getId(), "completed");

        assertThat(task.getStatus()).isEqualTo(TaskStatus.COMPLETED);
        ArgumentCaptor<TaskStatusChangedEvent> event = ArgumentCaptor.forClass(TaskStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().recipientIds()).containsExactly(creator.getId(), assignee.getId());
        assertThat(event.getValue().status()).isEqualTo(TaskStatus.COMPLETED);
    }

    @Test
    @DisplayName("a self-assigned task yields a single status change recipient")
    void updateStatus_creatorIsAssignee() {
        Task task = TestFixtures.task("Deploy", creator, creator, null);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        stubTaskSave();

        taskService.updateStatus(principal, task.getId(), "cancelled");

        ArgumentCaptor<TaskStatusChangedEvent> event = ArgumentCaptor.forClass(TaskStatusChangedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().recipientIds()).containsExactly(creator.getId());
    }

    @Test
    @DisplayName("a lost optimistic lock race surfaces as a retryable conflict and publishes nothing")
    void updateStatus_optimisticLockFailure() {
        Task task = TestFixtures.task("Deploy", creator, assignee, null);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
        when(taskRepository.saveAndFlush(task))
                .thenThrow(new ObjectOptimisticLockingFailureException(Task.class, task.getId()));

        assertThatThrownBy(() -> taskService.updateStatus(principal, task.getId(), "in-progress"))
                .isInstanceOfSatisfying(RetryableProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TASK_CONFLICT"));
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("an unrelated user cannot change the status")
    void updateStatus_deniedForOutsider() {
        Task task = TestFixtures.task("Deploy", creator, assignee, null);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, outsider);
        when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> taskService.updateStatus(principal, task.getId(), "completed"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("CHANGE_TASK_STATUS_FORBIDDEN"));
        assertThat(task.getStatus()).isEqualTo(TaskStatus.NEW);
    }

    @Test
    @DisplayName("a comment by the assignee notifies only the creator")
    void addComment_excludesCommenter() {
        Task task = TestFixtures.task("Deploy", creator, assignee, null);
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, assignee);
        when(taskRepository.findByIdForShare(task.getId())).thenReturn(Optional.of(task));
        when(taskUserRepository.getReferenceById(assignee.getId())).thenReturn(assignee);
        when(taskCommentRepository.saveAndFlush(any(TaskComment.class))).thenAnswer(invocation -> {
            TaskComment comment = invocation.getArgument(0);
            ReflectionTestUtils.setField(comment, "id", UUID.randomUUID());
            return comment;
        });

        UUID commentId = taskService.addComment(principal, task.getId(), "Done on staging");

        ArgumentCaptor<TaskCommentedEvent> event = ArgumentCaptor.forClass(TaskCommentedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().commentId()).isEqualTo(commentId);
        assertThat(event.getValue().recipientIds()).containsExactly(creator.getId());
        assertThat(event.getValue().authorName()).isEqualTo("Dave");
    }

    @Test
    void addComment_blankTextOrMissingTask() {
        TaskPrincipal principal = TestFixtures.login(sessionRegistry, creator);
        UUID missing = UUID.randomUUID();

        assertThatThrownBy(() -> taskService.addComment(principal, missing, " "))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("COMMENT_TEXT_REQUIRED"));

        when(taskRepository.findByIdForShare(missing)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> taskService.addComment(principal, missing, "hello"))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("TASK_NOT_FOUND"));
        verifyNoInteractions(taskCommentRepository, eventPublisher);
    }

    private void stubTaskSave() {
        when(taskRepository.saveAndFlush(any(Task.class))).thenAnswer(invocation -> {
            Task task = invocation.getArgument(0);
            if (task.getId() == null) {
                ReflectionTestUtils.setField(task, "id", UUID.randomUUID());
            }
            return task;
        });
    }
}
