package com.taskflow.backend.modules.task.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.global.jpa.AbstractTimestampedEntity;
import com.taskflow.backend.modules.auth.domain.TaskUser;
import com.taskflow.backend.modules.department.domain.Department;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.UuidGenerator;
import org.springframework.http.HttpStatus;

@Entity
@Table(name = "task")
public class Task extends AbstractTimestampedEntity {

    public static final int TITLE_MAX_LENGTH = 200;

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "title", nullable = false, length = TITLE_MAX_LENGTH)
    private String title;

    @Column(name = "description", columnDefinition = "text")
    private String description;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "creator_id", nullable = false, updatable = false)
    private TaskUser creator;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "assignee_id")
    private TaskUser assignee;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "department_id")
    private Department department;

    @Column(name = "deadline")
    private OffsetDateTime deadline;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status = TaskStatus.NEW;

    @Column(name = "priority", nullable = false, length = 20)
    private String priority = TaskPriority.NORMAL.label();

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    /**
     * Hands the task to {@code user} and moves it into work, whatever the previous status was.
     */
    public void assignTo(TaskUser user) {
        this.assignee = user;
        this.status = TaskStatus.IN_PROGRESS;
    }

    public void changeStatus(TaskStatus target) {
        if (!TaskTransitionPolicy.isAllowed(status, target)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "INVALID_TRANSITION",
                    status.label() + " -> " + (target == null ? null : target.label()));
        }
        this.status = target;
    }

    public UUID getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public TaskUser getCreator() {
        return creator;
    }

    public void setCreator(TaskUser creator) {
        this.creator = creator;
    }

    public UUID getCreatorId() {
        return creator != null ? creator.getId() : null;
    }

    public TaskUser getAssignee() {
        return assignee;
    }

    /**
     * Sets the initial assignee at creation; the status stays untouched.
     */
    public void setAssignee(TaskUser assignee) {
        this.assignee = assignee;
    }

    public UUID getAssigneeId() {
        return assignee != null ? assignee.getId() : null;
    }

    public Department getDepartment() {
        return department;
    }

    public void setDepartment(Department department) {
        this.department = department;
    }

    public UUID getDepartmentId() {
        return department != null ? department.getId() : null;
    }

    public OffsetDateTime getDeadline() {
        return deadline;
    }

    public void setDeadline(OffsetDateTime deadline) {
        this.deadline = deadline;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public String getPriority() {
        return priority;
    }

    public void setPriority(TaskPriority priority) {
        this.priority = priority.label();
    }

    public Long getVersion() {
        return version;
    }
}
