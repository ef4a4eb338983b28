package com.taskflow.backend.modules.task.domain;

import java.util.UUID;

import com.taskflow.backend.global.jpa.AbstractTimestampedEntity;
import com.taskflow.backend.modules.auth.domain.TaskUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "task_comment")
public class TaskComment extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false, updatable = false)
    private Task task;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false, updatable = false)
    private TaskUser author;

    @Column(name = "body", nullable = false, updatable = false, columnDefinition = "text")
    private String body;

    protected TaskComment() {
    }

    public TaskComment(Task task, TaskUser author, String body) {
        this.task = task;
        this.author = author;
        this.body = body;
    }

    public UUID getId() {
        return id;
    }

    public Task getTask() {
        return task;
    }

    public TaskUser getAuthor() {
        return author;
    }

    public String getBody() {
        return body;
    }
}
