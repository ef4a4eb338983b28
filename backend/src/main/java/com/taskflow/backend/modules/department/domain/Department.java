package com.taskflow.backend.modules.department.domain;

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
@Table(name = "department")
public class Department extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "head_id", nullable = false)
    private TaskUser head;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public TaskUser getHead() {
        return head;
    }

    public void setHead(TaskUser head) {
        this.head = head;
    }

    public UUID getHeadId() {
        return head != null ? head.getId() : null;
    }
}
