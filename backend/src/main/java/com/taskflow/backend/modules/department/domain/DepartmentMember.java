package com.taskflow.backend.modules.department.domain;

import com.taskflow.backend.global.jpa.AbstractTimestampedEntity;
import com.taskflow.backend.modules.auth.domain.TaskUser;

import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.MapsId;
import jakarta.persistence.Table;

@Entity
@Table(name = "department_member")
public class DepartmentMember extends AbstractTimestampedEntity {

    @EmbeddedId
    private DepartmentMemberId id;

    @MapsId("departmentId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "department_id", nullable = false)
    private Department department;

    @MapsId("userId")
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private TaskUser user;

    protected DepartmentMember() {
    }

    public DepartmentMember(Department department, TaskUser user) {
        this.id = new DepartmentMemberId(department.getId(), user.getId());
        this.department = department;
        this.user = user;
    }

    public DepartmentMemberId getId() {
        return id;
    }

    public Department getDepartment() {
        return department;
    }

    public TaskUser getUser() {
        return user;
    }
}
