package com.taskflow.backend.modules.department.domain;

import java.io.Serializable;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

@Embeddable
public class DepartmentMemberId implements Serializable {

    @Column(name = "department_id", nullable = false, columnDefinition = "uuid")
    private UUID departmentId;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    protected DepartmentMemberId() {
    }

    public DepartmentMemberId(UUID departmentId, UUID userId) {
        this.departmentId = departmentId;
        this.userId = userId;
    }

    public UUID getDepartmentId() {
        return departmentId;
    }

    public UUID getUserId() {
        return userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DepartmentMemberId that)) return false;
        return Objects.equals(departmentId, that.departmentId) && Objects.equals(userId, that.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(departmentId, userId);
    }
}
