package com.taskflow.backend.modules.department.infrastructure.persistence;

import java.util.UUID;

import com.taskflow.backend.modules.department.domain.Department;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DepartmentRepository extends JpaRepository<Department, UUID> {
}
