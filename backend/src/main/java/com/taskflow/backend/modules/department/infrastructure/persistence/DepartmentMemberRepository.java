package com.taskflow.backend.modules.department.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.taskflow.backend.modules.department.domain.DepartmentMember;
import com.taskflow.backend.modules.department.domain.DepartmentMemberId;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DepartmentMemberRepository extends JpaRepository<DepartmentMember, DepartmentMemberId> {

    @Query("""
            select case when count(dm) > 0 then true else false end
              from DepartmentMember dm
             where dm.id.departmentId = :departmentId
               and dm.id.userId = :userId
            """)
    boolean isMember(@Param("departmentId") UUID departmentId, @Param("userId") UUID userId);

    @Query("select dm.id.userId from DepartmentMember dm where dm.id.departmentId = :departmentId")
    List<UUID> findMemberIds(@Param("departmentId") UUID departmentId);
}
