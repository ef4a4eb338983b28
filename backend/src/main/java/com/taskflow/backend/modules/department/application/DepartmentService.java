package com.taskflow.backend.modules.department.application;

import java.util.List;
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
import com.taskflow.backend.modules.department.domain.DepartmentMember;
import com.taskflow.backend.modules.department.domain.DepartmentMemberId;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentMemberRepository;
import com.taskflow.backend.modules.department.infrastructure.persistence.DepartmentRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

/**
 * Administrative entry points for departments and their membership.
 */
@Service
@Transactional
public class DepartmentService {

    private static final Logger log = LoggerFactory.getLogger(DepartmentService.class);
    private static final int NAME_MAX_LENGTH = 100;

    private final DepartmentRepository departmentRepository;
    private final DepartmentMemberRepository departmentMemberRepository;
    private final TaskUserRepository taskUserRepository;
    private final AccessPolicy accessPolicy;
    private final PrincipalSessionRegistry sessionRegistry;

    public DepartmentService(
            DepartmentRepository departmentRepository,
            DepartmentMemberRepository departmentMemberRepository,
            TaskUserRepository taskUserRepository,
            AccessPolicy accessPolicy,
            PrincipalSessionRegistry sessionRegistry
    ) {
        this.departmentRepository = departmentRepository;
        this.departmentMemberRepository = departmentMemberRepository;
        this.taskUserRepository = taskUserRepository;
        this.accessPolicy = accessPolicy;
        this.sessionRegistry = sessionRegistry;
    }

    public UUID createDepartment(TaskPrincipal principal, String name, UUID headId) {
        sessionRegistry.requireActive(principal);
        // non-admins are rejected before the head is looked up
        TaskUser head = principal.admin() ? requireUser(headId) : null;
        accessPolicy.require(principal, AccessAction.CREATE_DEPARTMENT,
                AccessContext.forProposedHead(head != null && head.isAdmin()));

        if (!StringUtils.hasText(name)) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "DEPARTMENT_NAME_REQUIRED");
        }
        String trimmed = name.trim();
        if (trimmed.length() > NAME_MAX_LENGTH) {
            throw new ProblemException(HttpStatus.UNPROCESSABLE_ENTITY, "DEPARTMENT_NAME_TOO_LONG");
        }

        Department department = new Department();
        department.setName(trimmed);
        department.setHead(head);
        try {
            Department saved = departmentRepository.saveAndFlush(department);
            log.info("Department {} created with head {}", saved.getId(), head.getId());
            return saved.getId();
        } catch (DataAccessException ex) {
            throw PersistenceFailures.translate(ex);
        }
    }

    public void addMember(TaskPrincipal principal, UUID departmentId, UUID userId) {
        sessionRegistry.requireActive(principal);
        accessPolicy.require(principal, AccessAction.ADD_DEPARTMENT_MEMBER, AccessContext.none());

        TaskUser user = requireUser(userId);
        Department department = requireDepartment(departmentId);
        if (departmentMemberRepository.isMember(departmentId, userId)) {
            throw new ProblemException(HttpStatus.CONFLICT, "ALREADY_DEPARTMENT_MEMBER");
        }
        try {
            departmentMemberRepository.saveAndFlush(new DepartmentMember(department, user));
        } catch (DataIntegrityViolationException ex) {
            // a concurrent add won the membership primary key
            throw new ProblemException(HttpStatus.CONFLICT, "ALREADY_DEPARTMENT_MEMBER");
        } catch (DataAccessException ex) {
            throw PersistenceFailures.translate(ex);
        }
        log.info("User {} joined department {}", userId, departmentId);
    }

    public boolean removeMember(TaskPrincipal principal, UUID departmentId, UUID userId) {
        sessionRegistry.requireActive(principal);
        accessPolicy.require(principal, AccessAction.REMOVE_DEPARTMENT_MEMBER, AccessContext.none());
        requireDepartment(departmentId);

        DepartmentMemberId id = new DepartmentMemberId(departmentId, userId);
        if (!departmentMemberRepository.existsById(id)) {
            return false;
        }
        departmentMemberRepository.deleteById(id);
        log.info("User {} left department {}", userId, departmentId);
        return true;
    }

    @Transactional(readOnly = true)
    public List<UUID> listMemberIds(TaskPrincipal principal, UUID departmentId) {
        sessionRegistry.requireActive(principal);
        Department department = requireDepartment(departmentId);
        boolean member = departmentMemberRepository.isMember(departmentId, principal.userId());
        accessPolicy.require(principal, AccessAction.VIEW_DEPARTMENT_TASKS,
                AccessContext.forDepartment(department.getHeadId(), member));
        return departmentMemberRepository.findMemberIds(departmentId);
    }

    private TaskUser requireUser(UUID userId) {
        if (userId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND");
        }
        return taskUserRepository.findById(userId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "USER_NOT_FOUND"));
    }

    private Department requireDepartment(UUID departmentId) {
        if (departmentId == null) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "DEPARTMENT_NOT_FOUND");
        }
        return departmentRepository.findById(departmentId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "DEPARTMENT_NOT_FOUND"));
    }
}
