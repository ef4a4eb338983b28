package com.taskflow.backend.modules.access.application;

import java.util.Objects;
import java.util.UUID;

import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.modules.access.domain.AccessAction;
import com.taskflow.backend.modules.access.domain.AccessContext;
import com.taskflow.backend.modules.access.domain.AccessDecision;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Role and relationship based authorization. {@link #evaluate} is a pure function of its
 * arguments; callers gather the ownership facts into an {@link AccessContext} beforehand.
 *
 * <p>Each action is an ordered list of grants, the first matching grant wins and an action
 * with no matching grant is denied.
 */
@Component
public class AccessPolicy {

    private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

    static final String REASON_ADMIN = "admin";
    static final String REASON_AUTHENTICATED = "authenticated";
    static final String REASON_CREATOR = "task creator";
    static final String REASON_ASSIGNEE = "task assignee";
    static final String REASON_DEPARTMENT_HEAD = "department head";
    static final String REASON_DEPARTMENT_MEMBER = "department member";
    static final String REASON_SELF = "own records";
    static final String REASON_HEAD_NOT_ADMIN = "head must be admin";

    public AccessDecision evaluate(TaskPrincipal principal, AccessAction action, AccessContext context) {
        Objects.requireNonNull(action, "action");
        if (principal == null) {
            return AccessDecision.deny("not authenticated");
        }
        AccessContext ctx = context != null ? context : AccessContext.none();
        return switch (action) {
            case CREATE_DEPARTMENT -> evaluateCreateDepartment(principal, ctx);
            case ADD_DEPARTMENT_MEMBER, REMOVE_DEPARTMENT_MEMBER -> adminOnly(principal);
            case CREATE_TASK, ADD_COMMENT -> AccessDecision.allow(REASON_AUTHENTICATED);
            case CREATE_DEPARTMENT_TASK -> firstMatch(principal, ctx, false, false, true, false);
            case ASSIGN_TASK -> firstMatch(principal, ctx, true, false, true, false);
            case CHANGE_TASK_STATUS -> firstMatch(principal, ctx, true, true, true, false);
            case VIEW_TASK_COMMENTS -> firstMatch(principal, ctx, true, true, true, true);
            case VIEW_DEPARTMENT_TASKS -> firstMatch(principal, ctx, false, false, true, true);
            case VIEW_USER_TASKS, VIEW_USER_STATISTICS -> evaluateSelfOrAdmin(principal, ctx);
        };
    }

    public void require(TaskPrincipal principal, AccessAction action, AccessContext context) {
        AccessDecision decision = evaluate(principal, action, context);
        if (!decision.allowed()) {
            log.debug("Denied {} for user {}: {}", action, principal != null ? principal.userId() : null, decision.reason());
            throw new ProblemException(HttpStatus.FORBIDDEN, action.forbiddenCode(), decision.reason());
        }
    }

    private AccessDecision evaluateCreateDepartment(TaskPrincipal principal, AccessContext ctx) {
        if (!principal.admin()) {
            return AccessDecision.deny("admin role required");
        }
        if (!ctx.proposedHeadAdmin()) {
            return AccessDecision.deny(REASON_HEAD_NOT_ADMIN);
        }
        return AccessDecision.allow(REASON_ADMIN);
    }

    private AccessDecision adminOnly(TaskPrincipal principal) {
        return principal.admin()
                ? AccessDecision.allow(REASON_ADMIN)
                : AccessDecision.deny("admin role required");
    }

    private AccessDecision evaluateSelfOrAdmin(TaskPrincipal principal, AccessContext ctx) {
        if (ctx.targetUserId() == null || principal.isSelf(ctx.targetUserId())) {
            return AccessDecision.allow(REASON_SELF);
        }
        if (principal.admin()) {
            return AccessDecision.allow(REASON_ADMIN);
        }
        return AccessDecision.deny("only admins may view another user's records");
    }

    private AccessDecision firstMatch(
            TaskPrincipal principal,
            AccessContext ctx,
            boolean creatorGrants,
            boolean assigneeGrants,
            boolean headGrants,
            boolean memberGrants
    ) {
        UUID userId = principal.userId();
        if (principal.admin()) {
            return AccessDecision.allow(REASON_ADMIN);
        }
        if (creatorGrants && userId.equals(ctx.creatorId())) {
            return AccessDecision.allow(REASON_CREATOR);
        }
        if (assigneeGrants && userId.equals(ctx.assigneeId())) {
            return AccessDecision.allow(REASON_ASSIGNEE);
        }
        if (headGrants && userId.equals(ctx.departmentHeadId())) {
            return AccessDecision.allow(REASON_DEPARTMENT_HEAD);
        }
        if (memberGrants && ctx.departmentMember()) {
            return AccessDecision.allow(REASON_DEPARTMENT_MEMBER);
        }
        return AccessDecision.deny("no admin role or relationship to the resource");
    }
}
