package com.taskflow.backend.modules.access.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Ownership and department facts about the resource an action targets.
 * Fields that do not apply to an action stay {@code null}/{@code false}.
 */
public record AccessContext(
        UUID creatorId,
        UUID assigneeId,
        UUID departmentHeadId,
        boolean departmentMember,
        boolean proposedHeadAdmin,
        UUID targetUserId
) {

    private static final AccessContext NONE = new AccessContext(null, null, null, false, false, null);

    public static AccessContext none() {
        return NONE;
    }

    public static AccessContext forTask(UUID creatorId, UUID assigneeId, UUID departmentHeadId, boolean departmentMember) {
        return new AccessContext(creatorId, assigneeId, departmentHeadId, departmentMember, false, null);
    }

    public static AccessContext forDepartment(UUID departmentHeadId, boolean departmentMember) {
        return new AccessContext(null, null, departmentHeadId, departmentMember, false, null);
    }

    public static AccessContext forProposedHead(boolean proposedHeadAdmin) {
        return new AccessContext(null, null, null, false, proposedHeadAdmin, null);
    }

    public static AccessContext forTargetUser(UUID targetUserId) {
        return new AccessContext(null, null, null, false, false, Objects.requireNonNull(targetUserId, "targetUserId"));
    }
}
