package com.taskflow.backend.modules.auth.domain;

import java.util.UUID;

/**
 * Authenticated identity passed explicitly into every engine operation.
 * {@code sessionId} ties the principal to an entry in the session registry.
 */
public record TaskPrincipal(
        UUID sessionId,
        UUID userId,
        String username,
        String displayName,
        boolean admin,
        String email,
        boolean emailNotificationsEnabled,
        boolean inAppNotificationsEnabled
) {

    public static TaskPrincipal of(UUID sessionId, TaskUser user) {
        return new TaskPrincipal(
                sessionId,
                user.getId(),
                user.getUsername(),
                user.getDisplayName(),
                user.isAdmin(),
                user.getEmail(),
                user.isEmailNotificationsEnabled(),
                user.isInAppNotificationsEnabled()
        );
    }

    public boolean isSelf(UUID otherUserId) {
        return userId.equals(otherUserId);
    }
}
