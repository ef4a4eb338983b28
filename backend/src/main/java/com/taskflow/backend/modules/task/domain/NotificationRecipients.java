package com.taskflow.backend.modules.task.domain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Who hears about a task event. Each set is deduplicated and keeps first-seen order.
 */
public final class NotificationRecipients {

    private NotificationRecipients() {
    }

    public static List<UUID> assignment(UUID assigneeId) {
        return collect(null, assigneeId);
    }

    /**
     * Creator and assignee. The principal who changed the status is not excluded.
     */
    public static List<UUID> statusChange(UUID creatorId, UUID assigneeId) {
        return collect(null, creatorId, assigneeId);
    }

    public static List<UUID> newComment(UUID creatorId, UUID assigneeId, UUID commenterId) {
        return collect(commenterId, creatorId, assigneeId);
    }

    private static List<UUID> collect(UUID excluded, UUID... candidates) {
        Set<UUID> recipients = new LinkedHashSet<>();
        for (UUID candidate : candidates) {
            if (candidate != null && !Objects.equals(candidate, excluded)) {
                recipients.add(candidate);
            }
        }
        return List.copyOf(recipients);
    }
}
