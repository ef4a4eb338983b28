package com.taskflow.backend.modules.notification.application;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskflow.backend.modules.notification.domain.Notification;

public record NotificationView(
        UUID id,
        String message,
        String category,
        UUID relatedId,
        OffsetDateTime createdAt,
        boolean read,
        OffsetDateTime readAt
) {

    public static NotificationView from(Notification notification) {
        return new NotificationView(
                notification.getId(),
                notification.getMessage(),
                notification.getCategory().label(),
                notification.getRelatedId(),
                notification.getCreatedAt(),
                notification.isRead(),
                notification.getReadAt()
        );
    }
}
