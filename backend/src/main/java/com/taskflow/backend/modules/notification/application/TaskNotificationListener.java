package com.taskflow.backend.modules.notification.application;

import java.util.List;
import java.util.UUID;

import com.taskflow.backend.modules.notification.domain.NotificationCategory;
import com.taskflow.backend.modules.task.domain.event.TaskAssignedEvent;
import com.taskflow.backend.modules.task.domain.event.TaskCommentedEvent;
import com.taskflow.backend.modules.task.domain.event.TaskStatusChangedEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Turns committed task changes into in-app notifications and queued emails.
 * Runs after the task transaction commits; nothing here can fail the task operation.
 */
@Component
public class TaskNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(TaskNotificationListener.class);

    private final NotificationService notificationService;
    private final EmailDeliveryService emailDeliveryService;

    public TaskNotificationListener(NotificationService notificationService, EmailDeliveryService emailDeliveryService) {
        this.notificationService = notificationService;
        this.emailDeliveryService = emailDeliveryService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTaskAssigned(TaskAssignedEvent event) {
        dispatch(event.recipientIds(), event.taskId(), NotificationCategory.TASK_ASSIGNMENT,
                NotificationContent.assignment(event.taskTitle(), event.creatorName()));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTaskStatusChanged(TaskStatusChangedEvent event) {
        dispatch(event.recipientIds(), event.taskId(), NotificationCategory.STATUS_CHANGE,
                NotificationContent.statusChange(event.taskTitle(), event.status()));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTaskCommented(TaskCommentedEvent event) {
        dispatch(event.recipientIds(), event.taskId(), NotificationCategory.NEW_COMMENT,
                NotificationContent.newComment(event.taskTitle(), event.authorName(), event.commentText()));
    }

    private void dispatch(List<UUID> recipientIds, UUID taskId, NotificationCategory category, NotificationContent content) {
        for (UUID recipientId : recipientIds) {
            try {
                notificationService.notify(recipientId, content.message(), category, taskId);
                emailDeliveryService.deliverEmailAsync(recipientId, content.emailSubject(), content.emailBody());
            } catch (RuntimeException ex) {
                log.warn("Dispatch of {} for task {} to user {} failed: {}", category, taskId, recipientId, ex.getMessage());
            }
        }
    }
}
