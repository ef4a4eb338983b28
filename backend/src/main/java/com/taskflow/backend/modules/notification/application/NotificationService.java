package com.taskflow.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.taskflow.backend.global.error.ProblemException;
import com.taskflow.backend.modules.auth.application.PrincipalSessionRegistry;
import com.taskflow.backend.modules.auth.domain.TaskPrincipal;
import com.taskflow.backend.modules.auth.domain.TaskUser;
import com.taskflow.backend.modules.auth.infrastructure.persistence.TaskUserRepository;
import com.taskflow.backend.modules.notification.domain.Notification;
import com.taskflow.backend.modules.notification.domain.NotificationCategory;
import com.taskflow.backend.modules.notification.infrastructure.persistence.NotificationRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@Transactional
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final NotificationRepository notificationRepository;
    private final TaskUserRepository taskUserRepository;
    private final PrincipalSessionRegistry sessionRegistry;
    private final TransactionTemplate notifyTransaction;
    private final Clock clock;

    public NotificationService(
            NotificationRepository notificationRepository,
            TaskUserRepository taskUserRepository,
            PrincipalSessionRegistry sessionRegistry,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.notificationRepository = notificationRepository;
        this.taskUserRepository = taskUserRepository;
        this.sessionRegistry = sessionRegistry;
        this.notifyTransaction = new TransactionTemplate(transactionManager);
        this.notifyTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Stores an unread notification in its own transaction. A failure is logged and reported
     * as an empty result, so it never reaches the operation that triggered the notification.
     */
    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public Optional<UUID> notify(UUID recipientId, String message, NotificationCategory category, UUID relatedId) {
        try {
            UUID id = notifyTransaction.execute(status -> {
                Optional<TaskUser> recipient = taskUserRepository.findById(recipientId);
                if (recipient.isEmpty()) {
                    log.warn("Skipping {} notification for unknown user {}", category, recipientId);
                    return null;
                }
                Notification saved = notificationRepository.save(
                        new Notification(recipient.get(), message, category, relatedId));
                return saved.getId();
            });
            return Optional.ofNullable(id);
        } catch (RuntimeException ex) {
            log.warn("Failed to store {} notification for user {}: {}", category, recipientId, ex.getMessage());
            return Optional.empty();
        }
    }

    @Transactional(readOnly = true)
    public List<NotificationView> listNotifications(UUID userId, Integer limit, boolean onlyUnread) {
        PageRequest page = PageRequest.of(0, clampLimit(limit));
        List<Notification> notifications = onlyUnread
                ? notificationRepository.findByRecipientIdAndReadFalseOrderByCreatedAtDesc(userId, page)
                : notificationRepository.findByRecipientIdOrderByCreatedAtDesc(userId, page);
        return notifications.stream()
                .map(NotificationView::from)
                .toList();
    }

    /**
     * @return false when the notification does not exist; marking an already read one is a no-op
     */
    public boolean markRead(UUID notificationId) {
        Optional<Notification> notification = notificationRepository.findById(notificationId);
        if (notification.isEmpty()) {
            return false;
        }
        notification.get().markRead(OffsetDateTime.now(clock));
        return true;
    }

    public boolean markAllRead(UUID userId) {
        int updated = notificationRepository.markAllRead(userId, OffsetDateTime.now(clock));
        log.debug("Marked {} notifications read for user {}", updated, userId);
        return true;
    }

    @Transactional(readOnly = true)
    public long countUnread(UUID userId) {
        return notificationRepository.countByRecipientIdAndReadFalse(userId);
    }

    @Transactional(readOnly = true)
    public List<NotificationView> listMyNotifications(TaskPrincipal principal, Integer limit, boolean onlyUnread) {
        sessionRegistry.requireActive(principal);
        return listNotifications(principal.userId(), limit, onlyUnread);
    }

    public void markMyNotificationRead(TaskPrincipal principal, UUID notificationId) {
        sessionRegistry.requireActive(principal);
        Notification notification = notificationRepository.findByIdAndRecipientId(notificationId, principal.userId())
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "NOTIFICATION_NOT_FOUND"));
        notification.markRead(OffsetDateTime.now(clock));
    }

    public void markAllMyNotificationsRead(TaskPrincipal principal) {
        sessionRegistry.requireActive(principal);
        markAllRead(principal.userId());
    }

    @Transactional(readOnly = true)
    public long countMyUnread(TaskPrincipal principal) {
        sessionRegistry.requireActive(principal);
        return countUnread(principal.userId());
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.min(Math.max(limit, 1), MAX_LIMIT);
    }
}
