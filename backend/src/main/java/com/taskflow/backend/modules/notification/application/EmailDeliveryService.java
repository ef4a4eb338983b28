package com.taskflow.backend.modules.notification.application;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import com.taskflow.backend.global.config.AsyncConfig;
import com.taskflow.backend.modules.auth.domain.TaskUser;
import com.taskflow.backend.modules.auth.infrastructure.persistence.TaskUserRepository;
import com.taskflow.backend.modules.notification.domain.DeliveryResult;
import com.taskflow.backend.modules.notification.infrastructure.mail.MailTransport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
public class EmailDeliveryService {

    private static final Logger log = LoggerFactory.getLogger(EmailDeliveryService.class);

    private final MailTransport mailTransport;
    private final TaskUserRepository taskUserRepository;

    public EmailDeliveryService(MailTransport mailTransport, TaskUserRepository taskUserRepository) {
        this.mailTransport = mailTransport;
        this.taskUserRepository = taskUserRepository;
    }

    /**
     * Best-effort delivery. Never throws; every outcome is reported as a {@link DeliveryResult}.
     */
    public DeliveryResult deliverEmail(UUID recipientId, String subject, String htmlBody) {
        try {
            if (!mailTransport.isEnabled()) {
                return DeliveryResult.SKIPPED_TRANSPORT_DISABLED;
            }
            Optional<TaskUser> recipient = taskUserRepository.findById(recipientId);
            if (recipient.isEmpty() || !StringUtils.hasText(recipient.get().getEmail())) {
                return DeliveryResult.SKIPPED_NO_ADDRESS;
            }
            if (!recipient.get().isEmailNotificationsEnabled()) {
                return DeliveryResult.SKIPPED_DISABLED_BY_USER;
            }
            if (mailTransport.send(recipient.get().getEmail(), subject, htmlBody)) {
                return DeliveryResult.SENT;
            }
            log.warn("Mail transport rejected message '{}' for user {}", subject, recipientId);
            return DeliveryResult.FAILED;
        } catch (RuntimeException ex) {
            log.warn("Email delivery to user {} failed: {}", recipientId, ex.getMessage());
            return DeliveryResult.FAILED;
        }
    }

    @Async(AsyncConfig.MAIL_EXECUTOR)
    public CompletableFuture<DeliveryResult> deliverEmailAsync(UUID recipientId, String subject, String htmlBody) {
        return CompletableFuture.completedFuture(deliverEmail(recipientId, subject, htmlBody));
    }
}
