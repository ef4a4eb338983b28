package com.taskflow.backend.modules.notification.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.taskflow.backend.global.jpa.AbstractTimestampedEntity;
import com.taskflow.backend.modules.auth.domain.TaskUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * In-app notification. Only the read flag changes after creation.
 */
@Entity
@Table(name = "notification")
public class Notification extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "recipient_id", nullable = false, updatable = false)
    private TaskUser recipient;

    @Column(name = "message", nullable = false, updatable = false, columnDefinition = "text")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, updatable = false, length = 32)
    private NotificationCategory category;

    @Column(name = "related_id", updatable = false, columnDefinition = "uuid")
    private UUID relatedId;

    @Column(name = "is_read", nullable = false)
    private boolean read;

    @Column(name = "read_at")
    private OffsetDateTime readAt;

    protected Notification() {
    }

    public Notification(TaskUser recipient, String message, NotificationCategory category, UUID relatedId) {
        this.recipient = recipient;
        this.message = message;
        this.category = category;
        this.relatedId = relatedId;
    }

    public boolean markRead(OffsetDateTime now) {
        if (read) {
            return false;
        }
        this.read = true;
        this.readAt = now;
        return true;
    }

    public UUID getId() {
        return id;
    }

    public TaskUser getRecipient() {
        return recipient;
    }

    public UUID getRecipientId() {
        return recipient != null ? recipient.getId() : null;
    }

    public String getMessage() {
        return message;
    }

    public NotificationCategory getCategory() {
        return category;
    }

    public UUID getRelatedId() {
        return relatedId;
    }

    public boolean isRead() {
        return read;
    }

    public OffsetDateTime getReadAt() {
        return readAt;
    }
}
