package com.taskflow.backend.modules.notification.domain;

/**
 * Outcome of a best-effort email attempt. Delivery problems are reported here instead of thrown.
 */
public enum DeliveryResult {
    SENT,
    SKIPPED_NO_ADDRESS,
    SKIPPED_DISABLED_BY_USER,
    SKIPPED_TRANSPORT_DISABLED,
    FAILED;

    public boolean isDelivered() {
        return this == SENT;
    }
}
