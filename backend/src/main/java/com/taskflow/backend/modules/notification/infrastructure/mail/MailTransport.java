package com.taskflow.backend.modules.notification.infrastructure.mail;

public interface MailTransport {

    /**
     * Whether outgoing mail is configured at all.
     */
    boolean isEnabled();

    /**
     * @return true when the message was handed to the mail server
     */
    boolean send(String to, String subject, String htmlBody);
}
