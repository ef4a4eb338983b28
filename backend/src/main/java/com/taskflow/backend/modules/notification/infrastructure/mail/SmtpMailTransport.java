package com.taskflow.backend.modules.notification.infrastructure.mail;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Sends HTML mail through the Boot-configured {@link JavaMailSender}. Without
 * {@code spring.mail.host} there is no sender bean and the transport reports itself disabled.
 */
@Component
public class SmtpMailTransport implements MailTransport {

    private static final Logger log = LoggerFactory.getLogger(SmtpMailTransport.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final boolean enabled;
    private final String sender;

    public SmtpMailTransport(
            ObjectProvider<JavaMailSender> mailSenderProvider,
            @Value("${app.mail.enabled:false}") boolean enabled,
            @Value("${app.mail.sender:}") String sender
    ) {
        this.mailSenderProvider = mailSenderProvider;
        this.enabled = enabled;
        this.sender = sender;
    }

    @Override
    public boolean isEnabled() {
        return enabled && StringUtils.hasText(sender) && mailSenderProvider.getIfAvailable() != null;
    }

    @Override
    public boolean send(String to, String subject, String htmlBody) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (!enabled || mailSender == null) {
            return false;
        }
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, "UTF-8");
            helper.setFrom(sender);
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(htmlBody, true);
            mailSender.send(message);
            return true;
        } catch (MessagingException | MailException ex) {
            log.warn("Mail to {} failed: {}", to, ex.getMessage());
            return false;
        }
    }
}
