package com.openforge.memkeep.gateway;

import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SMTP delivery through Spring's {@link JavaMailSender}.  The sender bean only
 * exists when spring.mail.host is set; without it every send is refused with
 * a "not configured" error, logged once.
 */
@Slf4j
@Component
public class SmtpEmailTransport implements EmailTransport {

    private final ObjectProvider<JavaMailSender> mailSender;
    private final EmailProperties properties;
    private final AtomicBoolean   missingConfigLogged = new AtomicBoolean();

    public SmtpEmailTransport(ObjectProvider<JavaMailSender> mailSender, EmailProperties properties) {
        this.mailSender = mailSender;
        this.properties = properties;
    }

    @Override
    public boolean isConfigured() {
        return mailSender.getIfAvailable() != null
                && properties.from() != null && !properties.from().isBlank();
    }

    @Override
    public String send(EmailMessage message) {
        JavaMailSender sender = mailSender.getIfAvailable();
        if (sender == null || !isConfigured()) {
            if (missingConfigLogged.compareAndSet(false, true)) {
                log.warn("[Email] Not configured: set spring.mail.host/username/password and agent.email.from.");
            }
            throw new GatewayException("Email not configured. Set spring.mail.* and agent.email.from.");
        }
        try {
            MimeMessage mime = sender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, true, StandardCharsets.UTF_8.name());
            helper.setFrom(properties.from(), properties.fromName());
            helper.setTo(message.to());
            helper.setSubject(message.subject());
            helper.setText(message.body(), message.body().replace("\n", "<br>"));
            sender.send(mime);
            String messageId = mime.getMessageID();
            log.info("[Email] Sent to {}: {} ({})", message.to(), message.subject(), messageId);
            return messageId;
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            throw new GatewayException("Email failed: " + e.getMessage(), e);
        }
    }
}
