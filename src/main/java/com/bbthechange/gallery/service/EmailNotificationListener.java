package com.bbthechange.gallery.service;

import com.bbthechange.gallery.config.AsyncConfig;
import com.bbthechange.gallery.config.EmailProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.event.EventListener;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Delivers gallery notifications by e-mail on the async executor.
 */
@Component
@Slf4j
public class EmailNotificationListener {

    private final JavaMailSender mailSender;
    private final NotificationTextGenerator textGenerator;
    private final EmailProperties emailProperties;

    @Autowired
    public EmailNotificationListener(JavaMailSender mailSender, NotificationTextGenerator textGenerator,
                                     EmailProperties emailProperties) {
        this.mailSender = mailSender;
        this.textGenerator = textGenerator;
        this.emailProperties = emailProperties;
    }

    @Async(AsyncConfig.GALLERY_EXECUTOR)
    @EventListener
    public void onNotification(GalleryNotification notification) {
        if (!emailProperties.isEnabled()) {
            log.debug("E-mail disabled, dropping {}", notification);
            return;
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(emailProperties.getFrom());
        message.setTo(notification.getRecipientEmail());
        message.setSubject(textGenerator.getSubject(notification, emailProperties.getAppName()));
        message.setText(textGenerator.getBody(notification, emailProperties.getAppName(),
            emailProperties.getFrontendUrl()));

        try {
            mailSender.send(message);
            log.info("Sent {} e-mail for event {}", notification.getType(), notification.getEventId());
        } catch (MailException e) {
            log.error("Failed to send {} e-mail: {}", notification.getType(), e.getMessage(), e);
        }
    }
}
