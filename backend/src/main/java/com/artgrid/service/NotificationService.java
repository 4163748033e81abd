package com.artgrid.service;

import com.artgrid.config.ArtgridProperties;
import com.artgrid.entity.Artwork;
import com.artgrid.entity.User;
import lombok.extern.slf4j.Slf4j;
import com.artgrid.config.NotificationExecutorConfig;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Transactional email to artists.
 *
 * Delivery is best effort: messages are handed to the notification executor, and a
 * failure is logged and never propagates to the request that triggered it. Inside a
 * transaction the message is queued only after commit, so a rolled-back approval does
 * not announce itself. Without a configured
 * {@link JavaMailSender} (no {@code spring.mail.host}), or with
 * {@code artgrid.mail.enabled=false}, messages are logged instead of sent.
 */
@Service
@Slf4j
public class NotificationService {

    private static final String SIGNATURE = "\n\nBest regards,\nARTGRID Team";

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final ArtgridProperties properties;
    private final TaskExecutor executor;

    public NotificationService(ObjectProvider<JavaMailSender> mailSenderProvider, ArtgridProperties properties,
                               @Qualifier(NotificationExecutorConfig.NOTIFICATION_EXECUTOR) TaskExecutor executor) {
        this.mailSenderProvider = mailSenderProvider;
        this.properties = properties;
        this.executor = executor;
    }

    public void sendWelcome(User user) {
        dispatch(user.getEmail(),
                "Welcome to ARTGRID - UoPeople Art Community",
                String.format("Hello %s,\n\nWelcome to ARTGRID! Your account has been created successfully."
                        + "\n\nStart showcasing your artwork today!%s", user.getFullName(), SIGNATURE));
    }

    public void sendSubmissionReceived(User artist, Artwork artwork) {
        dispatch(artist.getEmail(),
                "Artwork Submitted - ARTGRID",
                String.format("Hello %s,\n\nYour artwork \"%s\" has been submitted successfully."
                                + "\n\nStatus: %s"
                                + "\n\nThank you for contributing to the UoPeople art community!%s",
                        artist.getFullName(), artwork.getTitle(), artwork.getStatus().getValue(), SIGNATURE));
    }

    public void sendApproved(Artwork artwork) {
        User artist = artwork.getArtist();
        dispatch(artist.getEmail(),
                "Artwork Approved - ARTGRID",
                String.format("Hello %s,\n\nGreat news! Your artwork \"%s\" has been approved and is now live on ARTGRID."
                                + "\n\nView it here: %s/artwork/%d"
                                + "\n\nThank you for contributing to the UoPeople art community!%s",
                        artist.getFullName(), artwork.getTitle(), properties.getPublicBaseUrl(),
                        artwork.getId(), SIGNATURE));
    }

    public void sendRejected(Artwork artwork, String feedback) {
        User artist = artwork.getArtist();
        dispatch(artist.getEmail(),
                "Artwork Submission Update - ARTGRID",
                String.format("Hello %s,\n\nThank you for your submission \"%s\". After review, we need you to make"
                                + " some adjustments before it can be approved."
                                + "\n\nFeedback: %s"
                                + "\n\nPlease feel free to resubmit your artwork after making the necessary changes.%s",
                        artist.getFullName(), artwork.getTitle(), feedback != null ? feedback : "", SIGNATURE));
    }

    private void dispatch(String to, String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(properties.getMail().getFrom());
        message.setTo(to);
        message.setSubject(subject);
        message.setText(body);

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    enqueue(message);
                }
            });
        } else {
            enqueue(message);
        }
    }

    private void enqueue(SimpleMailMessage message) {
        try {
            executor.execute(() -> send(message));
        } catch (TaskRejectedException e) {
            log.warn("Email dropped, notification queue is full: to={}, subject={}",
                    String.join(",", message.getTo()), message.getSubject());
        }
    }

    void send(SimpleMailMessage message) {
        String to = String.join(",", message.getTo() != null ? message.getTo() : new String[0]);
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();

        if (!properties.getMail().isEnabled() || mailSender == null) {
            log.info("Email not sent (mail delivery disabled): to={}, subject={}", to, message.getSubject());
            return;
        }

        try {
            mailSender.send(message);
            log.info("Email sent: to={}, subject={}", to, message.getSubject());
        } catch (MailException e) {
            log.error("Email delivery failed: to={}, subject={}, error={}", to, message.getSubject(), e.getMessage());
        }
    }
}
