package com.latchkey.backend.modules.auth.infrastructure.mail;

import java.util.UUID;

import com.latchkey.backend.global.config.MailExecutorConfig;
import com.latchkey.backend.modules.auth.application.AccountMailer;
import com.latchkey.backend.modules.auth.application.TokenPurpose;
import com.latchkey.backend.modules.auth.domain.AppUser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Composes the message on the caller's thread and sends it on the mail executor. Inside a
 * transaction the send is queued only after commit, so a rolled back request mails nothing.
 */
@Component
public class SmtpAccountMailer implements AccountMailer {

    private static final Logger log = LoggerFactory.getLogger(SmtpAccountMailer.class);

    static final String CONFIRMATION_SUBJECT = "Confirmation Instructions";
    static final String PASSWORD_RESET_SUBJECT = "Password Reset Instructions";

    private final JavaMailSender mailSender;
    private final TaskExecutor mailTaskExecutor;
    private final String from;
    private final String baseUrl;

    public SmtpAccountMailer(
            JavaMailSender mailSender,
            @Qualifier(MailExecutorConfig.MAIL_TASK_EXECUTOR) TaskExecutor mailTaskExecutor,
            @Value("${latchkey.mail.from:no-reply@example.com}") String from,
            @Value("${latchkey.mail.base-url:http://localhost:8080}") String baseUrl
    ) {
        this.mailSender = mailSender;
        this.mailTaskExecutor = mailTaskExecutor;
        this.from = from;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public void deliver(AppUser user, String token, TokenPurpose purpose) {
        SimpleMailMessage message = switch (purpose) {
            case CONFIRM_EMAIL -> compose(
                    user.getConfirmableEmail(),
                    CONFIRMATION_SUBJECT,
                    "Confirm your email address by opening this link before it expires:\n\n"
                            + baseUrl + "/confirmations/" + token + "\n"
            );
            case RESET_PASSWORD -> compose(
                    user.getEmail(),
                    PASSWORD_RESET_SUBJECT,
                    "Reset your password by opening this link before it expires:\n\n"
                            + baseUrl + "/passwords/" + token + "\n\n"
                            + "If you did not ask for a password reset you can ignore this message.\n"
            );
        };
        Runnable send = () -> send(message, purpose, user.getId());
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    dispatch(send, purpose, user.getId());
                }
            });
        } else {
            dispatch(send, purpose, user.getId());
        }
    }

    private void dispatch(Runnable send, TokenPurpose purpose, UUID userId) {
        try {
            mailTaskExecutor.execute(send);
        } catch (TaskRejectedException ex) {
            log.warn("Dropped {} mail to user {}: mail queue is full", purpose.claimValue(), userId);
        }
    }

    private void send(SimpleMailMessage message, TokenPurpose purpose, UUID userId) {
        try {
            mailSender.send(message);
            log.info("Sent {} mail to user {}", purpose.claimValue(), userId);
        } catch (MailException ex) {
            log.warn("Failed to send {} mail to user {}: {}", purpose.claimValue(), userId, ex.getMessage());
        }
    }

    private SimpleMailMessage compose(String to, String subject, String text) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(from);
        message.setTo(to);
        message.setSubject(subject);
        message.setText(text);
        return message;
    }
}
