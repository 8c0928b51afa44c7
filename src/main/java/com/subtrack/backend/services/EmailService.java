package com.subtrack.backend.services;

import com.resend.Resend;
import com.resend.core.exception.ResendException;
import com.resend.services.emails.model.CreateEmailOptions;
import com.resend.services.emails.model.CreateEmailResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Outbound email through Resend (https://resend.com).
 * <p>
 * Without a valid API key (one that starts with {@code re_}) or with {@code resend.enabled=false}
 * the service stays disabled and every send reports a failure instead of calling out.
 */
@Service
@Slf4j
public class EmailService {

    private final Resend resend;
    private final boolean enabled;
    private final String fromEmail;
    private final String fromName;

    public EmailService(
            @Value("${resend.api-key:}") String apiKey,
            @Value("${resend.enabled:true}") boolean enabledConfig,
            @Value("${resend.from-email:reminders@subtrack.app}") String fromEmail,
            @Value("${resend.from-name:SubTrack}") String fromName) {

        this.fromEmail = fromEmail;
        this.fromName = fromName;

        boolean hasValidKey = apiKey != null && !apiKey.isEmpty() && apiKey.startsWith("re_");
        this.enabled = enabledConfig && hasValidKey;

        if (this.enabled) {
            this.resend = new Resend(apiKey);
            log.info("Resend email service initialized, from: {} <{}>", fromName, fromEmail);
        } else {
            this.resend = null;
            if (!hasValidKey) {
                log.warn("Resend API key not configured or invalid - emails will not be sent");
                log.warn("Set RESEND_API_KEY with your Resend API key (starts with 're_')");
            } else {
                log.warn("Resend is disabled via configuration");
            }
        }
    }

    /**
     * Send one HTML email. Never throws; the outcome is in the result.
     */
    public EmailResult sendHtmlEmail(String toEmail, String subject, String htmlContent) {
        if (!enabled) {
            log.warn("Email service disabled, not sending '{}' to {}", subject, toEmail);
            return new EmailResult(false, null, "Email service is not configured");
        }

        try {
            CreateEmailOptions params = CreateEmailOptions.builder()
                    .from(fromName + " <" + fromEmail + ">")
                    .to(toEmail)
                    .subject(subject)
                    .html(htmlContent)
                    .build();

            CreateEmailResponse response = resend.emails().send(params);
            log.info("Email sent to {} via Resend, id: {}", toEmail, response.getId());
            return new EmailResult(true, response.getId(), null);

        } catch (ResendException e) {
            log.error("Resend rejected email to {}: {}", toEmail, e.getMessage());
            return new EmailResult(false, null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error sending email to {}: {}", toEmail, e.getMessage(), e);
            return new EmailResult(false, null, e.getMessage());
        }
    }

    public boolean isConfigured() {
        return enabled;
    }

    public String getFromEmail() {
        return fromEmail;
    }

    /**
     * Result wrapper for email operations
     */
    public static class EmailResult {
        private final boolean success;
        private final String messageId;
        private final String errorMessage;

        public EmailResult(boolean success, String messageId, String errorMessage) {
            this.success = success;
            this.messageId = messageId;
            this.errorMessage = errorMessage;
        }

        public boolean isSuccess() {
            return success;
        }

        public String getMessageId() {
            return messageId;
        }

        public String getErrorMessage() {
            return errorMessage;
        }
    }
}
