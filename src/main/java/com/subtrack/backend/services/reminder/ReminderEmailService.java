package com.subtrack.backend.services.reminder;

import com.subtrack.backend.exceptions.ReminderDeliveryException;
import com.subtrack.backend.services.EmailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders one renewal reminder and hands it to {@link EmailService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReminderEmailService {

    private static final DateTimeFormatter RENEWAL_DATE_FORMAT = DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US);

    private final EmailService emailService;
    private final Clock clock;

    /**
     * @param to           recipient address
     * @param type         template label, e.g. "7 days before reminder"
     * @param subscription subscription the reminder is about
     * @return provider message id
     * @throws IllegalArgumentException  if an argument is missing or no template has that label
     * @throws ReminderDeliveryException if the provider did not accept the email
     */
    public String sendReminderEmail(String to, String type, SubscriptionSnapshot subscription) {
        if (to == null || to.isBlank() || type == null || type.isBlank() || subscription == null) {
            throw new IllegalArgumentException("Missing required fields");
        }

        ReminderEmailTemplates.Template template = ReminderEmailTemplates.find(type)
                .orElseThrow(() -> new IllegalArgumentException("Invalid template type"));

        ReminderEmailTemplates.MailInfo mailInfo = toMailInfo(subscription);
        String subject = template.generateSubject(mailInfo);
        String body = template.generateBody(mailInfo);

        EmailService.EmailResult result = emailService.sendHtmlEmail(to, subject, body);
        if (!result.isSuccess()) {
            throw new ReminderDeliveryException(to, type, result.getErrorMessage());
        }

        log.info("Sent '{}' for subscription {} to {}, message id {}", type, subscription.getId(), to, result.getMessageId());
        return result.getMessageId();
    }

    ReminderEmailTemplates.MailInfo toMailInfo(SubscriptionSnapshot subscription) {
        ZoneId zone = clock.getZone();
        String renewalDate = subscription.getRenewalDate() != null
                ? RENEWAL_DATE_FORMAT.format(subscription.getRenewalDate().atZoneSameInstant(zone))
                : "";
        String frequency = subscription.getFrequency() != null ? subscription.getFrequency().getValue() : "";
        String price = subscription.getCurrency() + " " + subscription.getPrice().toPlainString() + " (" + frequency + ")";

        return new ReminderEmailTemplates.MailInfo(
                subscription.getUserName(),
                subscription.getName(),
                renewalDate,
                subscription.getName(),
                price,
                subscription.getPaymentMethod());
    }
}
