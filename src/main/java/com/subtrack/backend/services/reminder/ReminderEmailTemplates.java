package com.subtrack.backend.services.reminder;

import org.springframework.web.util.HtmlUtils;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renewal reminder templates, one per "&lt;n&gt; days before reminder" label.
 * All values are HTML-escaped before they are placed into the body.
 */
public final class ReminderEmailTemplates {

    private static final Pattern LABEL = Pattern.compile("^(\\d+) days before reminder$");

    private ReminderEmailTemplates() {
    }

    /**
     * Values substituted into a template
     */
    public record MailInfo(String userName,
                           String subscriptionName,
                           String renewalDate,
                           String planName,
                           String price,
                           String paymentMethod) {
    }

    public static Optional<Template> find(String label) {
        if (label == null) {
            return Optional.empty();
        }
        Matcher matcher = LABEL.matcher(label);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int daysBefore;
        try {
            daysBefore = Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return daysBefore > 0 ? Optional.of(new Template(daysBefore)) : Optional.empty();
    }

    public static final class Template {

        private final int daysBefore;

        private Template(int daysBefore) {
            this.daysBefore = daysBefore;
        }

        public String generateSubject(MailInfo info) {
            String name = info.subscriptionName();
            if (daysBefore == 1) {
                return "Final Reminder: " + name + " Renews Tomorrow!";
            }
            if (daysBefore <= 3) {
                return daysBefore + " Days Left! " + name + " Subscription Renewal";
            }
            return "Reminder: Your " + name + " Subscription Renews in " + daysBefore + " Days!";
        }

        public String generateBody(MailInfo info) {
            return """
                <!DOCTYPE html>
                <html>
                <head>
                    <meta charset="UTF-8">
                    <meta name="viewport" content="width=device-width, initial-scale=1.0">
                </head>
                <body style="margin: 0; padding: 0; font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif; background-color: #f4f4f5;">
                    <table role="presentation" width="100%%" cellpadding="0" cellspacing="0" style="background-color: #f4f4f5; padding: 40px 20px;">
                        <tr>
                            <td align="center">
                                <table role="presentation" width="100%%" cellpadding="0" cellspacing="0" style="max-width: 520px; background-color: #ffffff; border-radius: 12px;">
                                    <tr>
                                        <td style="padding: 32px 32px 24px; text-align: center; border-bottom: 1px solid #e4e4e7;">
                                            <h1 style="margin: 0; font-size: 24px; font-weight: 700; color: #4F46E5;">SubTrack</h1>
                                        </td>
                                    </tr>
                                    <tr>
                                        <td style="padding: 32px;">
                                            <p style="margin: 0 0 16px; font-size: 15px; color: #18181b;">Hello <strong>%s</strong>,</p>
                                            <p style="margin: 0 0 24px; font-size: 15px; line-height: 1.6; color: #52525b;">
                                                Your <strong>%s</strong> subscription is set to renew on <strong>%s</strong> (%s).
                                            </p>
                                            <table role="presentation" width="100%%" cellpadding="0" cellspacing="0" style="background-color: #f4f4f5; border-radius: 8px;">
                                                <tr><td style="padding: 12px 16px; font-size: 14px; color: #52525b;"><strong>Plan:</strong> %s</td></tr>
                                                <tr><td style="padding: 12px 16px; font-size: 14px; color: #52525b;"><strong>Price:</strong> %s</td></tr>
                                                <tr><td style="padding: 12px 16px; font-size: 14px; color: #52525b;"><strong>Payment Method:</strong> %s</td></tr>
                                            </table>
                                            <p style="margin: 24px 0 0; font-size: 14px; line-height: 1.6; color: #52525b;">
                                                If you'd like to make changes or cancel, update the subscription in your account before the renewal date.
                                            </p>
                                        </td>
                                    </tr>
                                    <tr>
                                        <td style="padding: 24px 32px; border-top: 1px solid #e4e4e7; text-align: center;">
                                            <p style="margin: 0; font-size: 12px; color: #a1a1aa;">You are receiving this email because you track this subscription with SubTrack.</p>
                                        </td>
                                    </tr>
                                </table>
                            </td>
                        </tr>
                    </table>
                </body>
                </html>
                """.formatted(
                    escape(info.userName()),
                    escape(info.subscriptionName()),
                    escape(info.renewalDate()),
                    countdown(),
                    escape(info.planName()),
                    escape(info.price()),
                    escape(info.paymentMethod()));
        }

        private String countdown() {
            return daysBefore == 1 ? "tomorrow" : "in " + daysBefore + " days";
        }

        private static String escape(String value) {
            return value == null ? "" : HtmlUtils.htmlEscape(value);
        }
    }
}
