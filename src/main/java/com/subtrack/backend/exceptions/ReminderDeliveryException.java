package com.subtrack.backend.exceptions;

/**
 * The mail provider did not accept a reminder. Fails the workflow step that sent it.
 */
public class ReminderDeliveryException extends RuntimeException {

    public ReminderDeliveryException(String recipient, String reminderType, String reason) {
        super("Failed to send '" + reminderType + "' to " + recipient + ": " + reason);
    }
}
