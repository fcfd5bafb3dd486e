package org.example.helpdesk.exception;

import lombok.Getter;

/**
 * Exception thrown when an uploaded photo is rejected.
 */
@Getter
public class InvalidAttachmentException extends TicketingException {

    private static final String ERROR_CODE = "INVALID_ATTACHMENT";

    public enum Reason {
        NOT_AN_IMAGE,
        TOO_LARGE,
        UNREADABLE
    }

    private final Reason reason;

    public InvalidAttachmentException(Reason reason, String message) {
        super(message, ERROR_CODE);
        this.reason = reason;
    }

    public InvalidAttachmentException(Reason reason, String message, Throwable cause) {
        super(message, ERROR_CODE, cause);
        this.reason = reason;
    }
}
