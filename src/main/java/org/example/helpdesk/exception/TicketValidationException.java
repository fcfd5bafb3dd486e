package org.example.helpdesk.exception;

import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when a request carries missing or invalid fields.
 * Collects every violation found so the caller can fix them in one go.
 */
@Getter
public class TicketValidationException extends TicketingException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    private final List<String> violations;

    public TicketValidationException(String message) {
        super(message, ERROR_CODE);
        this.violations = List.of(message);
    }

    public TicketValidationException(List<String> violations) {
        super("Validation failed: " + String.join("; ", violations), ERROR_CODE);
        this.violations = List.copyOf(violations);
    }
}
