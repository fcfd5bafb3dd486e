package org.example.helpdesk.exception;

/**
 * Exception thrown when no ticket matches the requested id or ticket number.
 */
public class TicketNotFoundException extends TicketingException {

    private static final String ERROR_CODE = "TICKET_NOT_FOUND";

    public TicketNotFoundException(String idOrNumber) {
        super("Ticket not found with id or number: " + idOrNumber, ERROR_CODE);
    }
}
