package org.example.helpdesk.event;

/**
 * Event published when a ticket has been removed through the API.
 */
public class TicketDeletedEvent extends TicketEvent {

    public TicketDeletedEvent(Object source, String ticketId, String ticketNumber) {
        super(source, ticketId, ticketNumber);
    }

    @Override
    public String toString() {
        return String.format("TicketDeletedEvent[ticketId=%s, ticketNumber=%s]",
                getTicketId(), getTicketNumber());
    }
}
