package org.example.helpdesk.event;

import lombok.Getter;
import org.example.helpdesk.dto.TicketDTO;

/**
 * Event published when a ticket has been updated, resolved or declined.
 */
@Getter
public class TicketUpdatedEvent extends TicketEvent {

    /** update, resolve or decline */
    private final String action;

    private final TicketDTO ticketDTO;

    public TicketUpdatedEvent(Object source, String action, TicketDTO ticketDTO) {
        super(source, ticketDTO.getId(), ticketDTO.getTicketNumber());
        this.action = action;
        this.ticketDTO = ticketDTO;
    }

    @Override
    public String toString() {
        return String.format("TicketUpdatedEvent[ticketId=%s, ticketNumber=%s, action=%s, status=%s]",
                getTicketId(), getTicketNumber(), action, ticketDTO.getStatus());
    }
}
