package org.example.helpdesk.event;

import lombok.Getter;
import org.example.helpdesk.dto.TicketDTO;

/**
 * Event published when a new ticket has been stored.
 */
@Getter
public class TicketCreatedEvent extends TicketEvent {

    private final TicketDTO ticketDTO;

    public TicketCreatedEvent(Object source, TicketDTO ticketDTO) {
        super(source, ticketDTO.getId(), ticketDTO.getTicketNumber());
        this.ticketDTO = ticketDTO;
    }

    @Override
    public String toString() {
        return String.format("TicketCreatedEvent[ticketId=%s, ticketNumber=%s]",
                getTicketId(), getTicketNumber());
    }
}
