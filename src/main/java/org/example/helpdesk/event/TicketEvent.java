package org.example.helpdesk.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * Base class for ticket domain events, published after the store has applied the change.
 */
@Getter
public abstract class TicketEvent extends ApplicationEvent {

    private final String ticketId;

    private final String ticketNumber;

    protected TicketEvent(Object source, String ticketId, String ticketNumber) {
        super(source);
        this.ticketId = ticketId;
        this.ticketNumber = ticketNumber;
    }
}
