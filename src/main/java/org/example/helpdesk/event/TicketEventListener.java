package org.example.helpdesk.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes an audit line for every ticket event.
 *
 * <p>Listeners run synchronously on the publishing thread, after the store lock has been released.
 */
@Slf4j
@Component
public class TicketEventListener {

    @EventListener
    public void handleTicketCreated(TicketCreatedEvent event) {
        log.info("✅ Ticket created - id: {}, ticketNumber: {}, division: {}",
                event.getTicketId(), event.getTicketNumber(), event.getTicketDTO().getDivision());
    }

    @EventListener
    public void handleTicketUpdated(TicketUpdatedEvent event) {
        log.info("✏️ Ticket {} - id: {}, ticketNumber: {}, status: {}",
                event.getAction(), event.getTicketId(), event.getTicketNumber(),
                event.getTicketDTO().getStatus());
    }

    @EventListener
    public void handleTicketDeleted(TicketDeletedEvent event) {
        log.info("🗑️ Ticket deleted - id: {}, ticketNumber: {}",
                event.getTicketId(), event.getTicketNumber());
    }

    @EventListener
    public void handleTicketsPurged(TicketsPurgedEvent event) {
        log.info("Cleanup completed. Purged: {}, total tickets: {}, threshold: {}",
                event.getPurgedCount(), event.getRemainingCount(), event.getThreshold());
    }
}
