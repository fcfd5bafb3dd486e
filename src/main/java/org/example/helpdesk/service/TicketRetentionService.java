package org.example.helpdesk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.HelpdeskProperties;
import org.example.helpdesk.event.TicketsPurgedEvent;
import org.example.helpdesk.repository.TicketRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Removes tickets older than the retention window, whatever their status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketRetentionService {

    private final TicketRepository ticketRepository;
    private final HelpdeskProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Delete tickets created strictly before {@code now - retentionDays}.
     *
     * @return number of removed tickets
     */
    public int purgeExpired() {
        Instant threshold = Instant.now(clock)
                .minus(Duration.ofDays(properties.retention().retentionDays()));
        int purged = ticketRepository.deleteCreatedBefore(threshold);
        eventPublisher.publishEvent(new TicketsPurgedEvent(this, purged, threshold, ticketRepository.count()));
        return purged;
    }
}
