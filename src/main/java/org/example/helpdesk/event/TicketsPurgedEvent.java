package org.example.helpdesk.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.time.Instant;

/**
 * Event published after a retention sweep, even when nothing was removed.
 */
@Getter
public class TicketsPurgedEvent extends ApplicationEvent {

    private final int purgedCount;

    private final Instant threshold;

    private final long remainingCount;

    public TicketsPurgedEvent(Object source, int purgedCount, Instant threshold, long remainingCount) {
        super(source);
        this.purgedCount = purgedCount;
        this.threshold = threshold;
        this.remainingCount = remainingCount;
    }
}
