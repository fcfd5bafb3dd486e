package org.example.helpdesk.entity;

import lombok.*;

import java.time.Instant;

/**
 * A support ticket held by the in-memory store.
 *
 * <p>Instances handed out by the repository are copies; mutating them has no effect on
 * the stored record.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Ticket {

    private String id;

    private String ticketNumber;

    /** Insertion counter value, used to order tickets created within the same instant. */
    private long sequence;

    private String name;

    private String division;

    private String priority;

    private String description;

    private TicketStatus status;

    @Builder.Default
    private String assignee = "";

    @Builder.Default
    private String notes = "";

    @Builder.Default
    private String operator = "";

    private TicketPhoto photo;

    private Instant createdAt;

    private Instant updatedAt;

    /**
     * @return true if either the internal id or the display number equals {@code key}
     */
    public boolean matches(String key) {
        return key != null && (key.equals(id) || key.equals(ticketNumber));
    }

    public Ticket copy() {
        return toBuilder().build();
    }
}
