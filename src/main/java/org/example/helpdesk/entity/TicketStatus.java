package org.example.helpdesk.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Lifecycle labels of a ticket.
 *
 * <p>Any status may move to any other status. {@link #RESOLVED} and {@link #DECLINED}
 * are terminal by convention only.
 */
public enum TicketStatus {

    UNRESOLVED("Unresolved"),
    IN_PROGRESS("InProgress"),
    RESOLVED("Resolved"),
    DECLINED("Declined");

    private final String label;

    TicketStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Resolves a status from its label. Matching is exact.
     *
     * @param label the wire label, e.g. {@code InProgress}
     * @return the status, or empty if the label is unknown
     */
    public static Optional<TicketStatus> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.label.equals(label))
                .findFirst();
    }

    @Override
    public String toString() {
        return label;
    }
}
