package org.example.helpdesk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a ticket.
 *
 * <p>A {@code null} field is left untouched. An empty string is applied as is, so notes,
 * operator and assignee can be cleared explicitly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketUpdateRequest {

    private String status;

    private String notes;

    private String operator;

    private String assignee;
}
