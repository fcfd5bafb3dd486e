package org.example.helpdesk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Ticket counts for the dashboard. The per-status counts always sum to {@code totalTickets}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DashboardStatsResponse {

    private long totalTickets;
    private long unresolvedTickets;
    private long inProgressTickets;
    private long resolvedTickets;
    private long declinedTickets;
    private Map<String, Long> byPriority;
}
