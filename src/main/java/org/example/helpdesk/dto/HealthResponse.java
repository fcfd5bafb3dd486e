package org.example.helpdesk.dto;

import java.time.Instant;

/**
 * Liveness probe body.
 *
 * @param uptime process uptime in seconds
 * @param memory used heap, e.g. {@code 42MB}
 */
public record HealthResponse(String status, Instant timestamp, double uptime, String memory) {
}
