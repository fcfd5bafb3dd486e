package org.example.helpdesk.dto;

/**
 * Body of a successful ticket creation.
 */
public record TicketCreatedResponse(String message, TicketDTO ticket, String ticketId) {
}
