package org.example.helpdesk.dto;

/**
 * Body returned by update, resolve, decline and delete.
 */
public record TicketActionResponse(String message, TicketDTO ticket) {
}
