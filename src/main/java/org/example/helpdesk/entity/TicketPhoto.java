package org.example.helpdesk.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Image attached to a ticket at creation time, kept Base64 encoded.
 */
@Getter
@Builder
@AllArgsConstructor
public class TicketPhoto {

    private final String data;

    private final String contentType;

    private final long size;
}
