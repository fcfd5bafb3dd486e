package org.example.helpdesk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.example.helpdesk.entity.TicketStatus;

import java.time.Instant;

/**
 * Data Transfer Object for Ticket.
 * {@code photo} is omitted from the JSON when the mapper leaves it out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TicketDTO {

    private String id;
    private String ticketNumber;
    private String name;
    private String division;
    private String priority;
    private String description;
    private TicketStatus status;
    private String assignee;
    private String notes;
    private String operator;
    private PhotoDTO photo;
    private Instant createdAt;
    private Instant updatedAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PhotoDTO {
        private String data;
        private String contentType;
        private long size;
    }
}
