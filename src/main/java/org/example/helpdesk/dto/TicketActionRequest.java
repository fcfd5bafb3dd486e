package org.example.helpdesk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional body of the resolve and decline endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketActionRequest {

    private String notes;

    private String operator;
}
