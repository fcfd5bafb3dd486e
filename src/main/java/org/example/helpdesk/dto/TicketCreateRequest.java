package org.example.helpdesk.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Text fields of a new ticket, bound from a multipart/url-encoded form or a JSON body.
 * The optional photo travels as a separate multipart part.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketCreateRequest {

    @NotBlank(message = "Name is required")
    private String name;

    @NotBlank(message = "Division is required")
    private String division;

    private String priority;

    @NotBlank(message = "Description is required")
    private String description;
}
