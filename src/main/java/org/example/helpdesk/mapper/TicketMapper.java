package org.example.helpdesk.mapper;

import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketPhoto;
import org.springframework.stereotype.Component;

@Component
public class TicketMapper {

    /**
     * Map a ticket including its photo payload.
     */
    public TicketDTO toDTO(Ticket ticket) {
        return toDTO(ticket, true);
    }

    /**
     * Map a ticket without its photo payload, for single-ticket responses.
     */
    public TicketDTO toSummaryDTO(Ticket ticket) {
        return toDTO(ticket, false);
    }

    private TicketDTO toDTO(Ticket ticket, boolean includePhoto) {
        if (ticket == null) {
            return null;
        }

        return TicketDTO.builder()
                .id(ticket.getId())
                .ticketNumber(ticket.getTicketNumber())
                .name(ticket.getName())
                .division(ticket.getDivision())
                .priority(ticket.getPriority())
                .description(ticket.getDescription())
                .status(ticket.getStatus())
                .assignee(ticket.getAssignee())
                .notes(ticket.getNotes())
                .operator(ticket.getOperator())
                .photo(includePhoto ? toPhotoDTO(ticket.getPhoto()) : null)
                .createdAt(ticket.getCreatedAt())
                .updatedAt(ticket.getUpdatedAt())
                .build();
    }

    private TicketDTO.PhotoDTO toPhotoDTO(TicketPhoto photo) {
        if (photo == null) {
            return null;
        }
        return TicketDTO.PhotoDTO.builder()
                .data(photo.getData())
                .contentType(photo.getContentType())
                .size(photo.getSize())
                .build();
    }
}
