package org.example.helpdesk.service;

import org.example.helpdesk.dto.DashboardStatsResponse;
import org.example.helpdesk.dto.PagedResponse;
import org.example.helpdesk.dto.TicketActionRequest;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.springframework.web.multipart.MultipartFile;

/**
 * Service interface for ticket operations.
 *
 * <p>Every {@code idOrNumber} parameter matches either the internal id or the display number.
 */
public interface TicketService {

    /**
     * List tickets, newest first.
     *
     * @param status status label, {@code all} or null for no filter
     * @param page   1-based page number; pages out of range yield no rows
     * @param limit  page size, at least 1
     * @return the requested page with the filtered total
     * @throws org.example.helpdesk.exception.TicketValidationException if limit is below 1
     */
    PagedResponse<TicketDTO> listTickets(String status, int page, int limit);

    /**
     * Get a ticket without its photo payload.
     *
     * @throws org.example.helpdesk.exception.TicketNotFoundException if not found
     */
    TicketDTO getTicket(String idOrNumber);

    /**
     * Create a new ticket in status Unresolved.
     *
     * @param request the text fields
     * @param photo   optional image, may be null
     * @return the created ticket without its photo payload
     * @throws org.example.helpdesk.exception.TicketValidationException  if a required field is blank
     * @throws org.example.helpdesk.exception.InvalidAttachmentException if the photo is rejected
     */
    TicketDTO createTicket(TicketCreateRequest request, MultipartFile photo);

    /**
     * Apply the non-null fields of {@code request}.
     *
     * @throws org.example.helpdesk.exception.TicketNotFoundException   if not found
     * @throws org.example.helpdesk.exception.TicketValidationException if the status label is unknown
     */
    TicketDTO updateTicket(String idOrNumber, TicketUpdateRequest request);

    /**
     * Force status Resolved; notes and operator are applied when non-null.
     *
     * @throws org.example.helpdesk.exception.TicketNotFoundException if not found
     */
    TicketDTO resolveTicket(String idOrNumber, TicketActionRequest request);

    /**
     * Force status Declined; notes and operator are applied when non-null.
     *
     * @throws org.example.helpdesk.exception.TicketNotFoundException if not found
     */
    TicketDTO declineTicket(String idOrNumber, TicketActionRequest request);

    /**
     * Remove a ticket.
     *
     * @return the removed ticket
     * @throws org.example.helpdesk.exception.TicketNotFoundException if not found
     */
    TicketDTO deleteTicket(String idOrNumber);

    /**
     * Count tickets per status and per priority.
     */
    DashboardStatsResponse getStats();
}
