package org.example.helpdesk.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.PagedResponse;
import org.example.helpdesk.dto.TicketActionRequest;
import org.example.helpdesk.dto.TicketActionResponse;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketCreatedResponse;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.example.helpdesk.service.TicketService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;


@Slf4j
@RestController
@RequestMapping("/api/tickets")
@RequiredArgsConstructor
public class TicketController {

    private final TicketService ticketService;

    // ==================== CREATE ====================

    /**
     * Create a new ticket from a form, with an optional {@code photo} part.
     * POST /api/tickets
     */
    @PostMapping(consumes = {MediaType.MULTIPART_FORM_DATA_VALUE, MediaType.APPLICATION_FORM_URLENCODED_VALUE})
    public ResponseEntity<TicketCreatedResponse> createTicket(
            @Valid @ModelAttribute TicketCreateRequest request,
            @RequestParam(name = "photo", required = false) MultipartFile photo) {
        log.info("POST /api/tickets - Creating ticket (photo: {})", photo != null && !photo.isEmpty());
        return created(ticketService.createTicket(request, photo));
    }

    /**
     * Create a new ticket from a JSON body. JSON requests cannot carry a photo.
     * POST /api/tickets
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<TicketCreatedResponse> createTicketFromJson(
            @Valid @RequestBody TicketCreateRequest request) {
        log.info("POST /api/tickets - Creating ticket from JSON");
        return created(ticketService.createTicket(request, null));
    }

    private ResponseEntity<TicketCreatedResponse> created(TicketDTO ticket) {
        TicketCreatedResponse body = new TicketCreatedResponse(
                "Ticket created successfully", ticket, ticket.getId());
        return new ResponseEntity<>(body, HttpStatus.CREATED);
    }

    // ==================== READ ====================

    /**
     * List tickets, newest first.
     * GET /api/tickets?status=&page=&limit=
     */
    @GetMapping
    public ResponseEntity<PagedResponse<TicketDTO>> listTickets(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "${helpdesk.tickets.default-page-size:50}") int limit) {
        log.debug("GET /api/tickets - status: {}, page: {}, limit: {}", status, page, limit);
        return ResponseEntity.ok(ticketService.listTickets(status, page, limit));
    }

    /**
     * Get a ticket by id or ticket number.
     * GET /api/tickets/{id}
     */
    @GetMapping("/{id}")
    public ResponseEntity<TicketDTO> getTicket(@PathVariable String id) {
        log.debug("GET /api/tickets/{}", id);
        return ResponseEntity.ok(ticketService.getTicket(id));
    }

    // ==================== UPDATE ====================

    /**
     * Partially update a ticket. A missing body is an empty patch.
     * PUT /api/tickets/{id}
     */
    @PutMapping("/{id}")
    public ResponseEntity<TicketActionResponse> updateTicket(
            @PathVariable String id,
            @Valid @RequestBody(required = false) TicketUpdateRequest request) {
        log.info("PUT /api/tickets/{}", id);
        return ResponseEntity.ok(new TicketActionResponse(
                "Ticket updated successfully", ticketService.updateTicket(id, request)));
    }

    /**
     * Mark a ticket as resolved.
     * POST /api/tickets/{id}/resolve
     */
    @PostMapping("/{id}/resolve")
    public ResponseEntity<TicketActionResponse> resolveTicket(
            @PathVariable String id,
            @Valid @RequestBody(required = false) TicketActionRequest request) {
        log.info("POST /api/tickets/{}/resolve", id);
        return ResponseEntity.ok(new TicketActionResponse(
                "Ticket resolved successfully", ticketService.resolveTicket(id, request)));
    }

    /**
     * Mark a ticket as declined.
     * POST /api/tickets/{id}/decline
     */
    @PostMapping("/{id}/decline")
    public ResponseEntity<TicketActionResponse> declineTicket(
            @PathVariable String id,
            @Valid @RequestBody(required = false) TicketActionRequest request) {
        log.info("POST /api/tickets/{}/decline", id);
        return ResponseEntity.ok(new TicketActionResponse(
                "Ticket declined successfully", ticketService.declineTicket(id, request)));
    }

    // ==================== DELETE ====================

    /**
     * Delete a ticket and return it.
     * DELETE /api/tickets/{id}
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<TicketActionResponse> deleteTicket(@PathVariable String id) {
        log.info("DELETE /api/tickets/{}", id);
        return ResponseEntity.ok(new TicketActionResponse(
                "Ticket deleted successfully", ticketService.deleteTicket(id)));
    }
}
