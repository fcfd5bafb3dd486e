package org.example.helpdesk.service;

import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.exception.TicketValidationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/**
 * Single place for the rules on ticket input.
 *
 * <p>Controllers run bean validation on the request DTOs first; the service calls this
 * class again so that direct callers get the same guarantees.
 */
@Slf4j
@Service
public class TicketValidationService {

    /** Filter value that disables status filtering. */
    public static final String ALL_STATUSES = "all";

    // ==================== CREATE VALIDATION ====================

    /**
     * @throws TicketValidationException if the request is null or a required field is blank
     */
    public void validateCreateRequest(TicketCreateRequest request) {
        if (request == null) {
            throw new TicketValidationException("Ticket create request cannot be null");
        }

        List<String> errors = new ArrayList<>();
        if (!StringUtils.hasText(request.getName())) {
            errors.add("Name is required");
        }
        if (!StringUtils.hasText(request.getDivision())) {
            errors.add("Division is required");
        }
        if (!StringUtils.hasText(request.getDescription())) {
            errors.add("Description is required");
        }

        if (!errors.isEmpty()) {
            log.debug("Create request rejected: {}", errors);
            throw new TicketValidationException(errors);
        }
    }

    // ==================== STATUS ====================

    /**
     * @throws TicketValidationException if {@code label} is not a known status label
     */
    public TicketStatus parseStatus(String label) {
        return TicketStatus.fromLabel(label)
                .orElseThrow(() -> new TicketValidationException(
                        "Invalid status: " + label + ". Valid values: " + Arrays.toString(TicketStatus.values())));
    }

    /**
     * Predicate for the list filter. Absent, blank or {@code all} matches everything;
     * an unknown label matches nothing.
     */
    public Predicate<Ticket> statusFilter(String statusFilter) {
        if (!StringUtils.hasText(statusFilter) || ALL_STATUSES.equalsIgnoreCase(statusFilter.trim())) {
            return ticket -> true;
        }
        return TicketStatus.fromLabel(statusFilter.trim())
                .<Predicate<Ticket>>map(status -> ticket -> ticket.getStatus() == status)
                .orElse(ticket -> false);
    }

    // ==================== PAGINATION ====================

    /**
     * @throws TicketValidationException if {@code limit} is below 1
     */
    public void validateLimit(int limit) {
        if (limit < 1) {
            throw new TicketValidationException("Limit must be at least 1, got: " + limit);
        }
    }
}
