package org.example.helpdesk.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.config.HelpdeskProperties;
import org.example.helpdesk.dto.DashboardStatsResponse;
import org.example.helpdesk.dto.PagedResponse;
import org.example.helpdesk.dto.TicketActionRequest;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.example.helpdesk.entity.Ticket;
import org.example.helpdesk.entity.TicketPhoto;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.event.TicketCreatedEvent;
import org.example.helpdesk.event.TicketDeletedEvent;
import org.example.helpdesk.event.TicketUpdatedEvent;
import org.example.helpdesk.exception.TicketNotFoundException;
import org.example.helpdesk.mapper.TicketMapper;
import org.example.helpdesk.repository.TicketRepository;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Implementation of {@link TicketService} on top of the in-memory {@link TicketRepository}.
 *
 * <p>Input is validated and photos are encoded before the repository is touched, so a failed
 * operation leaves the store unchanged. Each mutation is a single repository call, which keeps
 * lookup and write under the same lock. Events are published after the call returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TicketServiceImp implements TicketService {

    private static final Comparator<Ticket> NEWEST_FIRST = Comparator
            .comparing(Ticket::getCreatedAt)
            .thenComparingLong(Ticket::getSequence)
            .reversed();

    private final TicketRepository ticketRepository;
    private final TicketMapper ticketMapper;
    private final TicketValidationService validationService;
    private final TicketAttachmentService attachmentService;
    private final TicketNumberGenerator numberGenerator;
    private final HelpdeskProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    // ==================== READ ====================

    @Override
    public PagedResponse<TicketDTO> listTickets(String status, int page, int limit) {
        validationService.validateLimit(limit);

        List<Ticket> filtered = ticketRepository.findAll().stream()
                .filter(validationService.statusFilter(status))
                .sorted(NEWEST_FIRST)
                .toList();

        List<TicketDTO> rows = List.of();
        if (page >= 1) {
            long from = (long) (page - 1) * limit;
            if (from < filtered.size()) {
                int to = (int) Math.min(from + limit, filtered.size());
                rows = filtered.subList((int) from, to).stream()
                        .map(ticketMapper::toDTO)
                        .toList();
            }
        }

        log.debug("Listed {} of {} tickets - status: {}, page: {}, limit: {}",
                rows.size(), filtered.size(), status, page, limit);
        return PagedResponse.of(rows, page, limit, filtered.size());
    }

    @Override
    public TicketDTO getTicket(String idOrNumber) {
        return ticketRepository.findByIdOrTicketNumber(idOrNumber)
                .map(ticketMapper::toSummaryDTO)
                .orElseThrow(() -> new TicketNotFoundException(idOrNumber));
    }

    @Override
    public DashboardStatsResponse getStats() {
        Map<TicketStatus, Long> byStatus = new EnumMap<>(TicketStatus.class);
        Map<String, Long> byPriority = new LinkedHashMap<>();
        long total = 0;

        for (Ticket ticket : ticketRepository.findAll()) {
            total++;
            byStatus.merge(ticket.getStatus(), 1L, Long::sum);
            byPriority.merge(ticket.getPriority(), 1L, Long::sum);
        }

        return DashboardStatsResponse.builder()
                .totalTickets(total)
                .unresolvedTickets(byStatus.getOrDefault(TicketStatus.UNRESOLVED, 0L))
                .inProgressTickets(byStatus.getOrDefault(TicketStatus.IN_PROGRESS, 0L))
                .resolvedTickets(byStatus.getOrDefault(TicketStatus.RESOLVED, 0L))
                .declinedTickets(byStatus.getOrDefault(TicketStatus.DECLINED, 0L))
                .byPriority(byPriority)
                .build();
    }

    // ==================== CREATE ====================

    @Override
    public TicketDTO createTicket(TicketCreateRequest request, MultipartFile photo) {
        validationService.validateCreateRequest(request);
        TicketPhoto ticketPhoto = attachmentService.toPhoto(photo);

        String priority = StringUtils.hasText(request.getPriority())
                ? request.getPriority().trim()
                : properties.tickets().defaultPriority();
        Instant now = Instant.now(clock);

        Ticket saved = ticketRepository.save(sequence -> Ticket.builder()
                .id(numberGenerator.nextId(sequence, now))
                .ticketNumber(numberGenerator.nextTicketNumber(sequence, now))
                .sequence(sequence)
                .name(request.getName().trim())
                .division(request.getDivision().trim())
                .priority(priority)
                .description(request.getDescription().trim())
                .status(TicketStatus.UNRESOLVED)
                .photo(ticketPhoto)
                .createdAt(now)
                .updatedAt(now)
                .build());

        TicketDTO ticketDTO = ticketMapper.toSummaryDTO(saved);
        eventPublisher.publishEvent(new TicketCreatedEvent(this, ticketDTO));
        return ticketDTO;
    }

    // ==================== UPDATE ====================

    @Override
    public TicketDTO updateTicket(String idOrNumber, TicketUpdateRequest request) {
        TicketStatus status = request != null && request.getStatus() != null
                ? validationService.parseStatus(request.getStatus())
                : null;

        return mutate(idOrNumber, "update", ticket -> {
            if (status != null) {
                ticket.setStatus(status);
            }
            if (request != null) {
                applyIfPresent(request.getNotes(), ticket::setNotes);
                applyIfPresent(request.getOperator(), ticket::setOperator);
                applyIfPresent(request.getAssignee(), ticket::setAssignee);
            }
        });
    }

    @Override
    public TicketDTO resolveTicket(String idOrNumber, TicketActionRequest request) {
        return transition(idOrNumber, "resolve", TicketStatus.RESOLVED, request);
    }

    @Override
    public TicketDTO declineTicket(String idOrNumber, TicketActionRequest request) {
        return transition(idOrNumber, "decline", TicketStatus.DECLINED, request);
    }

    private TicketDTO transition(String idOrNumber, String action, TicketStatus target,
                                 TicketActionRequest request) {
        return mutate(idOrNumber, action, ticket -> {
            ticket.setStatus(target);
            if (request != null) {
                applyIfPresent(request.getNotes(), ticket::setNotes);
                applyIfPresent(request.getOperator(), ticket::setOperator);
            }
        });
    }

    private TicketDTO mutate(String idOrNumber, String action, Consumer<Ticket> changes) {
        Ticket updated = ticketRepository.update(idOrNumber, ticket -> {
                    changes.accept(ticket);
                    ticket.setUpdatedAt(Instant.now(clock));
                })
                .orElseThrow(() -> new TicketNotFoundException(idOrNumber));

        TicketDTO ticketDTO = ticketMapper.toDTO(updated);
        eventPublisher.publishEvent(new TicketUpdatedEvent(this, action, ticketDTO));
        return ticketDTO;
    }

    private static void applyIfPresent(String value, Consumer<String> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    // ==================== DELETE ====================

    @Override
    public TicketDTO deleteTicket(String idOrNumber) {
        Ticket removed = ticketRepository.deleteByIdOrTicketNumber(idOrNumber)
                .orElseThrow(() -> new TicketNotFoundException(idOrNumber));

        eventPublisher.publishEvent(new TicketDeletedEvent(this, removed.getId(), removed.getTicketNumber()));
        return ticketMapper.toDTO(removed);
    }
}
