package org.example.helpdesk.service;

import org.example.helpdesk.dto.DashboardStatsResponse;
import org.example.helpdesk.dto.PagedResponse;
import org.example.helpdesk.dto.TicketActionRequest;
import org.example.helpdesk.dto.TicketCreateRequest;
import org.example.helpdesk.dto.TicketDTO;
import org.example.helpdesk.dto.TicketUpdateRequest;
import org.example.helpdesk.entity.TicketStatus;
import org.example.helpdesk.event.TicketCreatedEvent;
import org.example.helpdesk.event.TicketDeletedEvent;
import org.example.helpdesk.event.TicketUpdatedEvent;
import org.example.helpdesk.exception.InvalidAttachmentException;
import org.example.helpdesk.exception.TicketNotFoundException;
import org.example.helpdesk.exception.TicketValidationException;
import org.example.helpdesk.mapper.TicketMapper;
import org.example.helpdesk.repository.InMemoryTicketRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.mock.web.MockMultipartFile;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TicketServiceImp")
class TicketServiceImpTest {

    private static final Instant CREATED_AT = Instant.parse("2026-01-10T08:00:00Z");
    private static final Instant UPDATED_AT = Instant.parse("2026-01-10T09:30:00Z");

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private Clock clock;

    private InMemoryTicketRepository repository;
    private TicketServiceImp service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryTicketRepository();
        service = new TicketServiceImp(
                repository,
                new TicketMapper(),
                new TicketValidationService(),
                new TicketAttachmentService(TestProperties.defaults()),
                new TicketNumberGenerator(),
                TestProperties.defaults(),
                eventPublisher,
                clock);
    }

    @Nested
    @DisplayName("createTicket")
    class CreateTicket {

        @Test
        @DisplayName("create trims fields and applies defaults")
        void createTrimsFieldsAndAppliesDefaults() {
            when(clock.instant()).thenReturn(CREATED_AT);

            TicketDTO created = service.createTicket(request(" Alice ", " Finance ", null, " Printer jammed "), null);

            assertThat(created.getName()).isEqualTo("Alice");
            assertThat(created.getDivision()).isEqualTo("Finance");
            assertThat(created.getDescription()).isEqualTo("Printer jammed");
            assertThat(created.getPriority()).isEqualTo("Normal");
            assertThat(created.getStatus()).isEqualTo(TicketStatus.UNRESOLVED);
            assertThat(created.getAssignee()).isEmpty();
            assertThat(created.getNotes()).isEmpty();
            assertThat(created.getOperator()).isEmpty();
            assertThat(created.getCreatedAt()).isEqualTo(CREATED_AT);
            assertThat(created.getUpdatedAt()).isEqualTo(created.getCreatedAt());
            assertThat(created.getTicketNumber()).startsWith("TKT-");
            assertThat(repository.count()).isEqualTo(1);
            verify(eventPublisher).publishEvent(any(TicketCreatedEvent.class));
        }

        @Test
        @DisplayName("create keeps photo out of response but in store")
        void createKeepsPhotoOutOfResponseButInStore() {
            when(clock.instant()).thenReturn(CREATED_AT);
            MockMultipartFile photo = new MockMultipartFile("photo", "a.jpg", "image/jpeg", new byte[]{1, 2, 3});

            TicketDTO created = service.createTicket(request("Alice", "Finance", "High", "Broken"), photo);

            assertThat(created.getPhoto()).isNull();
            TicketDTO listed = service.listTickets(null, 1, 10).getRows().get(0);
            assertThat(listed.getPhoto().getContentType()).isEqualTo("image/jpeg");
            assertThat(listed.getPhoto().getData()).isEqualTo("AQID");
            assertThat(listed.getPhoto().getSize()).isEqualTo(3);
        }

        @Test
        @DisplayName("create with missing fields stores nothing")
        void createWithMissingFieldsStoresNothing() {
            assertThatThrownBy(() -> service.createTicket(request("Alice", "  ", null, null), null))
                    .isInstanceOf(TicketValidationException.class)
                    .satisfies(ex -> assertThat(((TicketValidationException) ex).getViolations())
                            .containsExactly("Division is required", "Description is required"));

            assertThat(repository.count()).isZero();
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("create with rejected photo stores nothing")
        void createWithRejectedPhotoStoresNothing() {
            MockMultipartFile pdf = new MockMultipartFile("photo", "a.pdf", "application/pdf", new byte[]{1});

            assertThatThrownBy(() -> service.createTicket(request("Alice", "Finance", null, "Broken"), pdf))
                    .isInstanceOf(InvalidAttachmentException.class);

            assertThat(repository.count()).isZero();
        }
    }

    @Nested
    @DisplayName("update, resolve, decline and delete")
    class MutateTicket {

        @Test
        @DisplayName("update only touches supplied fields")
        void updateOnlyTouchesSuppliedFields() {
            when(clock.instant()).thenReturn(CREATED_AT, UPDATED_AT);
            TicketDTO created = service.createTicket(request("Alice", "Finance", "High", "Broken"), null);
            service.resolveTicket(created.getId(), new TicketActionRequest("first note", "Dave"));

            TicketDTO updated = service.updateTicket(created.getTicketNumber(),
                    TicketUpdateRequest.builder().notes("").assignee("Erin").build());

            assertThat(updated.getStatus()).isEqualTo(TicketStatus.RESOLVED);
            assertThat(updated.getNotes()).isEmpty();
            assertThat(updated.getOperator()).isEqualTo("Dave");
            assertThat(updated.getAssignee()).isEqualTo("Erin");
            assertThat(updated.getCreatedAt()).isEqualTo(CREATED_AT);
            assertThat(updated.getUpdatedAt()).isEqualTo(UPDATED_AT);
        }

        @Test
        @DisplayName("update rejects unknown status without changing ticket")
        void updateRejectsUnknownStatusWithoutChangingTicket() {
            when(clock.instant()).thenReturn(CREATED_AT);
            TicketDTO created = service.createTicket(request("Alice", "Finance", null, "Broken"), null);

            assertThatThrownBy(() -> service.updateTicket(created.getId(),
                    TicketUpdateRequest.builder().status("Done").notes("ignored").build()))
                    .isInstanceOf(TicketValidationException.class);

            TicketDTO unchanged = service.getTicket(created.getId());
            assertThat(unchanged.getStatus()).isEqualTo(TicketStatus.UNRESOLVED);
            assertThat(unchanged.getNotes()).isEmpty();
        }

        @Test
        @DisplayName("any status may move to any other")
        void anyStatusMayMoveToAnyOther() {
            when(clock.instant()).thenReturn(CREATED_AT);
            TicketDTO created = service.createTicket(request("Alice", "Finance", null, "Broken"), null);

            service.declineTicket(created.getId(), null);
            TicketDTO reopened = service.updateTicket(created.getId(),
                    TicketUpdateRequest.builder().status("InProgress").build());

            assertThat(reopened.getStatus()).isEqualTo(TicketStatus.IN_PROGRESS);
            verify(eventPublisher, times(2)).publishEvent(any(TicketUpdatedEvent.class));
        }

        @Test
        @DisplayName("decline without body keeps notes")
        void declineWithoutBodyKeepsNotes() {
            when(clock.instant()).thenReturn(CREATED_AT);
            TicketDTO created = service.createTicket(request("Alice", "Finance", null, "Broken"), null);
            service.updateTicket(created.getId(), TicketUpdateRequest.builder().notes("keep me").build());

            TicketDTO declined = service.declineTicket(created.getId(), null);

            assertThat(declined.getStatus()).isEqualTo(TicketStatus.DECLINED);
            assertThat(declined.getNotes()).isEqualTo("keep me");
        }

        @Test
        @DisplayName("mutations on unknown ticket throw not found")
        void mutationsOnUnknownTicketThrowNotFound() {
            TicketUpdateRequest patch = TicketUpdateRequest.builder().notes("x").build();

            assertThatThrownBy(() -> service.getTicket("nope")).isInstanceOf(TicketNotFoundException.class);
            assertThatThrownBy(() -> service.updateTicket("nope", patch)).isInstanceOf(TicketNotFoundException.class);
            assertThatThrownBy(() -> service.resolveTicket("nope", null)).isInstanceOf(TicketNotFoundException.class);
            assertThatThrownBy(() -> service.declineTicket("nope", null)).isInstanceOf(TicketNotFoundException.class);
            assertThatThrownBy(() -> service.deleteTicket("nope")).isInstanceOf(TicketNotFoundException.class);
            verify(eventPublisher, never()).publishEvent(any());
        }

        @Test
        @DisplayName("delete returns removed ticket")
        void deleteReturnsRemovedTicket() {
            when(clock.instant()).thenReturn(CREATED_AT);
            TicketDTO created = service.createTicket(request("Alice", "Finance", null, "Broken"), null);

            TicketDTO removed = service.deleteTicket(created.getTicketNumber());

            assertThat(removed.getId()).isEqualTo(created.getId());
            assertThat(repository.count()).isZero();
            ArgumentCaptor<ApplicationEvent> captor = ArgumentCaptor.forClass(ApplicationEvent.class);
            verify(eventPublisher, times(2)).publishEvent(captor.capture());
            assertThat(captor.getValue()).isInstanceOf(TicketDeletedEvent.class);
            assertThat(((TicketDeletedEvent) captor.getValue()).getTicketId()).isEqualTo(created.getId());
        }
    }

    @Nested
    @DisplayName("listTickets and getStats")
    class ReadTickets {

        @Test
        @DisplayName("list sorts newest first and slices")
        void listSortsNewestFirstAndSlices() {
            when(clock.instant()).thenReturn(
                    Instant.parse("2026-01-01T00:00:00Z"),
                    Instant.parse("2026-01-03T00:00:00Z"),
                    Instant.parse("2026-01-02T00:00:00Z"));
            service.createTicket(request("Oldest", "IT", null, "x"), null);
            service.createTicket(request("Newest", "IT", null, "x"), null);
            service.createTicket(request("Middle", "IT", null, "x"), null);

            PagedResponse<TicketDTO> firstPage = service.listTickets("all", 1, 2);
            PagedResponse<TicketDTO> secondPage = service.listTickets(null, 2, 2);

            assertThat(firstPage.getRows()).extracting(TicketDTO::getName).containsExactly("Newest", "Middle");
            assertThat(secondPage.getRows()).extracting(TicketDTO::getName).containsExactly("Oldest");
            assertThat(firstPage.getTotalPages()).isEqualTo(2);
            assertThat(firstPage.getTotal()).isEqualTo(3);
        }

        @Test
        @DisplayName("list with out of range or unknown inputs returns no rows")
        void listWithOutOfRangeOrUnknownInputsReturnsNoRows() {
            when(clock.instant()).thenReturn(CREATED_AT);
            service.createTicket(request("Alice", "IT", null, "x"), null);

            assertThat(service.listTickets(null, 0, 10).getRows()).isEmpty();
            assertThat(service.listTickets(null, 2, 10).getRows()).isEmpty();
            PagedResponse<TicketDTO> unknown = service.listTickets("Archived", 1, 10);
            assertThat(unknown.getRows()).isEmpty();
            assertThat(unknown.getTotal()).isZero();
            assertThat(unknown.getTotalPages()).isZero();
            assertThatThrownBy(() -> service.listTickets(null, 1, 0)).isInstanceOf(TicketValidationException.class);
        }

        @Test
        @DisplayName("stats count every ticket once")
        void statsCountEveryTicketOnce() {
            when(clock.instant()).thenReturn(CREATED_AT);
            List<TicketDTO> created = List.of(
                    service.createTicket(request("A", "IT", "High", "x"), null),
                    service.createTicket(request("B", "IT", "High", "x"), null),
                    service.createTicket(request("C", "IT", null, "x"), null),
                    service.createTicket(request("D", "IT", "Low", "x"), null));
            service.resolveTicket(created.get(0).getId(), null);
            service.declineTicket(created.get(1).getId(), null);
            service.updateTicket(created.get(2).getId(), TicketUpdateRequest.builder().status("InProgress").build());

            DashboardStatsResponse stats = service.getStats();

            assertThat(stats.getTotalTickets()).isEqualTo(4);
            assertThat(stats.getUnresolvedTickets()).isEqualTo(1);
            assertThat(stats.getInProgressTickets()).isEqualTo(1);
            assertThat(stats.getResolvedTickets()).isEqualTo(1);
            assertThat(stats.getDeclinedTickets()).isEqualTo(1);
            assertThat(stats.getByPriority())
                    .containsEntry("High", 2L)
                    .containsEntry("Normal", 1L)
                    .containsEntry("Low", 1L);
        }
    }

    private static TicketCreateRequest request(String name, String division, String priority, String description) {
        return TicketCreateRequest.builder()
                .name(name)
                .division(division)
                .priority(priority)
                .description(description)
                .build();
    }
}
