package org.example.helpdesk.repository;

import lombok.extern.slf4j.Slf4j;
import org.example.helpdesk.entity.Ticket;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * {@link TicketRepository} backed by an insertion-ordered list guarded by the repository monitor.
 *
 * <p>The sequence counter only ever grows, so ids built from it stay unique even after
 * tickets are deleted or purged.
 */
@Slf4j
@Repository
public class InMemoryTicketRepository implements TicketRepository {

    private final List<Ticket> tickets = new ArrayList<>();

    private long sequence = 0;

    @Override
    public synchronized Ticket save(LongFunction<Ticket> factory) {
        Ticket ticket = factory.apply(++sequence);
        tickets.add(ticket);
        return ticket.copy();
    }

    @Override
    public synchronized Optional<Ticket> findByIdOrTicketNumber(String key) {
        return find(key).map(Ticket::copy);
    }

    @Override
    public synchronized List<Ticket> findAll() {
        List<Ticket> snapshot = new ArrayList<>(tickets.size());
        for (Ticket ticket : tickets) {
            snapshot.add(ticket.copy());
        }
        return snapshot;
    }

    @Override
    public synchronized Optional<Ticket> update(String key, Consumer<Ticket> mutation) {
        return find(key).map(ticket -> {
            mutation.accept(ticket);
            return ticket.copy();
        });
    }

    @Override
    public synchronized Optional<Ticket> deleteByIdOrTicketNumber(String key) {
        Iterator<Ticket> iterator = tickets.iterator();
        while (iterator.hasNext()) {
            Ticket ticket = iterator.next();
            if (ticket.matches(key)) {
                iterator.remove();
                return Optional.of(ticket);
            }
        }
        return Optional.empty();
    }

    @Override
    public synchronized int deleteCreatedBefore(Instant threshold) {
        int before = tickets.size();
        tickets.removeIf(ticket -> ticket.getCreatedAt().isBefore(threshold));
        int removed = before - tickets.size();
        log.debug("Removed {} tickets created before {}", removed, threshold);
        return removed;
    }

    @Override
    public synchronized long count() {
        return tickets.size();
    }

    private Optional<Ticket> find(String key) {
        return tickets.stream()
                .filter(ticket -> ticket.matches(key))
                .findFirst();
    }
}
