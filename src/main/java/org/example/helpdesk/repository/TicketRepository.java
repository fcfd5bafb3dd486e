package org.example.helpdesk.repository;

import org.example.helpdesk.entity.Ticket;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * Store for tickets that lives for the lifetime of the process.
 *
 * <p>Operations:
 * - Create: save(sequence -> ticket)
 * - Read: findByIdOrTicketNumber(key), findAll()
 * - Update: update(key, mutation)
 * - Delete: deleteByIdOrTicketNumber(key), deleteCreatedBefore(threshold)
 *
 * <p>Every method is atomic with respect to every other method. Returned tickets are copies.
 */
public interface TicketRepository {

    /**
     * Allocate the next sequence value, build the ticket from it and append it.
     *
     * @param factory builds the ticket for the allocated sequence value
     * @return a copy of the stored ticket
     */
    Ticket save(LongFunction<Ticket> factory);

    /**
     * Find a ticket whose id or ticket number equals {@code key}.
     */
    Optional<Ticket> findByIdOrTicketNumber(String key);

    /**
     * Snapshot of all tickets in insertion order.
     */
    List<Ticket> findAll();

    /**
     * Apply {@code mutation} to the stored ticket matching {@code key}.
     *
     * @return a copy of the ticket after the mutation, or empty if nothing matched
     */
    Optional<Ticket> update(String key, Consumer<Ticket> mutation);

    /**
     * Remove the ticket matching {@code key}.
     *
     * @return the removed ticket, or empty if nothing matched
     */
    Optional<Ticket> deleteByIdOrTicketNumber(String key);

    /**
     * Remove every ticket created strictly before {@code threshold}.
     *
     * @return number of removed tickets
     */
    int deleteCreatedBefore(Instant threshold);

    long count();
}
