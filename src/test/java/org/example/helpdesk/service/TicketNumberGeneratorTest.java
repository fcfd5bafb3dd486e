package org.example.helpdesk.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TicketNumberGenerator")
class TicketNumberGeneratorTest {

    private static final Instant CREATED_AT = Instant.ofEpochMilli(1_718_000_000_000L);

    private final TicketNumberGenerator generator = new TicketNumberGenerator();

    @Test
    @DisplayName("id embeds millis and sequence")
    void idEmbedsMillisAndSequence() {
        assertThat(generator.nextId(7, CREATED_AT)).isEqualTo("ticket_1718000000000_7");
    }

    @Test
    @DisplayName("ticket number is upper case with base 36 parts")
    void ticketNumberIsUpperCaseWithBase36Parts() {
        String number = generator.nextTicketNumber(35, CREATED_AT);

        String millis36 = Long.toString(CREATED_AT.toEpochMilli(), 36).toUpperCase();
        assertThat(number).startsWith("TKT-" + millis36 + "-Z");
        assertThat(number).matches("TKT-[0-9A-Z]+-Z[0-9A-Z]{4}");
    }

    @Test
    @DisplayName("ticket numbers differ for distinct sequences")
    void ticketNumbersDifferForDistinctSequences() {
        Set<String> numbers = new HashSet<>();
        for (long sequence = 1; sequence <= 500; sequence++) {
            numbers.add(generator.nextTicketNumber(sequence, CREATED_AT));
        }

        assertThat(numbers).hasSize(500);
    }
}
