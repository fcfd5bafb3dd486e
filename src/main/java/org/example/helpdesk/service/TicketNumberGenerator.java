package org.example.helpdesk.service;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;

/**
 * Builds the internal id and the display number of a ticket.
 *
 * <p>Both embed the store sequence, which never repeats within a process, so they are unique
 * without consulting the store. The random suffix only makes display numbers harder to guess.
 */
@Component
public class TicketNumberGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 4;

    private final SecureRandom random = new SecureRandom();

    /**
     * @return e.g. {@code ticket_1718000000000_7}
     */
    public String nextId(long sequence, Instant createdAt) {
        return "ticket_" + createdAt.toEpochMilli() + "_" + sequence;
    }

    /**
     * @return e.g. {@code TKT-LXB4Z3K0-7Q2F9}
     */
    public String nextTicketNumber(long sequence, Instant createdAt) {
        String timestamp = Long.toString(createdAt.toEpochMilli(), 36);
        String counter = Long.toString(sequence, 36);
        return ("TKT-" + timestamp + "-" + counter + randomSuffix()).toUpperCase(Locale.ROOT);
    }

    private String randomSuffix() {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return suffix.toString();
    }
}
