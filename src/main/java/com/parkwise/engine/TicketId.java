package com.parkwise.engine;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;

/**
 * <p>
 * A <em>ticket ID</em> uniquely identifies a parking ticket.
 * </p>
 *
 * <p>
 * Ticket IDs consist of eight upper-case letters and digits, e.g. {@code K3ZQ81AB}.
 * A released ticket keeps its ID; a new parking event always gets a new one.
 * </p>
 */
public class TicketId {
    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int LENGTH = 8;
    private static final Random RANDOM = new SecureRandom();

    /**
     * Textual value of the ID.
     */
    private final String value;

    /**
     * Generates a new random ticket ID.
     *
     * @return The generated ticket ID.
     */
    public static TicketId generate() {
        return new TicketId(randomCode(LENGTH));
    }

    /**
     * Parses a ticket ID as typed in by a customer, ignoring case and surrounding blanks.
     *
     * @param text Text to parse.
     * @return The parsed ID or an empty {@link Optional} in case the text is malformed.
     */
    public static Optional<TicketId> parse(final String text) {
        if (text == null) {
            return Optional.empty();
        }
        final var normalized = text.trim().toUpperCase(Locale.ROOT);
        if (normalized.length() != LENGTH) {
            return Optional.empty();
        }
        for (var i = 0; i < normalized.length(); i++) {
            if (ALPHABET.indexOf(normalized.charAt(i)) < 0) {
                return Optional.empty();
            }
        }
        return Optional.of(new TicketId(normalized));
    }

    /**
     * Returns a random code over the ticket alphabet.
     *
     * @param length Length of the code.
     * @return Random code.
     */
    static String randomCode(final int length) {
        final var code = new StringBuilder(length);
        for (var i = 0; i < length; i++) {
            code.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return code.toString();
    }

    /**
     * Constructs a ticket ID from its textual value.
     *
     * @param value Textual value.
     */
    protected TicketId(final String value) {
        this.value = value;
    }

    /**
     * Returns the textual value of the ID.
     *
     * @return Textual value.
     */
    public String getValue() {
        return this.value;
    }

    @Override
    public int hashCode() {
        return this.value.hashCode();
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (other == null) {
            return false;
        }
        if (this.getClass() != other.getClass()) {
            return false;
        }
        return this.value.equals(((TicketId) other).value);
    }

    @Override
    public String toString() {
        return this.value;
    }
}
