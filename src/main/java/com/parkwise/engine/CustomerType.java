package com.parkwise.engine;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of customer requesting a slot.
 */
public enum CustomerType {
    /**
     * Pays per hour.
     */
    REGULAR,
    /**
     * May hold a monthly pass and is steered to the VIP section.
     */
    VIP;

    /**
     * Returns a {@link CustomerType} based on its name, ignoring case.
     *
     * @param name Name of the customer type.
     * @return An optional {@link CustomerType} which is empty in case the name is invalid.
     */
    public static Optional<CustomerType> fromName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "REGULAR" -> Optional.of(REGULAR);
            case "VIP" -> Optional.of(VIP);
            default -> Optional.empty();
        };
    }
}
