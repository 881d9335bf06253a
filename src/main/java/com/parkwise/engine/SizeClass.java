package com.parkwise.engine;

import java.util.Locale;
import java.util.Optional;

/**
 * <p>
 * Size class of a vehicle or of a slot.
 * </p>
 *
 * <p>
 * Size classes are totally ordered by capacity: a vehicle of a given class fits
 * into a slot of the same class or of any larger class, never into a smaller one.
 * </p>
 */
public enum SizeClass {
    /**
     * Motorbikes and small cars.
     */
    SMALL(1),
    /**
     * Ordinary cars.
     */
    MEDIUM(2),
    /**
     * Vans and other large vehicles.
     */
    LARGE(3);

    /**
     * Relative capacity of the class.
     */
    private final int capacity;

    SizeClass(final int capacity) {
        this.capacity = capacity;
    }

    /**
     * Returns whether a vehicle of this class fits into a slot of the given class.
     *
     * @param slotClass Size class of the slot.
     * @return Whether the vehicle fits.
     */
    public boolean fits(final SizeClass slotClass) {
        return slotClass.capacity >= this.capacity;
    }

    /**
     * Returns by how many classes a slot of the given class exceeds this class.
     *
     * @param slotClass Size class of the slot.
     * @return Zero for an exact fit, a positive number for an oversized slot.
     */
    public int oversizeIn(final SizeClass slotClass) {
        return slotClass.capacity - this.capacity;
    }

    /**
     * Returns a {@link SizeClass} based on its name, ignoring case.
     *
     * @param name Name of the size class.
     * @return An optional {@link SizeClass} which is empty in case the name is invalid.
     */
    public static Optional<SizeClass> fromName(final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "SMALL" -> Optional.of(SMALL);
            case "MEDIUM" -> Optional.of(MEDIUM);
            case "LARGE" -> Optional.of(LARGE);
            default -> Optional.empty();
        };
    }
}
