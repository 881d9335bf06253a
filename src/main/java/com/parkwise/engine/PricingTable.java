package com.parkwise.engine;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * <p>
 * Hourly rates, minimum charge and monthly pass prices.
 * </p>
 *
 * <p>
 * Amounts are whole currency units. A table is immutable once built.
 * </p>
 */
public class PricingTable {
    private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final Map<SizeClass, Long> hourlyRates;
    private final long minimumCharge;
    private final Map<SizeClass, Long> passPrices;

    /**
     * Constructs a new pricing table.
     *
     * @param hourlyRates   Hourly rate per size class.
     * @param minimumCharge Minimum charge of a parking event.
     * @param passPrices    Price of a 30-day pass per size class.
     */
    public PricingTable(final Map<SizeClass, Long> hourlyRates, final long minimumCharge,
            final Map<SizeClass, Long> passPrices) {
        this.hourlyRates = complete("hourly rate", hourlyRates);
        this.passPrices = complete("pass price", passPrices);
        if (minimumCharge < 0) {
            throw new IllegalArgumentException("Minimum charge must not be negative");
        }
        this.minimumCharge = minimumCharge;
    }

    /**
     * Returns the default table: 20/40/60 per hour, minimum charge 20, and
     * 1050/2100/3150 per 30-day pass for small/medium/large vehicles.
     *
     * @return The default table.
     */
    public static PricingTable standard() {
        return new PricingTable(
                Map.of(SizeClass.SMALL, 20L, SizeClass.MEDIUM, 40L, SizeClass.LARGE, 60L),
                20L,
                Map.of(SizeClass.SMALL, 1050L, SizeClass.MEDIUM, 2100L, SizeClass.LARGE, 3150L));
    }

    private static Map<SizeClass, Long> complete(final String what, final Map<SizeClass, Long> amounts) {
        final var copy = new EnumMap<SizeClass, Long>(SizeClass.class);
        for (final var size : SizeClass.values()) {
            final var amount = amounts.get(size);
            if (amount == null || amount < 0) {
                throw new IllegalArgumentException(String.format("Missing or negative %s for %s", what, size));
            }
            copy.put(size, amount);
        }
        return copy;
    }

    public long hourlyRate(final SizeClass size) {
        return this.hourlyRates.get(size);
    }

    public long minimumCharge() {
        return this.minimumCharge;
    }

    public long monthlyPassPrice(final SizeClass size) {
        return this.passPrices.get(size);
    }

    /**
     * Returns the number of started hours in the given duration.
     *
     * @param elapsed Parking duration.
     * @return Started hours, zero only for a zero duration.
     */
    public static long billedHours(final Duration elapsed) {
        final var millis = Math.max(0L, elapsed.toMillis());
        return (millis + MILLIS_PER_HOUR - 1) / MILLIS_PER_HOUR;
    }

    /**
     * Computes the fee of a parking event without a pass: every started hour is
     * charged at the hourly rate, but never less than the minimum charge.
     *
     * @param size    Size class of the vehicle.
     * @param elapsed Parking duration.
     * @return The fee.
     */
    public long parkingFee(final SizeClass size, final Duration elapsed) {
        return Math.max(this.minimumCharge, billedHours(elapsed) * this.hourlyRate(size));
    }
}
