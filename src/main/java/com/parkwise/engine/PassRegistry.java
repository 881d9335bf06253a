package com.parkwise.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <p>
 * Registry of VIP passes, one per customer key and size class.
 * </p>
 *
 * <p>
 * The registry is not thread-safe; {@link ParkingEngine} serializes access.
 * </p>
 */
public class PassRegistry {
    /**
     * Registry key of a pass.
     */
    private static class Key {
        private final String customerKey;
        private final SizeClass size;

        Key(final String customerKey, final SizeClass size) {
            this.customerKey = customerKey;
            this.size = size;
        }

        @Override
        public int hashCode() {
            return Objects.hash(this.customerKey, this.size);
        }

        @Override
        public boolean equals(final Object other) {
            if (this == other) {
                return true;
            }
            if (other == null || this.getClass() != other.getClass()) {
                return false;
            }
            final var that = (Key) other;
            return this.customerKey.equals(that.customerKey) && this.size == that.size;
        }
    }

    private final Map<Key, VipPass> passes = new HashMap<>();

    /**
     * <p>
     * Buys a pass.
     * </p>
     *
     * <p>
     * Without an existing pass for the customer and size class a new one valid for
     * 30 days is issued. Otherwise the existing pass is extended by 30 days counted
     * from now or from its current expiry, whichever is later; passes never stack.
     * </p>
     *
     * @param customerKey Key of the customer.
     * @param size        Size class to cover.
     * @param now         Time of the purchase.
     * @param price       Amount charged.
     * @return The new or extended pass.
     */
    public VipPass purchase(final String customerKey, final SizeClass size, final Instant now, final long price) {
        final var key = new Key(customerKey, size);
        final var existing = this.passes.get(key);
        if (existing != null) {
            final var extended = existing.extend(now, price);
            this.passes.put(key, extended);
            return extended;
        }
        final var pass = new VipPass("P-" + TicketId.randomCode(8), customerKey, size, now, price);
        this.passes.put(key, pass);
        return pass;
    }

    /**
     * Returns the customer's pass for a size class if it is active.
     *
     * @param customerKey Key of the customer.
     * @param size        Size class of the vehicle.
     * @param now         Current time.
     * @return The active pass, if any.
     */
    public Optional<VipPass> activePass(final String customerKey, final SizeClass size, final Instant now) {
        final var pass = this.passes.get(new Key(customerKey, size));
        if (pass == null || !pass.covers(now, size)) {
            return Optional.empty();
        }
        return Optional.of(pass);
    }

    /**
     * Returns all passes ever issued, expired ones included.
     *
     * @return Snapshot list of passes.
     */
    public List<VipPass> passes() {
        return Collections.unmodifiableList(new ArrayList<>(this.passes.values()));
    }
}
