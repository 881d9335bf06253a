package com.parkwise.engine;

import java.time.Duration;
import java.time.Instant;

/**
 * <p>
 * A prepaid entitlement to fee-free parking for one size class under one
 * customer key.
 * </p>
 *
 * <p>
 * A pass is active until its expiry and never deleted. Buying again before
 * expiry extends the same pass (see {@link PassRegistry#purchase}). Instances
 * are immutable; an extension yields a new instance with the same ID.
 * </p>
 */
public class VipPass {
    /**
     * Validity bought with one purchase.
     */
    public static final Duration TERM = Duration.ofDays(30);

    private final String id;
    private final String customerKey;
    private final SizeClass size;
    private final Instant issuedAt;
    private final Instant expiresAt;
    private final long amountPaid;

    /**
     * Constructs a new pass valid for one {@link #TERM} from its issue time.
     *
     * @param id          ID of the pass.
     * @param customerKey Key of the customer.
     * @param size        Covered size class.
     * @param issuedAt    Time of the purchase.
     * @param price       Amount paid.
     */
    public VipPass(final String id, final String customerKey, final SizeClass size, final Instant issuedAt,
            final long price) {
        this(id, customerKey, size, issuedAt, issuedAt.plus(TERM), price);
    }

    private VipPass(final String id, final String customerKey, final SizeClass size, final Instant issuedAt,
            final Instant expiresAt, final long amountPaid) {
        this.id = id;
        this.customerKey = customerKey;
        this.size = size;
        this.issuedAt = issuedAt;
        this.expiresAt = expiresAt;
        this.amountPaid = amountPaid;
    }

    public String getId() {
        return this.id;
    }

    public String getCustomerKey() {
        return this.customerKey;
    }

    public SizeClass getSize() {
        return this.size;
    }

    public Instant getIssuedAt() {
        return this.issuedAt;
    }

    public Instant getExpiresAt() {
        return this.expiresAt;
    }

    /**
     * Returns the total amount paid for the pass over all purchases.
     *
     * @return Amount paid.
     */
    public long getAmountPaid() {
        return this.amountPaid;
    }

    /**
     * Returns whether the pass entitles a vehicle of the given class to park for free.
     *
     * @param now  Current time.
     * @param size Size class of the vehicle.
     * @return Whether the pass is active and covers the size class.
     */
    public boolean covers(final Instant now, final SizeClass size) {
        return this.size == size && now.isBefore(this.expiresAt);
    }

    /**
     * Returns the pass extended by one {@link #TERM}, counted from now or from
     * the current expiry, whichever is later.
     *
     * @param now   Time of the purchase.
     * @param price Amount paid.
     * @return The extended pass.
     */
    VipPass extend(final Instant now, final long price) {
        final var from = now.isAfter(this.expiresAt) ? now : this.expiresAt;
        return new VipPass(this.id, this.customerKey, this.size, this.issuedAt, from.plus(TERM),
                this.amountPaid + price);
    }

    @Override
    public String toString() {
        return String.format("VipPass(%s, %s, %s, until %s)", this.id, this.customerKey, this.size, this.expiresAt);
    }
}
