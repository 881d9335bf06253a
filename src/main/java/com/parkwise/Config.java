package com.parkwise;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import com.parkwise.engine.CustomerType;
import com.parkwise.engine.PricingTable;
import com.parkwise.engine.Topology;

/**
 * Configuration of the parking engine.
 */
public class Config {
    /**
     * Default stay: one day for regular customers, one pass term for VIPs.
     */
    public static final Map<CustomerType, Duration> DEFAULT_TIME_LIMITS = Collections.unmodifiableMap(
            new EnumMap<>(Map.of(CustomerType.REGULAR, Duration.ofHours(24), CustomerType.VIP, Duration.ofDays(30))));

    /**
     * Layout of the garage.
     */
    private final Topology topology;
    /**
     * Rates and pass prices.
     */
    private final PricingTable pricing;
    /**
     * Whether a VIP entering without a pass buys one automatically.
     */
    private final boolean vipAutoEnroll;
    /**
     * Time a vehicle may stay per customer type before it counts as expired.
     */
    private final Map<CustomerType, Duration> timeLimits;

    /**
     * Constructs a new instance with the {@link #DEFAULT_TIME_LIMITS}.
     *
     * @param topology      Layout of the garage.
     * @param pricing       Rates and pass prices.
     * @param vipAutoEnroll Whether a VIP entering without a pass buys one automatically.
     */
    public Config(final Topology topology, final PricingTable pricing, final boolean vipAutoEnroll) {
        this(topology, pricing, vipAutoEnroll, DEFAULT_TIME_LIMITS);
    }

    /**
     * Constructs a new instance from the provided parameters.
     *
     * @param topology      Layout of the garage.
     * @param pricing       Rates and pass prices.
     * @param vipAutoEnroll Whether a VIP entering without a pass buys one automatically.
     * @param timeLimits    Positive time limit for every customer type.
     */
    public Config(final Topology topology, final PricingTable pricing, final boolean vipAutoEnroll,
            final Map<CustomerType, Duration> timeLimits) {
        this.topology = Objects.requireNonNull(topology);
        this.pricing = Objects.requireNonNull(pricing);
        this.vipAutoEnroll = vipAutoEnroll;
        final var limits = new EnumMap<CustomerType, Duration>(CustomerType.class);
        for (final var type : CustomerType.values()) {
            final var limit = timeLimits.get(type);
            if (limit == null || limit.isNegative() || limit.isZero()) {
                throw new IllegalArgumentException("Missing or non-positive time limit for " + type);
            }
            limits.put(type, limit);
        }
        this.timeLimits = Collections.unmodifiableMap(limits);
    }

    /**
     * Returns the default configuration: two levels of the standard layout,
     * standard pricing, no auto-enrolment.
     *
     * @return The default configuration.
     */
    public static Config defaults() {
        return new Config(Topology.standard(2), PricingTable.standard(), false);
    }

    /**
     * Returns the layout of the garage.
     *
     * @return Layout of the garage.
     */
    public Topology getTopology() {
        return this.topology;
    }

    /**
     * Returns the rates and pass prices.
     *
     * @return Rates and pass prices.
     */
    public PricingTable getPricing() {
        return this.pricing;
    }

    /**
     * Returns whether a VIP entering without a pass buys one automatically.
     *
     * @return Whether VIP auto-enrolment is enabled.
     */
    public boolean isVipAutoEnroll() {
        return this.vipAutoEnroll;
    }

    /**
     * Returns the time a customer of the given type may stay.
     *
     * @param type Customer type.
     * @return Time limit.
     */
    public Duration getTimeLimit(final CustomerType type) {
        return this.timeLimits.get(type);
    }
}
