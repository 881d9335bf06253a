package com.parkwise.engine;

/**
 * Grouping of slots that drives allocation priority.
 */
public enum Section {
    /**
     * Slots open to everybody.
     */
    REGULAR,
    /**
     * Slots reserved first for VIP customers.
     */
    VIP,
    /**
     * Slots with a charging point, reserved first for electric vehicles.
     */
    EV;
}
