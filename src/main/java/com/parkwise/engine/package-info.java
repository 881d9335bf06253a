/**
 * <p>
 * The in-memory parking engine.
 * </p>
 *
 * <p>
 * The components of the engine are:
 * </p>
 *
 * <ul>
 * <li>{@link SlotInventory}: Fixed set of slots, each changed by compare-and-set only.</li>
 * <li>{@link AllocationPolicy}: Ranks free slots for a request.</li>
 * <li>{@link TicketRegistry}: Active and released tickets by ID and licence plate.</li>
 * <li>{@link PassRegistry}: 30-day passes by customer and size class.</li>
 * <li>{@link PricingTable}: Hourly rates, minimum charge and pass prices.</li>
 * <li>{@link EventBroadcaster}: Delivers {@link SlotEvent}s to listeners on its own thread.</li>
 * </ul>
 *
 * <p>
 * {@link ParkingEngine} ties the components together and is the only entry point
 * for mutations.
 * </p>
 */
package com.parkwise.engine;
