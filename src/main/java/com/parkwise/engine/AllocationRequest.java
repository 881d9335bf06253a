package com.parkwise.engine;

import java.util.Objects;
import java.util.Optional;

/**
 * <p>
 * A vehicle asking for a slot.
 * </p>
 *
 * <p>
 * The licence plate may be missing, in which case the engine assigns a
 * generated one. The customer key identifies the holder of VIP passes and
 * defaults to the licence plate.
 * </p>
 */
public class AllocationRequest {
    private final String plate;
    private final String customerKey;
    private final SizeClass size;
    private final CustomerType customerType;
    private final boolean ev;

    /**
     * Constructs a new request.
     *
     * @param plate        Licence plate, {@code null} or blank if unknown.
     * @param customerKey  Key of the customer, {@code null} or blank to use the plate.
     * @param size         Size class of the vehicle.
     * @param customerType Kind of customer.
     * @param ev           Whether the vehicle wants a charging point.
     */
    public AllocationRequest(final String plate, final String customerKey, final SizeClass size,
            final CustomerType customerType, final boolean ev) {
        this.plate = blankToNull(plate);
        this.customerKey = blankToNull(customerKey);
        this.size = Objects.requireNonNull(size);
        this.customerType = Objects.requireNonNull(customerType);
        this.ev = ev;
    }

    /**
     * Constructs a request from loosely typed input, e.g. a form or a JSON body.
     *
     * @param vehicleType  Name of the size class, case-insensitive.
     * @param customerType Name of the customer type, case-insensitive; {@code null} means regular.
     * @param ev           Whether the vehicle wants a charging point.
     * @param plate        Licence plate, may be blank.
     * @param customerKey  Key of the customer, may be blank.
     * @return The request.
     * @throws ParkingException {@code INVALID_REQUEST} for unknown names.
     */
    public static AllocationRequest parse(final String vehicleType, final String customerType, final boolean ev,
            final String plate, final String customerKey) throws ParkingException {
        final var size = SizeClass.fromName(vehicleType)
                .orElseThrow(() -> ParkingException.invalidRequest("Invalid vehicle type: " + vehicleType));
        final var customer = customerType == null ? CustomerType.REGULAR
                : CustomerType.fromName(customerType)
                        .orElseThrow(() -> ParkingException.invalidRequest("Invalid customer type: " + customerType));
        return new AllocationRequest(plate, customerKey, size, customer, ev);
    }

    private static String blankToNull(final String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return text.trim();
    }

    /**
     * Returns a copy of this request with the given licence plate.
     *
     * @param newPlate Licence plate.
     * @return The copy.
     */
    public AllocationRequest withPlate(final String newPlate) {
        return new AllocationRequest(newPlate, this.customerKey, this.size, this.customerType, this.ev);
    }

    public Optional<String> getPlate() {
        return Optional.ofNullable(this.plate);
    }

    /**
     * Returns the key under which the customer's passes are registered.
     *
     * @return The customer key, falling back to the licence plate.
     */
    public Optional<String> getCustomerKey() {
        return Optional.ofNullable(this.customerKey != null ? this.customerKey : this.plate);
    }

    public SizeClass getSize() {
        return this.size;
    }

    public CustomerType getCustomerType() {
        return this.customerType;
    }

    public boolean isEv() {
        return this.ev;
    }

    @Override
    public String toString() {
        return String.format("AllocationRequest(%s, %s, %s%s)", this.plate, this.size, this.customerType,
                this.ev ? ", EV" : "");
    }
}
