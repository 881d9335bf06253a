package com.parkwise.engine;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.junit.Test;

public class TestAllocationPolicy {
    private final AllocationPolicy policy = new AllocationPolicy();

    /**
     * Level 1: L1-01 small regular, L1-02 small VIP, L1-03 small EV, L1-04 medium regular.
     * Level 2: L2-01 small regular.
     */
    private static final Topology LAYOUT = Topology.builder()
            .add(1, SizeClass.SMALL, Section.REGULAR, 1)
            .add(1, SizeClass.SMALL, Section.VIP, 1)
            .add(1, SizeClass.SMALL, Section.EV, 1)
            .add(1, SizeClass.MEDIUM, Section.REGULAR, 1)
            .add(2, SizeClass.SMALL, Section.REGULAR, 1)
            .build();

    private static List<SlotView> slots(final String... occupied) {
        final var taken = Set.of(occupied);
        final var views = new ArrayList<SlotView>();
        for (final var slot : LAYOUT.createSlots()) {
            final var ticket = taken.contains(slot.getId().toString()) ? TicketId.generate() : null;
            views.add(new SlotView(slot.getId(), slot.getSize(), slot.getSection(), ticket));
        }
        return views;
    }

    private static AllocationRequest small(final boolean ev) {
        return new AllocationRequest("AB-123", null, SizeClass.SMALL, CustomerType.REGULAR, ev);
    }

    /**
     * Builds the expected result from the textual slot ID, e.g. {@code L1-04}.
     */
    private static Optional<SlotId> id(final String text) {
        final var dash = text.indexOf('-');
        return Optional.of(new SlotId(Integer.parseInt(text.substring(1, dash)),
                Integer.parseInt(text.substring(dash + 1))));
    }

    @Test
    public void testSectionOrders() {
        assertEquals(List.of(Section.REGULAR, Section.EV, Section.VIP), this.policy.sectionOrder(small(false), false));
        assertEquals(List.of(Section.EV, Section.VIP, Section.REGULAR), this.policy.sectionOrder(small(true), false));
        assertEquals(List.of(Section.VIP, Section.EV, Section.REGULAR), this.policy.sectionOrder(small(false), true));
        // Charging beats the VIP section.
        assertEquals(Section.EV, this.policy.preferredSection(small(true), true));
    }

    @Test
    public void testRegularPrefersRegularSection() {
        assertEquals(id("L1-01"), this.policy.selectSlot(small(false), false, slots()));
    }

    @Test
    public void testEvPrefersEvSection() {
        assertEquals(id("L1-03"), this.policy.selectSlot(small(true), false, slots()));
    }

    @Test
    public void testVipPrefersVipSection() {
        assertEquals(id("L1-02"), this.policy.selectSlot(small(false), true, slots()));
    }

    @Test
    public void testExactFitBeforeOversizedOnLowerLevel() {
        assertEquals(id("L2-01"), this.policy.selectSlot(small(false), false, slots("L1-01")));
    }

    @Test
    public void testOversizedSlotWithinPreferredSection() {
        assertEquals(id("L1-04"), this.policy.selectSlot(small(false), false, slots("L1-01", "L2-01")));
    }

    @Test
    public void testFallbackOrder() {
        assertEquals(id("L1-03"), this.policy.selectSlot(small(false), false, slots("L1-01", "L1-04", "L2-01")));
        assertEquals(id("L1-02"),
                this.policy.selectSlot(small(false), false, slots("L1-01", "L1-03", "L1-04", "L2-01")));
        assertEquals(id("L1-01"), this.policy.selectSlot(small(true), false, slots("L1-02", "L1-03")));
    }

    @Test
    public void testNeverSmallerSlot() {
        final var medium = new AllocationRequest("AB-123", null, SizeClass.MEDIUM, CustomerType.REGULAR, true);
        assertEquals(id("L1-04"), this.policy.selectSlot(medium, false, slots()));
        assertFalse(this.policy.selectSlot(medium, false, slots("L1-04")).isPresent());

        final var large = new AllocationRequest("AB-123", null, SizeClass.LARGE, CustomerType.REGULAR, false);
        assertFalse(this.policy.selectSlot(large, false, slots()).isPresent());
    }

    @Test
    public void testNothingFree() {
        assertFalse(this.policy.selectSlot(small(false), false,
                slots("L1-01", "L1-02", "L1-03", "L1-04", "L2-01")).isPresent());
    }

    @Test
    public void testDeterministic() {
        final var reversed = new ArrayList<>(slots());
        Collections.reverse(reversed);
        for (var i = 0; i < 10; i++) {
            assertEquals(id("L1-01"), this.policy.selectSlot(small(false), false, reversed));
        }
    }
}
