package com.parkwise.engine;

import static org.junit.Assert.assertEquals;

import java.time.Duration;
import java.util.Map;

import org.junit.Test;

public class TestPricingTable {
    private final PricingTable pricing = PricingTable.standard();

    @Test
    public void testBilledHours() {
        assertEquals(0, PricingTable.billedHours(Duration.ZERO));
        assertEquals(1, PricingTable.billedHours(Duration.ofMillis(1)));
        assertEquals(1, PricingTable.billedHours(Duration.ofHours(1)));
        assertEquals(2, PricingTable.billedHours(Duration.ofMinutes(61)));
        assertEquals(0, PricingTable.billedHours(Duration.ofMinutes(-5)));
    }

    @Test
    public void testStartedHoursAreCharged() {
        assertEquals(120, this.pricing.parkingFee(SizeClass.MEDIUM, Duration.ofMinutes(135)));
        assertEquals(60, this.pricing.parkingFee(SizeClass.LARGE, Duration.ofMinutes(59)));
        assertEquals(40, this.pricing.parkingFee(SizeClass.SMALL, Duration.ofMinutes(90)));
    }

    @Test
    public void testMinimumCharge() {
        assertEquals(20, this.pricing.parkingFee(SizeClass.SMALL, Duration.ZERO));
        assertEquals(20, this.pricing.parkingFee(SizeClass.LARGE, Duration.ZERO));

        final var expensive = new PricingTable(Map.of(SizeClass.SMALL, 10L, SizeClass.MEDIUM, 20L,
                SizeClass.LARGE, 30L), 50, Map.of(SizeClass.SMALL, 1L, SizeClass.MEDIUM, 2L, SizeClass.LARGE, 3L));
        assertEquals(50, expensive.parkingFee(SizeClass.MEDIUM, Duration.ofHours(2)));
        assertEquals(60, expensive.parkingFee(SizeClass.MEDIUM, Duration.ofHours(3)));
    }

    @Test
    public void testPassPrices() {
        assertEquals(1050, this.pricing.monthlyPassPrice(SizeClass.SMALL));
        assertEquals(2100, this.pricing.monthlyPassPrice(SizeClass.MEDIUM));
        assertEquals(3150, this.pricing.monthlyPassPrice(SizeClass.LARGE));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIncompleteTable() {
        new PricingTable(Map.of(SizeClass.SMALL, 10L), 0, Map.of(SizeClass.SMALL, 1L));
    }
}
