package com.parkwise;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;

import org.junit.Test;

import com.beust.jcommander.JCommander;
import com.parkwise.engine.CustomerType;
import com.parkwise.engine.SizeClass;

public class TestCli {
    private static Config parse(final String... args) {
        final var cli = new Cli();
        JCommander.newBuilder().addObject(cli).build().parse(args);
        return cli.toConfig();
    }

    @Test
    public void testDefaults() {
        final var config = parse();
        assertEquals(Config.defaults().getTopology().getSlotCount(), config.getTopology().getSlotCount());
        assertEquals(36, config.getTopology().getSlotCount());
        assertEquals(40, config.getPricing().hourlyRate(SizeClass.MEDIUM));
        assertEquals(20, config.getPricing().minimumCharge());
        assertEquals(3150, config.getPricing().monthlyPassPrice(SizeClass.LARGE));
        assertFalse(config.isVipAutoEnroll());
        assertEquals(Duration.ofHours(24), config.getTimeLimit(CustomerType.REGULAR));
        assertEquals(Duration.ofDays(30), config.getTimeLimit(CustomerType.VIP));
    }

    @Test
    public void testOptions() {
        final var config = parse("-levels", "3", "-small-regular", "10", "-rate-small", "25", "-minimum-charge", "5",
                "-pass-medium", "1999", "-vip-auto-enroll");
        assertEquals(3 * (10 + 1 + 1 + 4 + 2 + 2 + 2 + 1 + 1), config.getTopology().getSlotCount());
        assertEquals(25, config.getPricing().hourlyRate(SizeClass.SMALL));
        assertEquals(5, config.getPricing().minimumCharge());
        assertEquals(1999, config.getPricing().monthlyPassPrice(SizeClass.MEDIUM));
        assertTrue(config.isVipAutoEnroll());
    }

    @Test
    public void testTimeLimits() {
        final var config = parse("-limit-regular-hours", "4", "-limit-vip-hours", "48");
        assertEquals(Duration.ofHours(4), config.getTimeLimit(CustomerType.REGULAR));
        assertEquals(Duration.ofHours(48), config.getTimeLimit(CustomerType.VIP));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositiveTimeLimit() {
        parse("-limit-regular-hours", "0");
    }
}
