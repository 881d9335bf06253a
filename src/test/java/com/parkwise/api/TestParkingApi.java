package com.parkwise.api;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.time.Duration;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parkwise.Config;
import com.parkwise.engine.MutableClock;
import com.parkwise.engine.ParkingEngine;
import com.parkwise.engine.ParkingException;
import com.parkwise.engine.PricingTable;
import com.parkwise.engine.Section;
import com.parkwise.engine.SizeClass;
import com.parkwise.engine.Topology;
import com.parkwise.request.MockRequest;
import com.parkwise.request.Request;

public class TestParkingApi {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final MutableClock clock = new MutableClock();
    private ParkingEngine engine;
    private ParkingApi api;

    @Before
    public void setUp() {
        final var topology = Topology.builder()
                .add(1, SizeClass.SMALL, Section.REGULAR, 2)
                .add(1, SizeClass.MEDIUM, Section.VIP, 1)
                .add(2, SizeClass.LARGE, Section.EV, 1)
                .build();
        this.engine = ParkingEngine.launch(new Config(topology, PricingTable.standard(), false), this.clock);
        this.api = new ParkingApi(this.engine, new EventJournal(100));
    }

    @After
    public void tearDown() {
        this.api.shutdown();
    }

    private MockRequest send(final Request.Kind kind, final String body, final String query) {
        final var request = new MockRequest(kind, body, query);
        this.api.handle(request);
        return request;
    }

    private static JsonNode json(final MockRequest request) throws Exception {
        return MAPPER.readTree(request.getResponse());
    }

    private JsonNode expect(final int status, final MockRequest request) throws Exception {
        assertEquals(request.getResponse(), status, request.getStatus());
        return json(request);
    }

    private JsonNode allocate(final String body) throws Exception {
        return this.expect(200, this.send(Request.Kind.ALLOCATE, body, null));
    }

    @Test
    public void testAllocateAndRelease() throws Exception {
        final var allocation = this.allocate("{\"vehicle_type\": \"small\", \"license_plate\": \"KA-1\"}");
        assertEquals("L1-01", allocation.get("slot_id").asText());
        assertEquals(1, allocation.get("level").asInt());
        assertEquals("regular", allocation.get("section").asText());
        assertEquals("regular", allocation.get("customer_type").asText());
        assertEquals("KA-1", allocation.get("license_plate").asText());
        assertEquals(8, allocation.get("ticket").asText().length());
        assertFalse(allocation.has("pass_id"));

        this.clock.advance(Duration.ofMinutes(135));
        final var ticket = allocation.get("ticket").asText();
        final var release = this.expect(200,
                this.send(Request.Kind.RELEASE, "{\"ticket\": \"" + ticket.toLowerCase() + "\"}", null));
        assertEquals(ticket, release.get("ticket").asText());
        assertEquals(60, release.get("fee").asLong());
        assertEquals(2.25, release.get("hours").asDouble(), 1e-9);
        assertEquals(3, release.get("billed_hours").asLong());
        assertFalse(release.get("pass_applied").asBoolean());

        final var lookup = this.expect(200, this.send(Request.Kind.TICKET, null, "id=" + ticket));
        assertEquals("released", lookup.get("state").asText());
        assertEquals(60, lookup.get("fee").asLong());
    }

    @Test
    public void testStatus() throws Exception {
        this.allocate("{\"vehicle_type\": \"large\", \"is_ev\": true, \"license_plate\": \"EV-1\"}");
        final var status = this.expect(200, this.send(Request.Kind.STATUS, null, null));

        assertEquals(4, status.get("counters").get("total").asInt());
        assertEquals(1, status.get("counters").get("occupied").asInt());
        assertEquals(3, status.get("counters").get("available").asInt());
        assertEquals(2, status.get("free_by_size").get("small").asInt());
        assertEquals(0, status.get("free_by_size").get("large").asInt());
        final var occupied = status.get("occupied_slots");
        assertEquals(1, occupied.size());
        assertEquals("L2-01", occupied.get(0).get("slot_id").asText());
        assertEquals("ev", occupied.get(0).get("section").asText());
        assertEquals("EV-1", occupied.get(0).get("license_plate").asText());
    }

    @Test
    public void testExpiredVehicles() throws Exception {
        final var entry = this.clock.instant();
        final var regular = this.allocate("{\"vehicle_type\": \"small\", \"license_plate\": \"KA-1\"}");
        assertEquals(24, regular.get("time_limit_hours").asLong());
        assertEquals(entry.plus(Duration.ofHours(24)).toString(), regular.get("expiry_time").asText());
        final var vip = this.allocate(
                "{\"vehicle_type\": \"medium\", \"customer_type\": \"vip\", \"license_plate\": \"VIP-1\"}");
        assertEquals(720, vip.get("time_limit_hours").asLong());

        var status = this.expect(200, this.send(Request.Kind.STATUS, null, null));
        assertEquals(0, status.get("counters").get("expired").asInt());

        this.clock.advance(Duration.ofHours(25));
        status = this.expect(200, this.send(Request.Kind.STATUS, null, null));
        assertEquals(1, status.get("counters").get("expired").asInt());
        final var occupied = status.get("occupied_slots");
        assertEquals(2, occupied.size());
        assertEquals("KA-1", occupied.get(0).get("license_plate").asText());
        assertTrue(occupied.get(0).get("expired").asBoolean());
        assertEquals("VIP-1", occupied.get(1).get("license_plate").asText());
        assertFalse(occupied.get(1).get("expired").asBoolean());

        final var lookup = this.expect(200,
                this.send(Request.Kind.TICKET, null, "id=" + regular.get("ticket").asText()));
        assertEquals(regular.get("expiry_time").asText(), lookup.get("expiry_time").asText());
    }

    @Test
    public void testSlots() throws Exception {
        final var ticket = this.allocate(
                "{\"vehicle_type\": \"medium\", \"customer_type\": \"vip\", \"license_plate\": \"KA-1\"}")
                .get("ticket").asText();
        final var slots = this.expect(200, this.send(Request.Kind.SLOTS, null, null));

        assertEquals(4, slots.size());
        final var vip = slots.get(2);
        assertEquals("L1-03", vip.get("id").asText());
        assertEquals("vip", vip.get("section").asText());
        assertEquals("occupied", vip.get("status").asText());
        assertEquals(ticket, vip.get("ticket").asText());
        assertTrue(slots.get(0).get("ticket").isNull());
        assertTrue(slots.get(3).get("is_ev").asBoolean());
    }

    @Test
    public void testPassPurchase() throws Exception {
        final var pass = this.expect(200, this.send(Request.Kind.PURCHASE_PASS,
                "{\"customer_key\": \"VIP-1\", \"vehicle_type\": \"medium\"}", null));
        assertTrue(pass.get("pass_id").asText().startsWith("P-"));
        assertEquals(2100, pass.get("amount_charged").asLong());
        assertEquals("2024-05-31T08:00:00Z", pass.get("expiry").asText());

        final var allocation = this.allocate(
                "{\"vehicle_type\": \"medium\", \"customer_type\": \"vip\", \"license_plate\": \"VIP-1\"}");
        assertEquals("vip", allocation.get("section").asText());
        this.clock.advance(Duration.ofHours(4));
        final var release = this.expect(200, this.send(Request.Kind.RELEASE,
                "{\"ticket\": \"" + allocation.get("ticket").asText() + "\"}", null));
        assertEquals(0, release.get("fee").asLong());
        assertTrue(release.get("pass_applied").asBoolean());
    }

    @Test
    public void testErrors() throws Exception {
        this.allocate("{\"vehicle_type\": \"small\", \"license_plate\": \"KA-1\"}");

        final var duplicate = this.expect(409, this.send(Request.Kind.ALLOCATE,
                "{\"vehicle_type\": \"small\", \"license_plate\": \"KA-1\"}", null));
        assertEquals("DUPLICATE_VEHICLE", duplicate.get("error").asText());
        assertTrue(duplicate.has("message"));
        assertTrue(duplicate.has("timestamp"));

        this.allocate("{\"vehicle_type\": \"small\", \"license_plate\": \"KA-2\"}");
        this.allocate("{\"vehicle_type\": \"small\", \"license_plate\": \"KA-3\"}");
        this.allocate("{\"vehicle_type\": \"small\", \"license_plate\": \"KA-4\"}");
        final var full = this.expect(503, this.send(Request.Kind.ALLOCATE,
                "{\"vehicle_type\": \"large\", \"license_plate\": \"KA-5\"}", null));
        assertEquals("NO_SLOT_AVAILABLE", full.get("error").asText());

        assertEquals("INVALID_REQUEST", this.expect(400, this.send(Request.Kind.ALLOCATE,
                "{\"vehicle_type\": \"bus\"}", null)).get("error").asText());
        assertEquals("INVALID_REQUEST", this.expect(400, this.send(Request.Kind.ALLOCATE,
                "{\"vehicle_type\": \"small\", \"customer_type\": \"gold\"}", null)).get("error").asText());
        assertEquals("INVALID_REQUEST", this.expect(400, this.send(Request.Kind.ALLOCATE,
                "{not json", null)).get("error").asText());
        assertEquals("INVALID_REQUEST", this.expect(400, this.send(Request.Kind.ALLOCATE,
                null, null)).get("error").asText());
        assertEquals("INVALID_REQUEST", this.expect(400, this.send(Request.Kind.RELEASE,
                "{}", null)).get("error").asText());
        assertEquals("INVALID_TICKET", this.expect(404, this.send(Request.Kind.RELEASE,
                "{\"ticket\": \"NOPE\"}", null)).get("error").asText());
        assertEquals("INVALID_TICKET", this.expect(404, this.send(Request.Kind.TICKET,
                null, "id=ZZZZZZZZ")).get("error").asText());
        assertEquals("INVALID_REQUEST", this.expect(400, this.send(Request.Kind.PURCHASE_PASS,
                "{\"vehicle_type\": \"small\"}", null)).get("error").asText());
        assertEquals("INVALID_REQUEST", this.expect(400, this.send(Request.Kind.EVENTS,
                null, "after=x")).get("error").asText());
    }

    @Test
    public void testWrongMethod() throws Exception {
        final var request = new MockRequest(Request.Method.GET, Request.Kind.ALLOCATE, null, null);
        this.api.handle(request);
        assertEquals("METHOD_NOT_ALLOWED", this.expect(405, request).get("error").asText());
        assertEquals(4, this.engine.status().getAvailable());
    }

    @Test
    public void testEvents() throws Exception {
        final var ticket = this.allocate("{\"vehicle_type\": \"small\", \"license_plate\": \"KA-1\"}")
                .get("ticket").asText();
        this.clock.advance(Duration.ofMinutes(30));
        this.send(Request.Kind.RELEASE, "{\"ticket\": \"" + ticket + "\"}", null);
        // Drains the broadcaster so the journal has seen both events.
        this.engine.shutdown();

        final var all = this.expect(200, this.send(Request.Kind.EVENTS, null, null));
        assertEquals(2, all.get("last_sequence").asLong());
        final var events = all.get("events");
        assertEquals(2, events.size());
        assertEquals("slot_occupied", events.get(0).get("type").asText());
        assertEquals(ticket, events.get(0).get("ticket").asText());
        assertFalse(events.get(0).has("fee"));
        assertEquals("slot_freed", events.get(1).get("type").asText());
        assertEquals(20, events.get(1).get("fee").asLong());

        final var tail = this.expect(200, this.send(Request.Kind.EVENTS, null, "after=1"));
        assertEquals(1, tail.get("events").size());
        assertEquals(2, tail.get("events").get(0).get("sequence").asLong());
    }

    @Test
    public void testStatusCodes() {
        assertEquals(400, ParkingApi.statusOf(ParkingException.Kind.INVALID_REQUEST));
        assertEquals(404, ParkingApi.statusOf(ParkingException.Kind.INVALID_TICKET));
        assertEquals(409, ParkingApi.statusOf(ParkingException.Kind.DUPLICATE_VEHICLE));
        assertEquals(503, ParkingApi.statusOf(ParkingException.Kind.NO_SLOT_AVAILABLE));
        assertEquals(503, ParkingApi.statusOf(ParkingException.Kind.SLOT_CONFLICT));
    }
}
