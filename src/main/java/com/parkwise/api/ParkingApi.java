package com.parkwise.api;

import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.parkwise.engine.AllocationRequest;
import com.parkwise.engine.ParkingEngine;
import com.parkwise.engine.ParkingException;
import com.parkwise.engine.Section;
import com.parkwise.engine.SizeClass;
import com.parkwise.engine.SlotView;
import com.parkwise.engine.Ticket;
import com.parkwise.engine.TicketId;
import com.parkwise.request.Request;
import com.parkwise.request.RequestHandler;

/**
 * <p>
 * Translates API requests into engine operations and engine results into JSON.
 * </p>
 *
 * <p>
 * The handler keeps no state of its own besides the {@link EventJournal}; the
 * engine serializes all mutations, so requests may be handled concurrently.
 * </p>
 */
public class ParkingApi implements RequestHandler {
    private static final Logger LOGGER = Logger.getLogger(ParkingApi.class.getName());

    private final ParkingEngine engine;
    private final EventJournal journal;
    private final ObjectMapper mapper = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    /**
     * Body of an allocation request.
     */
    public static class AllocateBody {
        @JsonProperty("vehicle_type")
        public String vehicleType;
        @JsonProperty("customer_type")
        public String customerType;
        @JsonProperty("is_ev")
        public boolean ev;
        @JsonProperty("license_plate")
        public String licensePlate;
        @JsonProperty("customer_key")
        public String customerKey;
    }

    /**
     * Body of a release request.
     */
    public static class ReleaseBody {
        @JsonProperty("ticket")
        public String ticket;
    }

    /**
     * Body of a pass purchase.
     */
    public static class PassBody {
        @JsonProperty("customer_key")
        public String customerKey;
        @JsonProperty("vehicle_type")
        public String vehicleType;
    }

    /**
     * Constructs a new handler and subscribes the journal to the engine's events.
     *
     * @param engine  The engine.
     * @param journal Journal answering event polls.
     */
    public ParkingApi(final ParkingEngine engine, final EventJournal journal) {
        this.engine = engine;
        this.journal = journal;
        this.engine.addListener(journal);
    }

    @Override
    public void handle(final Request request) {
        if (request.getMethod() != request.getKind().getMethod()) {
            this.respondWithError(request, 405, "METHOD_NOT_ALLOWED",
                    String.format("%s requires %s", request.getPath(), request.getKind().getMethod()));
            return;
        }
        try {
            switch (request.getKind()) {
                case ALLOCATE -> this.allocate(request);
                case RELEASE -> this.release(request);
                case PURCHASE_PASS -> this.purchasePass(request);
                case SLOTS -> this.slots(request);
                case STATUS -> this.status(request);
                case TICKET -> this.ticket(request);
                case EVENTS -> this.events(request);
            }
        } catch (ParkingException error) {
            this.respondWithError(request, statusOf(error.getKind()), error.getKind().name(), error.getMessage());
        }
    }

    @Override
    public void shutdown() {
        try {
            this.engine.shutdown();
        } catch (InterruptedException error) {
            LOGGER.log(Level.WARNING, "Interrupted while stopping the engine", error);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Returns the HTTP status code for a rejection.
     *
     * @param kind Kind of the rejection.
     * @return HTTP status code.
     */
    static int statusOf(final ParkingException.Kind kind) {
        return switch (kind) {
            case INVALID_REQUEST -> 400;
            case INVALID_TICKET -> 404;
            case DUPLICATE_VEHICLE -> 409;
            case NO_SLOT_AVAILABLE, SLOT_CONFLICT -> 503;
        };
    }

    private void allocate(final Request request) throws ParkingException {
        final var body = this.readBody(request, AllocateBody.class);
        final var allocation = this.engine.allocate(AllocationRequest.parse(body.vehicleType, body.customerType,
                body.ev, body.licensePlate, body.customerKey));
        final var ticket = allocation.getTicket();
        final var json = this.mapper.createObjectNode();
        json.put("ticket", allocation.getTicketId().toString());
        json.put("slot_id", allocation.getSlotId().toString());
        json.put("level", allocation.getLevel());
        json.put("section", name(allocation.getSection()));
        json.put("slot_size", name(allocation.getSlotSize()));
        json.put("vehicle_type", name(ticket.getSize()));
        json.put("customer_type", name(ticket.getCustomerType()));
        json.put("license_plate", allocation.getPlate());
        json.put("is_ev", ticket.isEv());
        json.put("allocation_time", allocation.getEntryTime().toString());
        json.put("time_limit_hours", ticket.getTimeLimit().toHours());
        json.put("expiry_time", ticket.getDeadline().toString());
        allocation.getEnrolledPass().ifPresent(pass -> {
            json.put("pass_id", pass.getId());
            json.put("pass_expiry", pass.getExpiresAt().toString());
        });
        this.respond(request, 200, json);
    }

    private void release(final Request request) throws ParkingException {
        final var body = this.readBody(request, ReleaseBody.class);
        final var release = this.engine.release(parseTicketId(body.ticket));
        final var json = this.mapper.createObjectNode();
        json.put("ticket", release.getTicketId().toString());
        json.put("slot_id", release.getSlotId().toString());
        json.put("license_plate", release.getPlate());
        json.put("fee", release.getFee());
        json.put("hours", Math.round(release.getDurationHours() * 100) / 100.0);
        json.put("billed_hours", release.getBilledHours());
        json.put("pass_applied", release.isPassApplied());
        json.put("release_time", release.getReleasedAt().toString());
        this.respond(request, 200, json);
    }

    private void purchasePass(final Request request) throws ParkingException {
        final var body = this.readBody(request, PassBody.class);
        final var size = SizeClass.fromName(body.vehicleType)
                .orElseThrow(() -> ParkingException.invalidRequest("Invalid vehicle type: " + body.vehicleType));
        final var pass = this.engine.purchasePass(body.customerKey, size);
        final var json = this.mapper.createObjectNode();
        json.put("pass_id", pass.getId());
        json.put("customer_key", pass.getCustomerKey());
        json.put("vehicle_type", name(pass.getSize()));
        json.put("issued_at", pass.getIssuedAt().toString());
        json.put("expiry", pass.getExpiresAt().toString());
        json.put("amount_charged", this.engine.getPricing().monthlyPassPrice(size));
        json.put("amount_paid", pass.getAmountPaid());
        this.respond(request, 200, json);
    }

    private void slots(final Request request) {
        final var json = this.mapper.createArrayNode();
        for (final var slot : this.engine.snapshot()) {
            json.add(this.slotJson(slot));
        }
        this.respond(request, 200, json);
    }

    private void status(final Request request) {
        final var status = this.engine.status();
        final var json = this.mapper.createObjectNode();
        final var counters = json.putObject("counters");
        counters.put("total", status.getTotal());
        counters.put("occupied", status.getOccupied());
        counters.put("available", status.getAvailable());
        counters.put("expired", status.getExpired());
        final var free = json.putObject("free_by_size");
        status.getFreeBySize().forEach((size, count) -> free.put(name(size), count));

        final var occupied = json.putArray("occupied_slots");
        for (final var occupant : status.getOccupants()) {
            final var slot = occupant.getSlot();
            final var ticket = occupant.getTicket();
            final var entry = occupied.addObject();
            entry.put("slot_id", slot.getId().toString());
            entry.put("level", slot.getLevel());
            entry.put("section", name(slot.getSection()));
            entry.put("vehicle_type", name(ticket.getSize()));
            entry.put("customer_type", name(ticket.getCustomerType()));
            entry.put("license_plate", ticket.getPlate());
            entry.put("ticket", ticket.getId().toString());
            entry.put("allocation_time", ticket.getEntryTime().toString());
            entry.put("expiry_time", ticket.getDeadline().toString());
            entry.put("expired", ticket.isOverdue(status.getTimestamp()));
        }
        json.put("timestamp", status.getTimestamp().toString());
        this.respond(request, 200, json);
    }

    private void ticket(final Request request) throws ParkingException {
        final var id = request.getParameter("id")
                .orElseThrow(() -> ParkingException.invalidRequest("Ticket ID is required"));
        this.respond(request, 200, this.ticketJson(this.engine.lookupTicket(parseTicketId(id))));
    }

    private void events(final Request request) throws ParkingException {
        final long after;
        try {
            after = Long.parseLong(request.getParameter("after").orElse("0"));
        } catch (NumberFormatException error) {
            throw ParkingException.invalidRequest("Parameter 'after' must be a number");
        }
        final var json = this.mapper.createObjectNode();
        json.put("last_sequence", this.journal.getLastSequence());
        final var events = json.putArray("events");
        for (final var entry : this.journal.after(after)) {
            final var event = entry.getEvent();
            final var item = events.addObject();
            item.put("sequence", entry.getSequence());
            item.put("type", event.getKind().name().toLowerCase(Locale.ROOT));
            item.put("slot_id", event.getSlotId().toString());
            item.put("ticket", event.getTicketId().toString());
            event.getFee().ifPresent(fee -> item.put("fee", fee));
            item.put("timestamp", event.getTimestamp().toString());
        }
        this.respond(request, 200, json);
    }

    private ObjectNode slotJson(final SlotView slot) {
        final var json = this.mapper.createObjectNode();
        json.put("id", slot.getId().toString());
        json.put("level", slot.getLevel());
        json.put("size", name(slot.getSize()));
        json.put("section", name(slot.getSection()));
        json.put("status", name(slot.getStatus()));
        json.put("is_ev", slot.getSection() == Section.EV);
        if (slot.getTicketId().isPresent()) {
            json.put("ticket", slot.getTicketId().get().toString());
        } else {
            json.putNull("ticket");
        }
        return json;
    }

    /**
     * Renders a ticket; the engine hands out snapshots, so state and settlement agree.
     */
    private ObjectNode ticketJson(final Ticket ticket) {
        final var json = this.mapper.createObjectNode();
        json.put("ticket", ticket.getId().toString());
        json.put("state", name(ticket.getState()));
        json.put("slot_id", ticket.getSlotId().toString());
        json.put("license_plate", ticket.getPlate());
        json.put("vehicle_type", name(ticket.getSize()));
        json.put("customer_type", name(ticket.getCustomerType()));
        json.put("is_ev", ticket.isEv());
        json.put("allocation_time", ticket.getEntryTime().toString());
        json.put("expiry_time", ticket.getDeadline().toString());
        ticket.getReleasedAt().ifPresent(at -> json.put("release_time", at.toString()));
        ticket.getFee().ifPresent(fee -> json.put("fee", fee));
        return json;
    }

    private static TicketId parseTicketId(final String text) throws ParkingException {
        if (text == null || text.isBlank()) {
            throw ParkingException.invalidRequest("Ticket ID is required");
        }
        return TicketId.parse(text).orElseThrow(() -> new ParkingException(ParkingException.Kind.INVALID_TICKET,
                String.format("Ticket %s does not exist", text.trim())));
    }

    private static String name(final Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }

    private <T> T readBody(final Request request, final Class<T> type) throws ParkingException {
        final var body = request.readBody()
                .orElseThrow(() -> ParkingException.invalidRequest("Request body is required"));
        try {
            final var value = this.mapper.readValue(body, type);
            if (value == null) {
                throw ParkingException.invalidRequest("Request body is required");
            }
            return value;
        } catch (JsonProcessingException error) {
            throw ParkingException.invalidRequest("Malformed request body: " + error.getOriginalMessage());
        }
    }

    private void respond(final Request request, final int status, final JsonNode json) {
        try {
            request.respondWithJson(status, this.mapper.writeValueAsString(json));
        } catch (JsonProcessingException error) {
            throw new IllegalStateException("Cannot serialize response", error);
        }
    }

    private void respondWithError(final Request request, final int status, final String kind,
            final String message) {
        final var json = this.mapper.createObjectNode();
        json.put("error", kind);
        json.put("message", message);
        json.put("timestamp", this.engine.now().toString());
        this.respond(request, status, json);
    }
}
