package com.parkwise.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * <p>
 * Decides which free slot serves a request.
 * </p>
 *
 * <p>
 * The policy is a pure function of the request and the current slot
 * snapshots. Candidates are all free slots the vehicle fits into. They are
 * ranked by
 * </p>
 *
 * <ol>
 * <li>the position of their section in the request's section order,</li>
 * <li>how much larger than the vehicle they are (exact fits first),</li>
 * <li>their level, and</li>
 * <li>their index on the level.</li>
 * </ol>
 *
 * <p>
 * The section order starts with the preferred section (EV for electric
 * vehicles, VIP for VIP customers, REGULAR otherwise) followed by the
 * remaining sections in the fallback order EV, VIP, REGULAR.
 * </p>
 */
public class AllocationPolicy {
    private static final Logger LOGGER = Logger.getLogger(AllocationPolicy.class.getName());

    /**
     * Order in which sections are tried once the preferred one is exhausted.
     */
    static final List<Section> FALLBACK_ORDER = List.of(Section.EV, Section.VIP, Section.REGULAR);

    /**
     * Section order by preferred section.
     */
    private static final Map<Section, List<Section>> SECTION_ORDERS = new EnumMap<>(Section.class);

    static {
        for (final var preferred : Section.values()) {
            final var order = new ArrayList<Section>();
            order.add(preferred);
            for (final var fallback : FALLBACK_ORDER) {
                if (fallback != preferred) {
                    order.add(fallback);
                }
            }
            SECTION_ORDERS.put(preferred, Collections.unmodifiableList(order));
        }
    }

    /**
     * Returns the section a request should be served from first.
     *
     * @param request     The request.
     * @param vipEntitled Whether the customer is entitled to the VIP section.
     * @return The preferred section.
     */
    public Section preferredSection(final AllocationRequest request, final boolean vipEntitled) {
        if (request.isEv()) {
            return Section.EV;
        }
        if (vipEntitled) {
            return Section.VIP;
        }
        return Section.REGULAR;
    }

    /**
     * Returns the order in which sections are tried for a request.
     *
     * @param request     The request.
     * @param vipEntitled Whether the customer is entitled to the VIP section.
     * @return Every section exactly once, preferred section first.
     */
    public List<Section> sectionOrder(final AllocationRequest request, final boolean vipEntitled) {
        return SECTION_ORDERS.get(this.preferredSection(request, vipEntitled));
    }

    /**
     * Selects the best-ranked free slot for a request.
     *
     * @param request     The request.
     * @param vipEntitled Whether the customer is entitled to the VIP section.
     * @param slots       Snapshots of the slots to choose from.
     * @return The selected slot or an empty {@link Optional} if no slot fits.
     */
    public Optional<SlotId> selectSlot(final AllocationRequest request, final boolean vipEntitled,
            final Iterable<SlotView> slots) {
        final var order = this.sectionOrder(request, vipEntitled);
        final var size = request.getSize();
        final Comparator<SlotView> ranking = Comparator
                .comparingInt((SlotView slot) -> order.indexOf(slot.getSection()))
                .thenComparingInt(slot -> size.oversizeIn(slot.getSize()))
                .thenComparing(SlotView::getId);
        SlotView best = null;
        for (final var slot : slots) {
            if (!slot.isFree() || !size.fits(slot.getSize())) {
                continue;
            }
            if (best == null || ranking.compare(slot, best) < 0) {
                best = slot;
            }
        }
        if (best == null) {
            LOGGER.fine(() -> String.format("No candidate slot for %s (order %s)", request, order));
            return Optional.empty();
        }
        final var chosen = best;
        LOGGER.fine(() -> String.format("Selected %s in %s for %s (order %s)", chosen.getId(), chosen.getSection(),
                request, order));
        return Optional.of(chosen.getId());
    }
}
