package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.model.Importance;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable lineup for one event: every slot filled once, everyone else rested.
 */
public final class Assignment {

    private final String eventId;
    private final Importance importance;
    private final List<SlotAssignment> slots;
    private final Set<String> restedWorkerIds;
    private final Map<String, Double> shadowPrices;
    private final List<String> relaxations;
    private final double totalCost;

    public Assignment(String eventId, Importance importance, List<SlotAssignment> slots,
                      Set<String> restedWorkerIds, Map<String, Double> shadowPrices,
                      List<String> relaxations, double totalCost) {
        this.eventId = Objects.requireNonNull(eventId, "eventId must not be null");
        this.importance = Objects.requireNonNull(importance, "importance must not be null");
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
        this.restedWorkerIds = Collections.unmodifiableSet(new LinkedHashSet<>(restedWorkerIds));
        this.shadowPrices = Collections.unmodifiableMap(new LinkedHashMap<>(shadowPrices));
        this.relaxations = Collections.unmodifiableList(new ArrayList<>(relaxations));
        this.totalCost = totalCost;
    }

    public String getEventId() {
        return eventId;
    }

    public Importance getImportance() {
        return importance;
    }

    /**
     * Filled slots in formation order.
     */
    public List<SlotAssignment> getSlots() {
        return slots;
    }

    public Set<String> getRestedWorkerIds() {
        return restedWorkerIds;
    }

    /**
     * Shadow price of every worker at this event, before importance scaling.
     */
    public Map<String, Double> getShadowPrices() {
        return shadowPrices;
    }

    public List<String> getRelaxations() {
        return relaxations;
    }

    public double getTotalCost() {
        return totalCost;
    }

    public double getTotalGss() {
        double total = 0;
        for (SlotAssignment s : slots) {
            total += s.getScore().getGss();
        }
        return total;
    }

    public Optional<SlotAssignment> findByWorker(String workerId) {
        return slots.stream().filter(s -> s.getWorkerId().equals(workerId)).findFirst();
    }

    public Optional<SlotAssignment> findBySlot(String slotId) {
        return slots.stream().filter(s -> s.getSlot().getId().equals(slotId)).findFirst();
    }

    public boolean isStarting(String workerId) {
        return findByWorker(workerId).isPresent();
    }

    /**
     * Slot id to worker id, in formation order.
     */
    public Map<String, String> toLineup() {
        Map<String, String> lineup = new LinkedHashMap<>();
        for (SlotAssignment s : slots) {
            lineup.put(s.getSlot().getId(), s.getWorkerId());
        }
        return lineup;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Assignment)) {
            return false;
        }
        Assignment that = (Assignment) o;
        return eventId.equals(that.eventId)
                && slots.equals(that.slots)
                && restedWorkerIds.equals(that.restedWorkerIds)
                && Double.compare(totalCost, that.totalCost) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, slots, restedWorkerIds, totalCost);
    }

    @Override
    public String toString() {
        return String.format("Assignment{%s, %s, gss=%.1f, lineup=%s}", eventId, importance, getTotalGss(), toLineup());
    }
}
