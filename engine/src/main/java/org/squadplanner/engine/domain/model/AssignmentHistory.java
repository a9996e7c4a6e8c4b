package org.squadplanner.engine.domain.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Per-worker sequence of slots held at past events, {@code null} where the worker rested.
 * Immutable; {@link #record} returns a new history.
 */
public final class AssignmentHistory {

    private static final AssignmentHistory EMPTY = new AssignmentHistory(Collections.emptyMap());

    private final Map<String, List<String>> slotsByWorker;

    private AssignmentHistory(Map<String, List<String>> slotsByWorker) {
        Map<String, List<String>> copy = new HashMap<>();
        slotsByWorker.forEach((id, slots) -> copy.put(id, Collections.unmodifiableList(new ArrayList<>(slots))));
        this.slotsByWorker = Collections.unmodifiableMap(copy);
    }

    public static AssignmentHistory empty() {
        return EMPTY;
    }

    /**
     * Seeds the history with the lineup of the event played before the horizon starts.
     *
     * @param previousSlots worker id to slot id
     */
    public static AssignmentHistory fromPrevious(Map<String, String> previousSlots) {
        Objects.requireNonNull(previousSlots, "previousSlots must not be null");
        Map<String, List<String>> seeded = new HashMap<>();
        previousSlots.forEach((workerId, slotId) -> seeded.put(workerId, Collections.singletonList(slotId)));
        return new AssignmentHistory(seeded);
    }

    /**
     * Appends one event: starters get their slot, every other listed worker a rest entry.
     */
    public AssignmentHistory record(Assignment assignment, Collection<String> workerIds) {
        Map<String, List<String>> next = new HashMap<>(slotsByWorker);
        for (String workerId : workerIds) {
            List<String> slots = new ArrayList<>(next.getOrDefault(workerId, Collections.emptyList()));
            slots.add(assignment.findByWorker(workerId).map(s -> s.getSlot().getId()).orElse(null));
            next.put(workerId, slots);
        }
        return new AssignmentHistory(next);
    }

    /**
     * Slot held at the immediately preceding event; empty if the worker rested or has no history.
     */
    public Optional<String> previousSlot(String workerId) {
        List<String> slots = slotsByWorker.get(workerId);
        if (slots == null || slots.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(slots.get(slots.size() - 1));
    }

    /**
     * Number of most recent consecutive events in which the worker held {@code slotId}.
     */
    public int consecutiveInSlot(String workerId, String slotId) {
        List<String> slots = slotsByWorker.getOrDefault(workerId, Collections.emptyList());
        int count = 0;
        for (int i = slots.size() - 1; i >= 0 && slotId.equals(slots.get(i)); i--) {
            count++;
        }
        return count;
    }

    public List<String> getSlots(String workerId) {
        return slotsByWorker.getOrDefault(workerId, Collections.emptyList());
    }

    @Override
    public String toString() {
        return "AssignmentHistory" + slotsByWorker;
    }
}
