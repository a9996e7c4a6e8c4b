package org.squadplanner.simulation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered list of task slots making up a lineup: exactly eleven, one of them goalkeeper-kind.
 */
public final class Formation {

    public static final int REQUIRED_SLOTS = 11;

    private final String name;
    private final List<TaskSlot> slots;

    public Formation(String name, List<TaskSlot> slots) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.slots = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(slots, "slots must not be null")));
        validate();
    }

    private void validate() {
        if (slots.size() != REQUIRED_SLOTS) {
            throw new ValidationException(
                    "formation " + name + " must have " + REQUIRED_SLOTS + " slots but has " + slots.size(), name);
        }
        Set<String> ids = new HashSet<>();
        int goalkeepers = 0;
        for (TaskSlot slot : slots) {
            if (!ids.add(slot.getId())) {
                throw new ValidationException("duplicate slot id " + slot.getId() + " in formation " + name,
                        name, slot.getId());
            }
            if (slot.isGoalkeeper()) {
                goalkeepers++;
            }
        }
        if (goalkeepers != 1) {
            throw new ValidationException(
                    "formation " + name + " must have exactly one goalkeeper slot but has " + goalkeepers, name);
        }
    }

    public String getName() {
        return name;
    }

    public List<TaskSlot> getSlots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public Optional<TaskSlot> findSlot(String slotId) {
        return slots.stream().filter(s -> s.getId().equals(slotId)).findFirst();
    }

    public int indexOf(String slotId) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).getId().equals(slotId)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "Formation{" + name + ", " + slots + "}";
    }
}
