package org.squadplanner.simulation.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormationTest {

    private static List<TaskSlot> outfield(int count) {
        List<TaskSlot> slots = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            slots.add(TaskSlot.of("S" + i, "M(C)"));
        }
        return slots;
    }

    @Test
    void acceptsElevenSlotsWithOneGoalkeeper() {
        List<TaskSlot> slots = outfield(10);
        slots.add(0, TaskSlot.goalkeeper("GK", "GK"));

        Formation f = new Formation("test", slots);

        assertEquals(11, f.size());
        assertEquals(0, f.indexOf("GK"));
        assertTrue(f.findSlot("S3").isPresent());
        assertEquals(-1, f.indexOf("nope"));
    }

    @Test
    void rejectsWrongSize() {
        List<TaskSlot> slots = outfield(9);
        slots.add(TaskSlot.goalkeeper("GK", "GK"));

        assertThrows(ValidationException.class, () -> new Formation("ten", slots));
    }

    @Test
    void rejectsMissingGoalkeeper() {
        assertThrows(ValidationException.class, () -> new Formation("no-keeper", outfield(11)));
    }

    @Test
    void rejectsDuplicateSlotIds() {
        List<TaskSlot> slots = outfield(9);
        slots.add(TaskSlot.of("S1", "ST"));
        slots.add(TaskSlot.goalkeeper("GK", "GK"));

        ValidationException e = assertThrows(ValidationException.class, () -> new Formation("dup", slots));
        assertTrue(e.getOffendingIds().contains("S1"));
    }
}
