package org.squadplanner.engine.domain.service;

import org.junit.jupiter.api.Test;
import org.squadplanner.engine.SquadFixtures;
import org.squadplanner.engine.domain.error.ConstraintConflictException;
import org.squadplanner.simulation.model.ConstraintSet;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Formation;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.ValidationException;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintValidatorTest {

    private final ConstraintValidator validator = new ConstraintValidator();
    private final Formation formation = SquadFixtures.fourFourTwo();
    private final List<Worker> squad = SquadFixtures.squad(formation, 150, 130);

    private Event event(ConstraintSet constraints) {
        return SquadFixtures.event("e0", 0, Importance.HIGH, formation, constraints);
    }

    @Test
    void consistentConstraintsPass() {
        ConstraintSet constraints = ConstraintSet.builder()
                .lock("ML-1", "ML")
                .reject("ML-0", "MR")
                .forceRest("STL-0")
                .build();

        assertDoesNotThrow(() -> validator.validate(event(constraints), squad));
    }

    @Test
    void lockAndRejectionOnTheSamePairConflict() {
        ConstraintSet constraints = ConstraintSet.builder()
                .lock("ML-0", "ML")
                .reject("ML-0", "ML")
                .build();

        ConstraintConflictException e = assertThrows(ConstraintConflictException.class,
                () -> validator.validate(event(constraints), squad));

        assertEquals("e0", e.getEventId());
        assertEquals(1, e.getConflicts().size());
        assertTrue(e.getConflicts().get(0).contains("rejection"));
    }

    @Test
    void twoLocksOnOneSlotConflict() {
        ConstraintSet constraints = ConstraintSet.builder()
                .lock("ML-0", "ML")
                .lock("ML-1", "ML")
                .build();

        ConstraintConflictException e = assertThrows(ConstraintConflictException.class,
                () -> validator.validate(event(constraints), squad));

        assertTrue(e.getConflicts().get(0).contains("same slot"));
    }

    @Test
    void oneWorkerLockedTwiceConflicts() {
        ConstraintSet constraints = ConstraintSet.builder()
                .lock("ML-0", "ML")
                .lock("ML-0", "MR")
                .build();

        ConstraintConflictException e = assertThrows(ConstraintConflictException.class,
                () -> validator.validate(event(constraints), squad));

        assertTrue(e.getConflicts().get(0).contains("same worker"));
    }

    @Test
    void lockingAWorkerWhoMustRestConflicts() {
        List<Worker> roster = new ArrayList<>(squad);
        roster.set(2, roster.get(2).toBuilder().suspended(true).build());
        String suspended = roster.get(2).getId();

        assertThrows(ConstraintConflictException.class, () -> validator.validate(
                event(ConstraintSet.builder().lock(suspended, "DL").build()), roster));
        assertThrows(ConstraintConflictException.class, () -> validator.validate(
                event(ConstraintSet.builder().lock("ML-0", "ML").forceRest("ML-0").build()), squad));
    }

    @Test
    void unknownIdentifiersFailValidationWithTheOffendingIds() {
        ValidationException unknownWorker = assertThrows(ValidationException.class,
                () -> validator.validate(event(ConstraintSet.builder().forceRest("nobody").build()), squad));
        assertTrue(unknownWorker.getOffendingIds().contains("nobody"));

        ValidationException unknownSlot = assertThrows(ValidationException.class,
                () -> validator.validate(event(ConstraintSet.builder().reject("ML-0", "AMC").build()), squad));
        assertTrue(unknownSlot.getOffendingIds().contains("AMC"));
    }

    @Test
    void duplicateWorkerIdsFailValidation() {
        List<Worker> roster = new ArrayList<>(squad);
        roster.add(squad.get(0));

        assertThrows(ValidationException.class, () -> validator.validate(event(ConstraintSet.empty()), roster));
    }
}
