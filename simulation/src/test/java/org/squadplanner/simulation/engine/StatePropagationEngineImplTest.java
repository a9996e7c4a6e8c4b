package org.squadplanner.simulation.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.squadplanner.simulation.model.Appearance;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.LoadCategory;
import org.squadplanner.simulation.model.TrainingIntensity;
import org.squadplanner.simulation.model.ValidationException;
import org.squadplanner.simulation.model.Worker;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class StatePropagationEngineImplTest {

    private final StatePropagationEngineImpl engine = new StatePropagationEngineImpl();

    private static Worker.Builder worker(String id) {
        return new Worker.Builder().id(id).natural("M(C)", 150);
    }

    @Test
    @DisplayName("resting zero days returns the identical state")
    void restZeroDaysIsIdentity() {
        Worker w = worker("w1")
                .readiness(0.83)
                .sharpness(0.41)
                .consecutiveAppearances(2)
                .appearances(Arrays.asList(new Appearance(3, 90), new Appearance(6, 90)))
                .load(LoadCategory.FIT)
                .build();

        assertSame(w, engine.rest(w, 0));
        assertEquals(w, engine.propagate(w, Participation.rested(), 0));
    }

    @Test
    void playingLowersReadinessAndRaisesSharpness() {
        Worker w = worker("w1").readiness(0.95).sharpness(0.6).build();

        Worker after = engine.propagate(w, Participation.played(90, Importance.MEDIUM, "M(C)"), 0);

        assertEquals(0.95 - 0.28, after.getReadiness(), 1e-9);
        assertEquals(0.6 + 0.08, after.getSharpness(), 1e-9);
        assertEquals(1, after.getConsecutiveAppearances());
        assertEquals(90, after.getWindowMinutes());
        assertEquals(0, after.getDaysSinceLastAppearance());
    }

    @Test
    void readinessLossGrowsWithMinutesAndIntensity() {
        Worker w = worker("w1").readiness(1.0).build();

        double half = engine.propagate(w, Participation.played(45, Importance.MEDIUM, "M(C)"), 0).getReadiness();
        double full = engine.propagate(w, Participation.played(90, Importance.MEDIUM, "M(C)"), 0).getReadiness();
        double fullHigh = engine.propagate(w, Participation.played(90, Importance.HIGH, "M(C)"), 0).getReadiness();

        assertTrue(half > full);
        assertTrue(full > fullHigh);
    }

    @Test
    void lowStaminaAndRunningTasksTireFaster() {
        Worker strong = worker("strong").stamina(18).build();
        Worker weak = worker("weak").stamina(4).build();
        Participation midfield = Participation.played(90, Importance.MEDIUM, "M(C)");

        assertTrue(engine.propagate(weak, midfield, 0).getReadiness()
                < engine.propagate(strong, midfield, 0).getReadiness());

        double keeper = engine.propagate(strong, Participation.played(90, Importance.MEDIUM, "GK"), 0).getReadiness();
        double fullBack = engine.propagate(strong, Participation.played(90, Importance.MEDIUM, "D(L)"), 0).getReadiness();
        assertTrue(keeper > fullBack);
    }

    @Test
    void competitiveEventsSharpenFaster() {
        Worker w = worker("w1").sharpness(0.3).build();

        double high = engine.propagate(w, Participation.played(90, Importance.HIGH, "M(C)"), 0).getSharpness();
        double low = engine.propagate(w, Participation.played(90, Importance.LOW, "M(C)"), 0).getSharpness();

        assertTrue(high > low);
    }

    @Test
    void restRecoversReadinessAndDecaysSharpness() {
        Worker w = worker("w1").readiness(0.6).sharpness(0.8).consecutiveAppearances(3).build();

        Worker after = engine.rest(w, 3);

        assertEquals(0.6 + 3 * 0.05, after.getReadiness(), 1e-9);
        assertEquals(0.8 - 3 * 0.008, after.getSharpness(), 1e-9);
        assertEquals(0, after.getConsecutiveAppearances());
    }

    @Test
    void olderWorkersAndHardTrainingRecoverSlower() {
        Worker young = worker("young").age(24).readiness(0.5).build();
        Worker veteran = worker("veteran").age(33).readiness(0.5).build();
        Worker drilled = worker("drilled").age(24).trainingIntensity(TrainingIntensity.HIGH).readiness(0.5).build();

        double youngGain = engine.rest(young, 2).getReadiness();
        assertTrue(engine.rest(veteran, 2).getReadiness() < youngGain);
        assertTrue(engine.rest(drilled, 2).getReadiness() < youngGain);
    }

    @Test
    void valuesStayWithinBounds() {
        Worker tired = worker("tired").readiness(0.05).sharpness(0.99).stamina(1).build();

        Worker played = engine.propagate(tired, Participation.played(90, Importance.HIGH, "D(L)"), 0);
        assertEquals(0.0, played.getReadiness());
        assertEquals(1.0, played.getSharpness());

        Worker rested = engine.rest(played, 60);
        assertEquals(1.0, rested.getReadiness());
        assertEquals(0.52, rested.getSharpness(), 1e-9);

        assertEquals(0.0, engine.rest(rested, 200).getSharpness());
    }

    @Test
    void rollingWindowAgesOutOldMinutes() {
        Worker w = worker("w1")
                .appearances(Arrays.asList(new Appearance(2, 90), new Appearance(12, 90)))
                .build();

        Worker after = engine.rest(w, 3);

        assertEquals(1, after.getAppearances().size());
        assertEquals(new Appearance(5, 90), after.getAppearances().get(0));
        assertEquals(90, after.getWindowMinutes());
    }

    @Test
    void playedThenElapsedKeepsTheAppearanceStreak() {
        Worker w = worker("w1").consecutiveAppearances(1).build();

        Worker after = engine.propagate(w, Participation.played(90, Importance.MEDIUM, "M(C)"), 3);

        assertEquals(2, after.getConsecutiveAppearances());
        assertEquals(3, after.getDaysSinceLastAppearance());
    }

    @Test
    void loadCategoryFollowsWindowMinutes() {
        assertEquals(LoadCategory.FRESH, engine.classifyLoad(worker("a").build()));
        assertEquals(LoadCategory.FIT, engine.classifyLoad(worker("b")
                .appearances(Arrays.asList(new Appearance(1, 90), new Appearance(4, 90), new Appearance(7, 90)))
                .build()));
        assertEquals(LoadCategory.TIRED, engine.classifyLoad(worker("c")
                .appearances(Arrays.asList(new Appearance(1, 90), new Appearance(4, 90),
                        new Appearance(7, 90), new Appearance(10, 90)))
                .build()));
    }

    @Test
    @DisplayName("overload across a streak turns a worker jaded and one rest day does not clear it")
    void jadednessIsSticky() {
        Worker w = worker("w1").appearances(Arrays.asList(
                new Appearance(2, 90), new Appearance(4, 90), new Appearance(6, 90),
                new Appearance(8, 90), new Appearance(10, 90)))
                .consecutiveAppearances(5)
                .build();

        Worker jaded = engine.propagate(w, Participation.played(90, Importance.MEDIUM, "M(C)"), 0);
        assertEquals(LoadCategory.JADED, jaded.getLoad());

        Worker oneDay = engine.rest(jaded, 1);
        assertEquals(LoadCategory.JADED, oneDay.getLoad());

        Worker cleared = engine.rest(oneDay, 13);
        assertNotEquals(LoadCategory.JADED, cleared.getLoad());
    }

    @Test
    void heavyWindowWithoutStreakIsOnlyTired() {
        Worker w = worker("w1").appearances(Arrays.asList(
                new Appearance(2, 90), new Appearance(4, 90), new Appearance(6, 90),
                new Appearance(8, 90), new Appearance(10, 90), new Appearance(12, 90)))
                .consecutiveAppearances(0)
                .build();

        assertEquals(LoadCategory.TIRED, engine.classifyLoad(w));
    }

    @Test
    void propagationIsDeterministic() {
        Worker w = worker("w1").readiness(0.77).sharpness(0.5).build();
        Participation p = Participation.played(70, Importance.LOW, "ST");

        assertEquals(engine.propagate(w, p, 4), engine.propagate(w, p, 4));
    }

    @Test
    @DisplayName("recovery after a full appearance terminates in a bounded number of days")
    void playThenRecoverTerminates() {
        for (int nf = 1; nf <= 20; nf++) {
            for (int age : new int[] {17, 25, 31, 36}) {
                Worker before = worker("w" + nf).naturalFitness(nf).age(age).readiness(0.98).build();
                Worker after = engine.propagate(before, Participation.played(90, Importance.HIGH, "D(R)"), 0);

                int days = engine.daysToRecover(after, 0.999 * before.getReadiness());

                assertTrue(days > 0 && days <= engine.getParameters().getMaxRecoveryDays());
                assertTrue(engine.rest(after, days).getReadiness() >= 0.999 * before.getReadiness());
            }
        }
    }

    @Test
    void daysToRecoverIsZeroWhenAlreadyReady() {
        assertEquals(0, engine.daysToRecover(worker("w1").readiness(0.9).build(), 0.85));
    }

    @Test
    void daysToRecoverFailsWithoutRecovery() {
        StatePropagationEngineImpl stalled = new StatePropagationEngineImpl(
                PropagationParameters.builder().dailyRecovery(0.0).build());
        Worker w = worker("w1").readiness(0.5).build();

        ValidationException e = assertThrows(ValidationException.class, () -> stalled.daysToRecover(w, 0.9));
        assertEquals(Collections.singletonList("w1"), e.getOffendingIds());
    }

    @Test
    void negativeElapsedDaysAreRejected() {
        Worker w = worker("w1").build();

        assertThrows(ValidationException.class, () -> engine.rest(w, -1));
        assertThrows(ValidationException.class, () -> engine.daysToRecover(w, 1.5));
    }
}
