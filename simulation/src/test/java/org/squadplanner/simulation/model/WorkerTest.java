package org.squadplanner.simulation.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkerTest {

    @Test
    void outOfRangeStateIsRejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> new Worker.Builder().id("w9").readiness(-0.1).build());
        assertTrue(e.getOffendingIds().contains("w9"));

        assertThrows(ValidationException.class, () -> new Worker.Builder().id("w9").sharpness(1.01).build());
        assertThrows(ValidationException.class, () -> new Worker.Builder().id("w9").stamina(21).build());
        assertThrows(ValidationException.class, () -> new Worker.Builder().id("w9").rating("ST", -5).build());
        assertThrows(ValidationException.class,
                () -> new Worker.Builder().id("w9").familiarity("ST", 1.2, 0.5).build());
    }

    @Test
    void missingTaskDefaultsToZero() {
        Worker w = new Worker.Builder().id("w1").natural("ST", 140).build();

        assertEquals(140, w.getRating("ST"));
        assertEquals(0.0, w.getRating("GK"));
        assertEquals(0.0, w.getInPossessionFamiliarity("GK"));
        assertEquals(1.0, w.getOutOfPossessionFamiliarity("ST"));
    }

    @Test
    void appearancesAreDefensivelyCopied() {
        List<Appearance> source = new ArrayList<>();
        source.add(new Appearance(1, 90));
        Worker w = new Worker.Builder().id("w1").appearances(source).build();

        source.add(new Appearance(2, 90));

        assertEquals(90, w.getWindowMinutes());
        assertThrows(UnsupportedOperationException.class, () -> w.getAppearances().add(new Appearance(0, 1)));
    }

    @Test
    void availabilityReflectsInjuryAndSuspension() {
        assertTrue(new Worker.Builder().id("a").build().isAvailable());
        assertFalse(new Worker.Builder().id("b").injured(true).build().isAvailable());
        assertFalse(new Worker.Builder().id("c").suspended(true).build().isAvailable());
    }

    @Test
    void toBuilderRoundTripsEveryField() {
        Worker w = new Worker.Builder().id("w1").name("Alex").age(31).naturalFitness(14).stamina(7)
                .goalkeeper(true).trainingIntensity(TrainingIntensity.LOW)
                .natural("GK", 130).familiarity("D(C)", 0.3, 0.6)
                .readiness(0.7).sharpness(0.4).load(LoadCategory.TIRED)
                .consecutiveAppearances(2).daysSinceLastAppearance(3).suspended(true)
                .build();

        assertEquals(w, w.toBuilder().build());
    }

    @Test
    void familiarityTiers() {
        assertEquals(FamiliarityTier.NATURAL, FamiliarityTier.of(1.0));
        assertEquals(FamiliarityTier.ACCOMPLISHED, FamiliarityTier.of(0.75));
        assertEquals(FamiliarityTier.COMPETENT, FamiliarityTier.of(0.5));
        assertEquals(FamiliarityTier.UNCONVINCING, FamiliarityTier.of(0.3));
        assertEquals(FamiliarityTier.AWKWARD, FamiliarityTier.of(0.1));
        assertThrows(ValidationException.class, () -> FamiliarityTier.of(-0.2));
    }
}
