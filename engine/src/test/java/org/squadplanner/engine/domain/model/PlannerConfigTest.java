package org.squadplanner.engine.domain.model;

import org.junit.jupiter.api.Test;
import org.squadplanner.simulation.engine.PropagationParameters;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.LoadCategory;
import org.squadplanner.simulation.model.ValidationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlannerConfigTest {

    @Test
    void defaultsAreConsistent() {
        PlannerConfig config = PlannerConfig.defaults();

        assertEquals(3, config.getHorizonLength());
        assertEquals(0.85, config.getDiscountFactor(), 1e-12);
        assertEquals(0.75, config.getReadinessFloor(), 1e-12);
        assertEquals(1.0, config.getLoadMultiplier(LoadCategory.FRESH), 1e-12);
        assertTrue(config.getImportanceWeight(Importance.HIGH) > config.getImportanceWeight(Importance.LOW));
        assertTrue(config.getShadowScale(Importance.HIGH) < config.getShadowScale(Importance.LOW));
        for (Importance importance : Importance.values()) {
            assertNotNull(config.getReadinessCurve(importance));
            assertNotNull(config.getSharpnessCurve(importance));
        }
    }

    @Test
    void valuesOverrideDefaultsKeyByKey() {
        Map<String, Double> values = new HashMap<>();
        values.put(PlannerConfig.DISCOUNT_FACTOR, 0.5);
        values.put(PlannerConfig.key(PlannerConfig.IMPORTANCE_WEIGHT, Importance.LOW), 0.1);

        PlannerConfig config = PlannerConfig.fromMap(values);

        assertEquals(0.5, config.getDiscountFactor(), 1e-12);
        assertEquals(0.1, config.getImportanceWeight(Importance.LOW), 1e-12);
        assertEquals(3, config.getHorizonLength());
        assertEquals(42.0, config.getOrDefault("no_such_key", 42.0));
        assertThrows(IllegalArgumentException.class, () -> config.get("no_such_key"));
    }

    @Test
    void curveSpecsReplaceDefaultCurves() {
        Map<String, CurveSpec> curves = new HashMap<>();
        curves.put(PlannerConfig.key(PlannerConfig.READINESS_CURVE, Importance.HIGH),
                CurveSpec.linear(0.5, 0.9, 0.1));

        PlannerConfig config = PlannerConfig.fromMap(Collections.emptyMap(), curves);

        assertEquals(0.1, config.getReadinessCurve(Importance.HIGH).apply(0.4), 1e-12);
        assertTrue(config.getReadinessCurve(Importance.LOW) instanceof LogisticCurve);
    }

    @Test
    void invalidParametersAreRejected() {
        assertThrows(ValidationException.class,
                () -> PlannerConfig.fromMap(Collections.singletonMap(PlannerConfig.DISCOUNT_FACTOR, 1.0)));
        assertThrows(ValidationException.class,
                () -> PlannerConfig.fromMap(Collections.singletonMap(PlannerConfig.FAMILIARITY_GAP_PENALTY, 0.8)));
        assertThrows(ValidationException.class, () -> PlannerConfig.fromMap(
                Collections.singletonMap(PlannerConfig.key(PlannerConfig.LOAD_MULTIPLIER, LoadCategory.JADED), 1.0)));
        assertThrows(ValidationException.class,
                () -> PlannerConfig.fromMap(Collections.singletonMap(PlannerConfig.FORBIDDEN_COST, -1.0)));
    }

    @Test
    void negativeWeightsAreRejected() {
        String[] keys = {
                PlannerConfig.SCARCITY_WEIGHT,
                PlannerConfig.STABILITY_WEIGHT,
                PlannerConfig.CONTINUITY_BONUS,
                PlannerConfig.SWITCH_COST,
                PlannerConfig.ANCHOR_THRESHOLD,
                PlannerConfig.ANCHOR_MULTIPLIER,
                PlannerConfig.key(PlannerConfig.IMPORTANCE_WEIGHT, Importance.HIGH),
                PlannerConfig.key(PlannerConfig.SHADOW_SCALE, Importance.LOW),
                PlannerConfig.key(PlannerConfig.RELIEF_WEIGHT, Importance.MEDIUM),
                PlannerConfig.key(PlannerConfig.NEED_WEIGHT, Importance.SHARPNESS)
        };
        for (String key : keys) {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> PlannerConfig.fromMap(Collections.singletonMap(key, -5.0)), key);
            assertTrue(e.getMessage().contains(key), e.getMessage());
        }
        assertEquals(0.0, PlannerConfig.fromMap(
                Collections.singletonMap(PlannerConfig.SCARCITY_WEIGHT, 0.0)).getScarcityWeight(), 0.0);
    }

    @Test
    void countsMustBeWholeNumbers() {
        for (String key : new String[] {PlannerConfig.HORIZON_LENGTH, PlannerConfig.DEFAULT_MINUTES,
                PlannerConfig.FINAL_REST_DAYS, PlannerConfig.ANCHOR_THRESHOLD, PlannerConfig.LOAD_WINDOW_DAYS}) {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> PlannerConfig.fromMap(Collections.singletonMap(key, 2.7)), key);
            assertEquals(Collections.singletonList(key), e.getOffendingIds());
        }
        assertThrows(ValidationException.class, () -> PlannerConfig.fromMap(
                Collections.singletonMap(PlannerConfig.HORIZON_LENGTH, Double.POSITIVE_INFINITY)));

        PlannerConfig whole = PlannerConfig.fromMap(
                Collections.singletonMap(PlannerConfig.HORIZON_LENGTH, (double) Integer.MAX_VALUE));
        assertEquals(Integer.MAX_VALUE, whole.getHorizonLength());
    }

    @Test
    void dynamicsKeysFlowIntoPropagationParameters() {
        Map<String, Double> values = new HashMap<>();
        values.put(PlannerConfig.DAILY_RECOVERY, 0.04);
        values.put(PlannerConfig.LOAD_WINDOW_DAYS, 10.0);

        PropagationParameters params = PlannerConfig.fromMap(values).toPropagationParameters();

        assertEquals(0.04, params.getDailyRecovery(), 1e-12);
        assertEquals(10, params.getWindowDays());
        assertEquals(PropagationParameters.defaults().getReadinessLossPer90(), params.getReadinessLossPer90(), 1e-12);
    }
}
