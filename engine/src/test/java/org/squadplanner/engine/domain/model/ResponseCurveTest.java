package org.squadplanner.engine.domain.model;

import org.junit.jupiter.api.Test;
import org.squadplanner.simulation.model.ValidationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCurveTest {

    @Test
    void logisticRunsFromFloorToOne() {
        LogisticCurve curve = new LogisticCurve(0.85, 20, 0.25);

        assertEquals(0.25, curve.apply(0.0), 1e-9);
        assertEquals(1.0, curve.apply(1.0), 1e-9);
        assertEquals(0.25, curve.apply(-3.0), 1e-9);
        assertEquals(1.0, curve.apply(7.0), 1e-9);
        assertTrue(curve.apply(0.85) > 0.25 && curve.apply(0.85) < 1.0);
    }

    @Test
    void everyCurveKindIsMonotone() {
        ResponseCurve[] curves = {
                new LogisticCurve(0.7, 12, 0.3),
                new LinearCurve(0.5, 0.9, 0.1),
                new PiecewiseLinearCurve(new double[]{0.0, 0.6, 0.8, 1.0}, new double[]{0.2, 0.3, 0.9, 1.0})
        };
        for (ResponseCurve curve : curves) {
            double previous = -1;
            for (int i = 0; i <= 100; i++) {
                double y = curve.apply(i / 100.0);
                assertTrue(y >= previous - 1e-12, curve + " at " + i);
                assertTrue(y >= curve.floor() - 1e-12 && y <= 1.0 + 1e-12);
                previous = y;
            }
        }
    }

    @Test
    void linearIsFlatOutsideItsRamp() {
        LinearCurve curve = new LinearCurve(0.5, 0.9, 0.1);

        assertEquals(0.1, curve.apply(0.3), 1e-12);
        assertEquals(0.55, curve.apply(0.7), 1e-12);
        assertEquals(1.0, curve.apply(0.95), 1e-12);
    }

    @Test
    void piecewiseInterpolatesBetweenBreakpoints() {
        PiecewiseLinearCurve curve = new PiecewiseLinearCurve(new double[]{0.0, 0.5, 1.0}, new double[]{0.2, 0.4, 1.0});

        assertEquals(0.3, curve.apply(0.25), 1e-12);
        assertEquals(0.7, curve.apply(0.75), 1e-12);
        assertEquals(0.2, curve.floor());
    }

    @Test
    void invalidCurvesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new LogisticCurve(0.5, 0, 0.2));
        assertThrows(IllegalArgumentException.class, () -> new LinearCurve(0.9, 0.5, 0.2));
        assertThrows(IllegalArgumentException.class,
                () -> new PiecewiseLinearCurve(new double[]{0.0, 1.0}, new double[]{0.8, 0.4}));
    }

    @Test
    void curveSpecBuildsTheDescribedCurve() {
        ResponseCurve curve = CurveSpec.piecewise(new double[]{0.0, 1.0}, new double[]{0.5, 1.0}).toCurve("test");

        assertEquals(0.75, curve.apply(0.5), 1e-12);
        assertEquals(CurveKind.LOGISTIC, CurveSpec.logistic(0.8, 10, 0.2).getKind());
    }

    @Test
    void curveSpecWithMissingOrInvalidParametersFailsValidation() {
        Map<String, Double> partial = new HashMap<>();
        partial.put("midpoint", 0.8);

        ValidationException missing = assertThrows(ValidationException.class,
                () -> new CurveSpec(CurveKind.LOGISTIC, partial).toCurve("readiness_high"));
        assertTrue(missing.getMessage().contains("steepness"));
        assertEquals(Collections.singletonList("readiness_high"), missing.getOffendingIds());

        assertThrows(ValidationException.class, () -> CurveSpec.linear(0.9, 0.1, 0.5).toCurve("sharpness_low"));
    }
}
