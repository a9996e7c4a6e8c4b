package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.model.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Serializable description of a response curve: a kind plus named parameters.
 *
 * LOGISTIC:         midpoint, steepness, floor
 * LINEAR:           lower, upper, floor
 * PIECEWISE_LINEAR: x0, y0, x1, y1, ... in order
 */
public final class CurveSpec {

    private final CurveKind kind;
    private final Map<String, Double> parameters;

    public CurveSpec(CurveKind kind, Map<String, Double> parameters) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.parameters = Collections.unmodifiableMap(
                new HashMap<>(Objects.requireNonNull(parameters, "parameters must not be null")));
    }

    public static CurveSpec logistic(double midpoint, double steepness, double floor) {
        Map<String, Double> p = new HashMap<>();
        p.put("midpoint", midpoint);
        p.put("steepness", steepness);
        p.put("floor", floor);
        return new CurveSpec(CurveKind.LOGISTIC, p);
    }

    public static CurveSpec linear(double lower, double upper, double floor) {
        Map<String, Double> p = new HashMap<>();
        p.put("lower", lower);
        p.put("upper", upper);
        p.put("floor", floor);
        return new CurveSpec(CurveKind.LINEAR, p);
    }

    public static CurveSpec piecewise(double[] xs, double[] ys) {
        Map<String, Double> p = new HashMap<>();
        for (int i = 0; i < xs.length && i < ys.length; i++) {
            p.put("x" + i, xs[i]);
            p.put("y" + i, ys[i]);
        }
        return new CurveSpec(CurveKind.PIECEWISE_LINEAR, p);
    }

    public CurveKind getKind() {
        return kind;
    }

    public Map<String, Double> getParameters() {
        return parameters;
    }

    /**
     * Builds the curve.
     *
     * @param name used in the error message when parameters are missing or invalid
     * @throws ValidationException when the parameters do not describe a valid curve
     */
    public ResponseCurve toCurve(String name) {
        try {
            switch (kind) {
                case LOGISTIC:
                    return new LogisticCurve(require("midpoint", name), require("steepness", name),
                            require("floor", name));
                case LINEAR:
                    return new LinearCurve(require("lower", name), require("upper", name), require("floor", name));
                case PIECEWISE_LINEAR:
                    return piecewise(name);
                default:
                    throw new ValidationException("unsupported curve kind " + kind, name);
            }
        } catch (IllegalArgumentException e) {
            throw new ValidationException("invalid curve " + name + ": " + e.getMessage(), name);
        }
    }

    private ResponseCurve piecewise(String name) {
        List<Double> xs = new ArrayList<>();
        List<Double> ys = new ArrayList<>();
        for (int i = 0; parameters.containsKey("x" + i); i++) {
            xs.add(parameters.get("x" + i));
            ys.add(require("y" + i, name));
        }
        double[] x = new double[xs.size()];
        double[] y = new double[ys.size()];
        for (int i = 0; i < x.length; i++) {
            x[i] = xs.get(i);
            y[i] = ys.get(i);
        }
        return new PiecewiseLinearCurve(x, y);
    }

    private double require(String key, String name) {
        Double value = parameters.get(key);
        if (value == null || value.isNaN()) {
            throw new ValidationException("curve " + name + " is missing parameter " + key, name);
        }
        return value;
    }

    @Override
    public String toString() {
        return kind + parameters.toString();
    }
}
