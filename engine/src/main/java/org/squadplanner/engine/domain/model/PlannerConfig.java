package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.engine.PropagationParameters;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.LoadCategory;
import org.squadplanner.simulation.model.ValidationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable planner parameters: numeric weights and thresholds plus one readiness and one
 * sharpness curve per importance level. Loaded from a parameter source and cached.
 */
public final class PlannerConfig {

    // Horizon keys
    public static final String HORIZON_LENGTH = "horizon_length";
    public static final String DISCOUNT_FACTOR = "discount_factor";
    public static final String DEFAULT_MINUTES = "default_minutes";
    public static final String FINAL_REST_DAYS = "final_rest_days";

    // Scoring keys
    public static final String READINESS_FLOOR = "readiness_floor";
    public static final String FAMILIARITY_FLOOR = "familiarity_floor";
    public static final String FAMILIARITY_GAP_PENALTY = "familiarity_gap_penalty";
    public static final String LOAD_MULTIPLIER = "load_multiplier";
    public static final String SHARPNESS_BOOST = "sharpness_boost";

    // Shadow pricing keys
    public static final String IMPORTANCE_WEIGHT = "importance_weight";
    public static final String SHADOW_SCALE = "shadow_scale";
    public static final String SCARCITY_WEIGHT = "scarcity_weight";

    // Cost matrix keys
    public static final String STABILITY_WEIGHT = "stability_weight";
    public static final String CONTINUITY_BONUS = "continuity_bonus";
    public static final String SWITCH_COST = "switch_cost";
    public static final String ANCHOR_THRESHOLD = "anchor_threshold";
    public static final String ANCHOR_MULTIPLIER = "anchor_multiplier";
    public static final String REST_UTILITY_WEIGHT = "rest_utility_weight";
    public static final String RELIEF_WEIGHT = "relief_weight";
    public static final String NEED_WEIGHT = "need_weight";
    public static final String FORBIDDEN_COST = "forbidden_cost";

    // Optional state dynamics keys
    public static final String READINESS_LOSS_PER_90 = "readiness_loss_per_90";
    public static final String DAILY_RECOVERY = "daily_recovery";
    public static final String SHARPNESS_GAIN_PER_90 = "sharpness_gain_per_90";
    public static final String DAILY_SHARPNESS_DECAY = "daily_sharpness_decay";
    public static final String LOAD_WINDOW_DAYS = "load_window_days";
    public static final String JADEDNESS_THRESHOLD_MINUTES = "jadedness_threshold_minutes";

    public static final String READINESS_CURVE = "readiness";
    public static final String SHARPNESS_CURVE = "sharpness";

    private static final Map<String, Double> DEFAULT_VALUES = buildDefaultValues();
    private static final Map<String, CurveSpec> DEFAULT_CURVES = buildDefaultCurves();

    private final Map<String, Double> values;
    private final Map<String, CurveSpec> curveSpecs;
    private final Map<Importance, ResponseCurve> readinessCurves = new EnumMap<>(Importance.class);
    private final Map<Importance, ResponseCurve> sharpnessCurves = new EnumMap<>(Importance.class);

    private PlannerConfig(Map<String, Double> values, Map<String, CurveSpec> curveSpecs) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
        this.curveSpecs = Collections.unmodifiableMap(new HashMap<>(curveSpecs));
        for (Importance importance : Importance.values()) {
            readinessCurves.put(importance, buildCurve(READINESS_CURVE, importance));
            sharpnessCurves.put(importance, buildCurve(SHARPNESS_CURVE, importance));
        }
        validate();
    }

    /**
     * Creates a PlannerConfig from key-value pairs and curve specs; anything missing falls back to defaults.
     */
    public static PlannerConfig fromMap(Map<String, Double> values, Map<String, CurveSpec> curves) {
        Objects.requireNonNull(values, "values must not be null");
        Objects.requireNonNull(curves, "curves must not be null");
        return new PlannerConfig(values, curves);
    }

    public static PlannerConfig fromMap(Map<String, Double> values) {
        return fromMap(values, Collections.emptyMap());
    }

    /**
     * Creates a default configuration.
     */
    public static PlannerConfig defaults() {
        return new PlannerConfig(Collections.emptyMap(), Collections.emptyMap());
    }

    /**
     * Key of a per-importance parameter, e.g. {@code importance_weight_high}.
     */
    public static String key(String prefix, Importance importance) {
        return prefix + "_" + importance.name().toLowerCase(Locale.ROOT);
    }

    public static String key(String prefix, LoadCategory load) {
        return prefix + "_" + load.name().toLowerCase(Locale.ROOT);
    }

    private static Map<String, Double> buildDefaultValues() {
        Map<String, Double> d = new HashMap<>();
        d.put(HORIZON_LENGTH, 3.0);
        d.put(DISCOUNT_FACTOR, 0.85);
        d.put(DEFAULT_MINUTES, 90.0);
        d.put(FINAL_REST_DAYS, 3.0);
        d.put(READINESS_FLOOR, 0.75);
        d.put(FAMILIARITY_FLOOR, 0.7);
        d.put(FAMILIARITY_GAP_PENALTY, 0.25);
        d.put(SHARPNESS_BOOST, 0.3);
        d.put(SCARCITY_WEIGHT, 0.5);
        d.put(STABILITY_WEIGHT, 1.0);
        d.put(CONTINUITY_BONUS, 3.0);
        d.put(SWITCH_COST, 2.0);
        d.put(ANCHOR_THRESHOLD, 3.0);
        d.put(ANCHOR_MULTIPLIER, 2.0);
        d.put(REST_UTILITY_WEIGHT, 0.1);
        d.put(FORBIDDEN_COST, 1e6);

        d.put(key(LOAD_MULTIPLIER, LoadCategory.FRESH), 1.0);
        d.put(key(LOAD_MULTIPLIER, LoadCategory.FIT), 0.9);
        d.put(key(LOAD_MULTIPLIER, LoadCategory.TIRED), 0.7);
        d.put(key(LOAD_MULTIPLIER, LoadCategory.JADED), 0.4);

        putPerImportance(d, IMPORTANCE_WEIGHT, 3.0, 1.5, 0.5, 0.3);
        putPerImportance(d, SHADOW_SCALE, 0.3, 0.7, 1.0, 0.5);
        putPerImportance(d, RELIEF_WEIGHT, 0.2, 0.6, 1.0, 0.8);
        putPerImportance(d, NEED_WEIGHT, 0.0, 0.2, 0.5, 1.0);
        return Collections.unmodifiableMap(d);
    }

    private static void putPerImportance(Map<String, Double> d, String prefix,
                                         double high, double medium, double low, double sharpness) {
        d.put(key(prefix, Importance.HIGH), high);
        d.put(key(prefix, Importance.MEDIUM), medium);
        d.put(key(prefix, Importance.LOW), low);
        d.put(key(prefix, Importance.SHARPNESS), sharpness);
    }

    // Higher importance tolerates lower readiness before the multiplier collapses
    private static Map<String, CurveSpec> buildDefaultCurves() {
        Map<String, CurveSpec> c = new HashMap<>();
        c.put(key(READINESS_CURVE, Importance.HIGH), CurveSpec.logistic(0.80, 20, 0.3));
        c.put(key(READINESS_CURVE, Importance.MEDIUM), CurveSpec.logistic(0.88, 25, 0.2));
        c.put(key(READINESS_CURVE, Importance.LOW), CurveSpec.logistic(0.92, 30, 0.1));
        c.put(key(READINESS_CURVE, Importance.SHARPNESS), CurveSpec.logistic(0.85, 20, 0.2));
        c.put(key(SHARPNESS_CURVE, Importance.HIGH), CurveSpec.logistic(0.70, 12, 0.3));
        c.put(key(SHARPNESS_CURVE, Importance.MEDIUM), CurveSpec.logistic(0.75, 15, 0.2));
        c.put(key(SHARPNESS_CURVE, Importance.LOW), CurveSpec.logistic(0.75, 15, 0.3));
        c.put(key(SHARPNESS_CURVE, Importance.SHARPNESS), CurveSpec.logistic(0.50, 6, 0.7));
        return Collections.unmodifiableMap(c);
    }

    private ResponseCurve buildCurve(String target, Importance importance) {
        String name = key(target, importance);
        CurveSpec spec = curveSpecs.getOrDefault(name, DEFAULT_CURVES.get(name));
        return spec.toCurve(name);
    }

    private void validate() {
        for (String key : new String[] {HORIZON_LENGTH, DEFAULT_MINUTES, FINAL_REST_DAYS, ANCHOR_THRESHOLD}) {
            requireWholeNumber(key, get(key));
        }
        if (values.containsKey(LOAD_WINDOW_DAYS)) {
            requireWholeNumber(LOAD_WINDOW_DAYS, values.get(LOAD_WINDOW_DAYS));
        }
        for (String key : new String[] {SCARCITY_WEIGHT, SHARPNESS_BOOST, STABILITY_WEIGHT, CONTINUITY_BONUS,
                SWITCH_COST, ANCHOR_THRESHOLD, ANCHOR_MULTIPLIER, REST_UTILITY_WEIGHT}) {
            ValidationException.requireNonNegative(get(key), key, "config");
        }
        for (Importance importance : Importance.values()) {
            for (String prefix : new String[] {IMPORTANCE_WEIGHT, SHADOW_SCALE, RELIEF_WEIGHT, NEED_WEIGHT}) {
                ValidationException.requireNonNegative(get(key(prefix, importance)), key(prefix, importance), "config");
            }
        }
        ValidationException.requireInRange(getDiscountFactor(), 0.0, 1.0, DISCOUNT_FACTOR, "config");
        if (getDiscountFactor() >= 1.0) {
            throw new ValidationException("discount_factor must be below 1", DISCOUNT_FACTOR);
        }
        ValidationException.requireInRange(getReadinessFloor(), 0.0, 1.0, READINESS_FLOOR, "config");
        ValidationException.requireInRange(getFamiliarityFloor(), 0.0, 1.0, FAMILIARITY_FLOOR, "config");
        ValidationException.requireInRange(getFamiliarityGapPenalty(), 0.0, 0.5, FAMILIARITY_GAP_PENALTY, "config");
        if (getHorizonLength() < 0 || getFinalRestDays() < 0 || getDefaultMinutes() <= 0) {
            throw new ValidationException("horizon_length, final_rest_days and default_minutes must not be negative",
                    HORIZON_LENGTH, FINAL_REST_DAYS, DEFAULT_MINUTES);
        }
        double previous = Double.MAX_VALUE;
        for (LoadCategory load : LoadCategory.values()) {
            double m = getLoadMultiplier(load);
            ValidationException.requireInRange(m, 0.0, 1.0, key(LOAD_MULTIPLIER, load), "config");
            if (m > previous) {
                throw new ValidationException("load multipliers must not increase with load", key(LOAD_MULTIPLIER, load));
            }
            previous = m;
        }
        if (getForbiddenCost() <= 0) {
            throw new ValidationException("forbidden_cost must be positive", FORBIDDEN_COST);
        }
    }

    // Counts and day numbers are read as int, so a fraction would be cut off silently
    private static void requireWholeNumber(String key, double value) {
        if (Double.isNaN(value) || value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new ValidationException(key + " must be a whole number but was " + value, key);
        }
    }

    /**
     * Gets a configuration value by key.
     */
    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            value = DEFAULT_VALUES.get(key);
        }
        if (value == null) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        return value;
    }

    /**
     * Gets a configuration value by key, with a default.
     */
    public double getOrDefault(String key, double defaultValue) {
        Double value = values.get(key);
        if (value != null) {
            return value;
        }
        return DEFAULT_VALUES.getOrDefault(key, defaultValue);
    }

    public Map<String, Double> getValues() {
        return values;
    }

    public Map<String, CurveSpec> getCurveSpecs() {
        return curveSpecs;
    }

    public ResponseCurve getReadinessCurve(Importance importance) {
        return readinessCurves.get(importance);
    }

    public ResponseCurve getSharpnessCurve(Importance importance) {
        return sharpnessCurves.get(importance);
    }

    // Horizon
    public int getHorizonLength() {
        return (int) get(HORIZON_LENGTH);
    }

    public double getDiscountFactor() {
        return get(DISCOUNT_FACTOR);
    }

    public int getDefaultMinutes() {
        return (int) get(DEFAULT_MINUTES);
    }

    public int getFinalRestDays() {
        return (int) get(FINAL_REST_DAYS);
    }

    // Scoring
    public double getReadinessFloor() {
        return get(READINESS_FLOOR);
    }

    public double getFamiliarityFloor() {
        return get(FAMILIARITY_FLOOR);
    }

    public double getFamiliarityGapPenalty() {
        return get(FAMILIARITY_GAP_PENALTY);
    }

    public double getLoadMultiplier(LoadCategory load) {
        return get(key(LOAD_MULTIPLIER, load));
    }

    public double getSharpnessBoost() {
        return get(SHARPNESS_BOOST);
    }

    // Shadow pricing
    public double getImportanceWeight(Importance importance) {
        return get(key(IMPORTANCE_WEIGHT, importance));
    }

    public double getShadowScale(Importance importance) {
        return get(key(SHADOW_SCALE, importance));
    }

    public double getScarcityWeight() {
        return get(SCARCITY_WEIGHT);
    }

    // Cost matrix
    public double getStabilityWeight() {
        return get(STABILITY_WEIGHT);
    }

    public double getContinuityBonus() {
        return get(CONTINUITY_BONUS);
    }

    public double getSwitchCost() {
        return get(SWITCH_COST);
    }

    public int getAnchorThreshold() {
        return (int) get(ANCHOR_THRESHOLD);
    }

    public double getAnchorMultiplier() {
        return get(ANCHOR_MULTIPLIER);
    }

    public double getRestUtilityWeight() {
        return get(REST_UTILITY_WEIGHT);
    }

    public double getReliefWeight(Importance importance) {
        return get(key(RELIEF_WEIGHT, importance));
    }

    public double getNeedWeight(Importance importance) {
        return get(key(NEED_WEIGHT, importance));
    }

    public double getForbiddenCost() {
        return get(FORBIDDEN_COST);
    }

    /**
     * State dynamics, overriding the propagation defaults with any dynamics keys present.
     */
    public PropagationParameters toPropagationParameters() {
        PropagationParameters.Builder builder = PropagationParameters.builder();
        if (values.containsKey(READINESS_LOSS_PER_90)) {
            builder.readinessLossPer90(values.get(READINESS_LOSS_PER_90));
        }
        if (values.containsKey(DAILY_RECOVERY)) {
            builder.dailyRecovery(values.get(DAILY_RECOVERY));
        }
        if (values.containsKey(SHARPNESS_GAIN_PER_90)) {
            builder.sharpnessGainPer90(values.get(SHARPNESS_GAIN_PER_90));
        }
        if (values.containsKey(DAILY_SHARPNESS_DECAY)) {
            builder.dailySharpnessDecay(values.get(DAILY_SHARPNESS_DECAY));
        }
        if (values.containsKey(LOAD_WINDOW_DAYS)) {
            builder.windowDays(values.get(LOAD_WINDOW_DAYS).intValue());
        }
        if (values.containsKey(JADEDNESS_THRESHOLD_MINUTES)) {
            builder.jadednessThresholdMinutes(values.get(JADEDNESS_THRESHOLD_MINUTES));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "PlannerConfig" + values + ", curves=" + curveSpecs.keySet();
    }
}
