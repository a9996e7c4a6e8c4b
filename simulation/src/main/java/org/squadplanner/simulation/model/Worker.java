package org.squadplanner.simulation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one squad member: capability ratings, phase familiarity and perishable state.
 * A new snapshot is produced by the state propagation engine after every event.
 */
public final class Worker {

    public static final int MIN_ATTRIBUTE = 1;
    public static final int MAX_ATTRIBUTE = 20;

    private final String id;
    private final String name;
    private final int age;
    private final int naturalFitness;
    private final int stamina;
    private final boolean goalkeeper;
    private final TrainingIntensity trainingIntensity;
    private final Map<String, Double> ratings;
    private final Map<String, Double> inPossessionFamiliarity;
    private final Map<String, Double> outOfPossessionFamiliarity;
    private final double readiness;
    private final double sharpness;
    private final LoadCategory load;
    private final List<Appearance> appearances;
    private final int consecutiveAppearances;
    private final int daysSinceLastAppearance;
    private final boolean injured;
    private final boolean suspended;

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.age = builder.age;
        this.naturalFitness = builder.naturalFitness;
        this.stamina = builder.stamina;
        this.goalkeeper = builder.goalkeeper;
        this.trainingIntensity = Objects.requireNonNull(builder.trainingIntensity, "trainingIntensity must not be null");
        this.ratings = Collections.unmodifiableMap(new HashMap<>(builder.ratings));
        this.inPossessionFamiliarity = Collections.unmodifiableMap(new HashMap<>(builder.inPossessionFamiliarity));
        this.outOfPossessionFamiliarity = Collections.unmodifiableMap(new HashMap<>(builder.outOfPossessionFamiliarity));
        this.readiness = builder.readiness;
        this.sharpness = builder.sharpness;
        this.load = Objects.requireNonNull(builder.load, "load must not be null");
        this.appearances = Collections.unmodifiableList(new ArrayList<>(builder.appearances));
        this.consecutiveAppearances = builder.consecutiveAppearances;
        this.daysSinceLastAppearance = builder.daysSinceLastAppearance;
        this.injured = builder.injured;
        this.suspended = builder.suspended;
        validate();
    }

    private void validate() {
        ValidationException.requireInRange(readiness, 0.0, 1.0, "readiness", id);
        ValidationException.requireInRange(sharpness, 0.0, 1.0, "sharpness", id);
        ValidationException.requireInRange(naturalFitness, MIN_ATTRIBUTE, MAX_ATTRIBUTE, "naturalFitness", id);
        ValidationException.requireInRange(stamina, MIN_ATTRIBUTE, MAX_ATTRIBUTE, "stamina", id);
        if (age <= 0) {
            throw new ValidationException("age of " + id + " must be positive but was " + age, id);
        }
        if (consecutiveAppearances < 0 || daysSinceLastAppearance < 0) {
            throw new ValidationException("appearance counters of " + id + " must not be negative", id);
        }
        ratings.forEach((task, rating) -> ValidationException.requireNonNegative(rating, "rating[" + task + "]", id));
        inPossessionFamiliarity.forEach((task, f) ->
                ValidationException.requireInRange(f, 0.0, 1.0, "inPossessionFamiliarity[" + task + "]", id));
        outOfPossessionFamiliarity.forEach((task, f) ->
                ValidationException.requireInRange(f, 0.0, 1.0, "outOfPossessionFamiliarity[" + task + "]", id));
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public int getAge() {
        return age;
    }

    public int getNaturalFitness() {
        return naturalFitness;
    }

    public int getStamina() {
        return stamina;
    }

    /**
     * Whether this worker is eligible for goalkeeper-kind slots without relaxation.
     */
    public boolean isGoalkeeper() {
        return goalkeeper;
    }

    public TrainingIntensity getTrainingIntensity() {
        return trainingIntensity;
    }

    /**
     * Capability rating for a task kind, 0 when the worker has none.
     */
    public double getRating(String task) {
        return ratings.getOrDefault(task, 0.0);
    }

    public Map<String, Double> getRatings() {
        return ratings;
    }

    public double getInPossessionFamiliarity(String task) {
        return inPossessionFamiliarity.getOrDefault(task, 0.0);
    }

    public double getOutOfPossessionFamiliarity(String task) {
        return outOfPossessionFamiliarity.getOrDefault(task, 0.0);
    }

    public Map<String, Double> getInPossessionFamiliarity() {
        return inPossessionFamiliarity;
    }

    public Map<String, Double> getOutOfPossessionFamiliarity() {
        return outOfPossessionFamiliarity;
    }

    public double getReadiness() {
        return readiness;
    }

    public double getSharpness() {
        return sharpness;
    }

    public LoadCategory getLoad() {
        return load;
    }

    /**
     * Appearances still inside the rolling window, most recent first.
     */
    public List<Appearance> getAppearances() {
        return appearances;
    }

    public int getWindowMinutes() {
        int total = 0;
        for (Appearance appearance : appearances) {
            total += appearance.getMinutes();
        }
        return total;
    }

    public int getConsecutiveAppearances() {
        return consecutiveAppearances;
    }

    public int getDaysSinceLastAppearance() {
        return daysSinceLastAppearance;
    }

    public boolean isInjured() {
        return injured;
    }

    public boolean isSuspended() {
        return suspended;
    }

    public boolean isAvailable() {
        return !injured && !suspended;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .id(id)
                .name(name)
                .age(age)
                .naturalFitness(naturalFitness)
                .stamina(stamina)
                .goalkeeper(goalkeeper)
                .trainingIntensity(trainingIntensity)
                .readiness(readiness)
                .sharpness(sharpness)
                .load(load)
                .appearances(appearances)
                .consecutiveAppearances(consecutiveAppearances)
                .daysSinceLastAppearance(daysSinceLastAppearance)
                .injured(injured)
                .suspended(suspended);
        builder.ratings.putAll(ratings);
        builder.inPossessionFamiliarity.putAll(inPossessionFamiliarity);
        builder.outOfPossessionFamiliarity.putAll(outOfPossessionFamiliarity);
        return builder;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Worker)) {
            return false;
        }
        Worker that = (Worker) o;
        return age == that.age
                && naturalFitness == that.naturalFitness
                && stamina == that.stamina
                && goalkeeper == that.goalkeeper
                && trainingIntensity == that.trainingIntensity
                && Double.compare(readiness, that.readiness) == 0
                && Double.compare(sharpness, that.sharpness) == 0
                && consecutiveAppearances == that.consecutiveAppearances
                && daysSinceLastAppearance == that.daysSinceLastAppearance
                && injured == that.injured
                && suspended == that.suspended
                && id.equals(that.id)
                && name.equals(that.name)
                && ratings.equals(that.ratings)
                && inPossessionFamiliarity.equals(that.inPossessionFamiliarity)
                && outOfPossessionFamiliarity.equals(that.outOfPossessionFamiliarity)
                && load == that.load
                && appearances.equals(that.appearances);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, readiness, sharpness, load, appearances, consecutiveAppearances,
                daysSinceLastAppearance, injured, suspended);
    }

    @Override
    public String toString() {
        return String.format("Worker{id='%s', readiness=%.3f, sharpness=%.3f, load=%s, window=%d'}",
                id, readiness, sharpness, load, getWindowMinutes());
    }

    /**
     * Builder for Worker.
     */
    public static final class Builder {
        private String id;
        private String name;
        private int age = 25;
        private int naturalFitness = 10;
        private int stamina = 10;
        private boolean goalkeeper;
        private TrainingIntensity trainingIntensity = TrainingIntensity.MEDIUM;
        private final Map<String, Double> ratings = new HashMap<>();
        private final Map<String, Double> inPossessionFamiliarity = new HashMap<>();
        private final Map<String, Double> outOfPossessionFamiliarity = new HashMap<>();
        private double readiness = 1.0;
        private double sharpness = 1.0;
        private LoadCategory load = LoadCategory.FRESH;
        private List<Appearance> appearances = new ArrayList<>();
        private int consecutiveAppearances;
        private int daysSinceLastAppearance;
        private boolean injured;
        private boolean suspended;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder age(int age) {
            this.age = age;
            return this;
        }

        public Builder naturalFitness(int naturalFitness) {
            this.naturalFitness = naturalFitness;
            return this;
        }

        public Builder stamina(int stamina) {
            this.stamina = stamina;
            return this;
        }

        public Builder goalkeeper(boolean goalkeeper) {
            this.goalkeeper = goalkeeper;
            return this;
        }

        public Builder trainingIntensity(TrainingIntensity trainingIntensity) {
            this.trainingIntensity = trainingIntensity;
            return this;
        }

        public Builder rating(String task, double rating) {
            this.ratings.put(Objects.requireNonNull(task, "task must not be null"), rating);
            return this;
        }

        public Builder familiarity(String task, double inPossession, double outOfPossession) {
            Objects.requireNonNull(task, "task must not be null");
            this.inPossessionFamiliarity.put(task, inPossession);
            this.outOfPossessionFamiliarity.put(task, outOfPossession);
            return this;
        }

        /**
         * Shorthand for a task the worker plays naturally in both phases.
         */
        public Builder natural(String task, double rating) {
            return rating(task, rating).familiarity(task, 1.0, 1.0);
        }

        public Builder readiness(double readiness) {
            this.readiness = readiness;
            return this;
        }

        public Builder sharpness(double sharpness) {
            this.sharpness = sharpness;
            return this;
        }

        public Builder load(LoadCategory load) {
            this.load = load;
            return this;
        }

        public Builder appearances(List<Appearance> appearances) {
            this.appearances = new ArrayList<>(Objects.requireNonNull(appearances, "appearances must not be null"));
            return this;
        }

        public Builder consecutiveAppearances(int consecutiveAppearances) {
            this.consecutiveAppearances = consecutiveAppearances;
            return this;
        }

        public Builder daysSinceLastAppearance(int daysSinceLastAppearance) {
            this.daysSinceLastAppearance = daysSinceLastAppearance;
            return this;
        }

        public Builder injured(boolean injured) {
            this.injured = injured;
            return this;
        }

        public Builder suspended(boolean suspended) {
            this.suspended = suspended;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }
}
