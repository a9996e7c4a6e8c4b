package org.squadplanner.simulation.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Hard requirements for one event. Locks are kept as a list so that contradictory
 * locks survive construction and can be reported before any matrix is built.
 */
public final class ConstraintSet {

    private static final ConstraintSet EMPTY = new Builder().build();

    private final Set<String> forcedRest;
    private final List<Pin> locks;
    private final Set<Pin> rejections;
    private final boolean overrideReadinessFloor;

    private ConstraintSet(Builder builder) {
        this.forcedRest = Collections.unmodifiableSet(new LinkedHashSet<>(builder.forcedRest));
        this.locks = Collections.unmodifiableList(new ArrayList<>(builder.locks));
        this.rejections = Collections.unmodifiableSet(new LinkedHashSet<>(builder.rejections));
        this.overrideReadinessFloor = builder.overrideReadinessFloor;
    }

    public static ConstraintSet empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> getForcedRest() {
        return forcedRest;
    }

    public boolean isForcedRest(String workerId) {
        return forcedRest.contains(workerId);
    }

    public List<Pin> getLocks() {
        return locks;
    }

    public Optional<Pin> findLock(String workerId) {
        return locks.stream().filter(l -> l.getWorkerId().equals(workerId)).findFirst();
    }

    public Set<Pin> getRejections() {
        return rejections;
    }

    public boolean isRejected(String workerId, String slotId) {
        return rejections.contains(new Pin(workerId, slotId));
    }

    /**
     * When set, workers below the readiness hard floor may still be started.
     */
    public boolean isOverrideReadinessFloor() {
        return overrideReadinessFloor;
    }

    @Override
    public String toString() {
        return "ConstraintSet{forcedRest=" + forcedRest + ", locks=" + locks + ", rejections=" + rejections
                + ", overrideReadinessFloor=" + overrideReadinessFloor + "}";
    }

    /**
     * Builder for ConstraintSet.
     */
    public static final class Builder {
        private final Set<String> forcedRest = new LinkedHashSet<>();
        private final List<Pin> locks = new ArrayList<>();
        private final Set<Pin> rejections = new LinkedHashSet<>();
        private boolean overrideReadinessFloor;

        public Builder forceRest(String workerId) {
            forcedRest.add(Objects.requireNonNull(workerId, "workerId must not be null"));
            return this;
        }

        public Builder lock(String workerId, String slotId) {
            locks.add(new Pin(workerId, slotId));
            return this;
        }

        public Builder reject(String workerId, String slotId) {
            rejections.add(new Pin(workerId, slotId));
            return this;
        }

        public Builder overrideReadinessFloor(boolean overrideReadinessFloor) {
            this.overrideReadinessFloor = overrideReadinessFloor;
            return this;
        }

        public ConstraintSet build() {
            return new ConstraintSet(this);
        }
    }
}
