package org.squadplanner.engine.domain.model;

import java.util.Objects;

/**
 * Opportunity cost of starting a worker at one event, on the GSS scale.
 */
public final class ShadowPrice implements Comparable<ShadowPrice> {

    private final String workerId;
    private final String eventId;
    private final double preservationValue;
    private final double scarcity;
    private final double value;

    public ShadowPrice(String workerId, String eventId, double preservationValue, double scarcity, double value) {
        this.workerId = Objects.requireNonNull(workerId, "workerId must not be null");
        this.eventId = Objects.requireNonNull(eventId, "eventId must not be null");
        this.preservationValue = preservationValue;
        this.scarcity = scarcity;
        this.value = value;
    }

    public static ShadowPrice zero(String workerId, String eventId) {
        return new ShadowPrice(workerId, eventId, 0.0, 0.0, 0.0);
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getEventId() {
        return eventId;
    }

    /**
     * Discounted, importance-weighted future GSS lost by starting now, clamped at zero.
     */
    public double getPreservationValue() {
        return preservationValue;
    }

    /**
     * 0 when an equal replacement exists, approaching 1 when nobody comes close.
     */
    public double getScarcity() {
        return scarcity;
    }

    public double getValue() {
        return value;
    }

    @Override
    public int compareTo(ShadowPrice other) {
        // Highest opportunity cost first, ties by id
        int byValue = Double.compare(other.value, this.value);
        return byValue != 0 ? byValue : workerId.compareTo(other.workerId);
    }

    @Override
    public String toString() {
        return String.format("ShadowPrice{%s@%s=%.2f, scarcity=%.2f}", workerId, eventId, value, scarcity);
    }
}
