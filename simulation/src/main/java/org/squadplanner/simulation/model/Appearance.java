package org.squadplanner.simulation.model;

import java.util.Objects;

/**
 * Minutes played in one past event, dated relative to "now" in whole days.
 */
public final class Appearance {

    private final int daysAgo;
    private final int minutes;

    public Appearance(int daysAgo, int minutes) {
        if (daysAgo < 0) {
            throw new ValidationException("daysAgo must not be negative: " + daysAgo);
        }
        if (minutes < 0) {
            throw new ValidationException("minutes must not be negative: " + minutes);
        }
        this.daysAgo = daysAgo;
        this.minutes = minutes;
    }

    public int getDaysAgo() {
        return daysAgo;
    }

    public int getMinutes() {
        return minutes;
    }

    public Appearance aged(int days) {
        return new Appearance(daysAgo + days, minutes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Appearance)) {
            return false;
        }
        Appearance that = (Appearance) o;
        return daysAgo == that.daysAgo && minutes == that.minutes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(daysAgo, minutes);
    }

    @Override
    public String toString() {
        return minutes + "'@-" + daysAgo + "d";
    }
}
