package org.squadplanner.simulation.engine;

import org.squadplanner.simulation.model.Importance;

import java.util.Objects;

/**
 * What a worker did at one event: played some minutes in a task, or rested.
 */
public final class Participation {

    private static final Participation RESTED = new Participation(false, 0, null, null);

    private final boolean played;
    private final int minutes;
    private final Importance importance;
    private final String task;

    private Participation(boolean played, int minutes, Importance importance, String task) {
        this.played = played;
        this.minutes = minutes;
        this.importance = importance;
        this.task = task;
    }

    public static Participation played(int minutes, Importance importance, String task) {
        if (minutes < 0) {
            throw new IllegalArgumentException("minutes must not be negative: " + minutes);
        }
        return new Participation(true, minutes,
                Objects.requireNonNull(importance, "importance must not be null"),
                Objects.requireNonNull(task, "task must not be null"));
    }

    public static Participation rested() {
        return RESTED;
    }

    public boolean isPlayed() {
        return played;
    }

    public int getMinutes() {
        return minutes;
    }

    public Importance getImportance() {
        return importance;
    }

    public String getTask() {
        return task;
    }

    @Override
    public String toString() {
        return played ? "played(" + minutes + "', " + importance + ", " + task + ")" : "rested";
    }
}
