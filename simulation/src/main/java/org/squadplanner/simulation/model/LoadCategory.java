package org.squadplanner.simulation.model;

/**
 * Accumulated-fatigue category derived from the rolling minutes window.
 * Declared from least to most loaded.
 */
public enum LoadCategory {
    FRESH,
    FIT,
    TIRED,
    JADED;

    public boolean isHeavierThan(LoadCategory other) {
        return ordinal() > other.ordinal();
    }
}
