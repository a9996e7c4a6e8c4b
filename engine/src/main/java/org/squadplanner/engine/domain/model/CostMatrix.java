package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Square workers x (slots + rest sinks) matrix for one event.
 * Columns {@code 0..slotCount-1} are the formation's slots, the rest are interchangeable rest sinks.
 */
public final class CostMatrix {

    private final Event event;
    private final List<Worker> workers;
    private final List<TaskSlot> slots;
    private final CellCost[][] cells;
    private final ScoreBreakdown[][] scores;
    private final List<String> relaxations;

    public CostMatrix(Event event, List<Worker> workers, CellCost[][] cells, ScoreBreakdown[][] scores,
                      List<String> relaxations) {
        this.event = Objects.requireNonNull(event, "event must not be null");
        this.workers = Collections.unmodifiableList(new ArrayList<>(workers));
        this.slots = event.getFormation().getSlots();
        this.cells = Objects.requireNonNull(cells, "cells must not be null");
        this.scores = Objects.requireNonNull(scores, "scores must not be null");
        this.relaxations = Collections.unmodifiableList(new ArrayList<>(relaxations));
        if (cells.length != workers.size()) {
            throw new IllegalArgumentException("one row per worker expected");
        }
        for (CellCost[] row : cells) {
            if (row.length != workers.size()) {
                throw new IllegalArgumentException("cost matrix must be square");
            }
        }
    }

    public Event getEvent() {
        return event;
    }

    public List<Worker> getWorkers() {
        return workers;
    }

    public List<TaskSlot> getSlots() {
        return slots;
    }

    public int size() {
        return workers.size();
    }

    public int getSlotCount() {
        return slots.size();
    }

    public boolean isRestColumn(int column) {
        return column >= slots.size();
    }

    public CellCost cell(int row, int column) {
        return cells[row][column];
    }

    /**
     * Score of a worker in a slot column; {@code null} for rest columns.
     */
    public ScoreBreakdown score(int row, int column) {
        return isRestColumn(column) ? null : scores[row][column];
    }

    /**
     * Constraint relaxations applied while building this matrix, e.g. the goalkeeper fallback.
     */
    public List<String> getRelaxations() {
        return relaxations;
    }

    public double[][] toArray() {
        int n = size();
        double[][] costs = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                costs[i][j] = cells[i][j].getTotal();
            }
        }
        return costs;
    }
}
