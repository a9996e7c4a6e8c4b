package org.squadplanner.engine;

import org.squadplanner.simulation.model.ConstraintSet;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Formation;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.Worker;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Shared formations, squads and schedules for engine tests.
 */
public final class SquadFixtures {

    public static final LocalDate START = LocalDate.of(2025, 8, 2);

    private SquadFixtures() {
    }

    /**
     * 4-4-2 with slot ids GK, DL, DCL, DCR, DR, ML, MCL, MCR, MR, STL, STR.
     */
    public static Formation fourFourTwo() {
        return new Formation("4-4-2", Arrays.asList(
                TaskSlot.goalkeeper("GK", "GK"),
                TaskSlot.of("DL", "D(L)"),
                TaskSlot.of("DCL", "D(C)"),
                TaskSlot.of("DCR", "D(C)"),
                TaskSlot.of("DR", "D(R)"),
                TaskSlot.of("ML", "M(L)"),
                TaskSlot.of("MCL", "M(C)"),
                TaskSlot.of("MCR", "M(C)"),
                TaskSlot.of("MR", "M(R)"),
                TaskSlot.of("STL", "ST"),
                TaskSlot.of("STR", "ST")));
    }

    /**
     * 4-3-3 sharing the goalkeeper, defence and striker tasks of {@link #fourFourTwo()}.
     */
    public static Formation fourThreeThree() {
        return new Formation("4-3-3", Arrays.asList(
                TaskSlot.goalkeeper("GK", "GK"),
                TaskSlot.of("DL", "D(L)"),
                TaskSlot.of("DCL", "D(C)"),
                TaskSlot.of("DCR", "D(C)"),
                TaskSlot.of("DR", "D(R)"),
                TaskSlot.of("MCL", "M(C)"),
                TaskSlot.of("MC", "M(C)"),
                TaskSlot.of("MCR", "M(C)"),
                TaskSlot.of("AML", "AM(L)"),
                TaskSlot.of("AMR", "AM(R)"),
                TaskSlot.of("ST", "ST")));
    }

    public static Worker.Builder natural(String id, String task, double rating) {
        return new Worker.Builder()
                .id(id)
                .goalkeeper("GK".equals(task))
                .natural(task, rating);
    }

    /**
     * One worker per slot and rating, named {@code <slot>-<index>}; goalkeepers for the goalkeeper slot.
     */
    public static List<Worker> squad(Formation formation, double... ratings) {
        List<Worker> squad = new ArrayList<>();
        for (TaskSlot slot : formation.getSlots()) {
            for (int i = 0; i < ratings.length; i++) {
                squad.add(natural(slot.getId() + "-" + i, slot.getInPossessionTask(), ratings[i]).build());
            }
        }
        return squad;
    }

    public static Event event(String id, int day, Importance importance, Formation formation) {
        return new Event(id, START.plusDays(day), importance, formation);
    }

    public static Event event(String id, int day, Importance importance, Formation formation,
                              ConstraintSet constraints) {
        return new Event(id, START.plusDays(day), importance, formation, constraints);
    }

    /**
     * Events e0, e1, ... on the given day offsets, all in the same formation.
     */
    public static List<Event> schedule(Formation formation, int[] days, Importance... importances) {
        List<Event> events = new ArrayList<>();
        for (int k = 0; k < days.length; k++) {
            events.add(event("e" + k, days[k], importances[k], formation));
        }
        return events;
    }
}
