package org.squadplanner.engine.domain.model;

import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.ValidationException;

import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered events of a planning horizon. Dates must not go backwards and ids must be unique.
 */
public final class EventSchedule {

    private final List<Event> events;

    public EventSchedule(List<Event> events) {
        Objects.requireNonNull(events, "events must not be null");
        if (events.isEmpty()) {
            throw new ValidationException("a horizon needs at least one event");
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < events.size(); i++) {
            Event event = events.get(i);
            if (!ids.add(event.getId())) {
                throw new ValidationException("duplicate event id " + event.getId(), event.getId());
            }
            if (i > 0 && event.getDate().isBefore(events.get(i - 1).getDate())) {
                throw new ValidationException("event " + event.getId() + " is dated before the event preceding it",
                        events.get(i - 1).getId(), event.getId());
            }
        }
        this.events = Collections.unmodifiableList(new ArrayList<>(events));
    }

    public List<Event> getEvents() {
        return events;
    }

    public Event get(int index) {
        return events.get(index);
    }

    public int size() {
        return events.size();
    }

    public boolean isLast(int index) {
        return index == events.size() - 1;
    }

    /**
     * Days from event {@code index} to the next one, or {@code finalRestDays} after the last.
     */
    public int daysAfter(int index, int finalRestDays) {
        if (isLast(index)) {
            return finalRestDays;
        }
        return (int) ChronoUnit.DAYS.between(events.get(index).getDate(), events.get(index + 1).getDate());
    }
}
