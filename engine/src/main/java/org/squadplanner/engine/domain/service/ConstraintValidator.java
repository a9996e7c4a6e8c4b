package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.error.ConstraintConflictException;
import org.squadplanner.simulation.model.ConstraintSet;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Pin;
import org.squadplanner.simulation.model.ValidationException;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks an event's constraint set against the roster before any matrix is built.
 */
public final class ConstraintValidator {

    /**
     * @throws ValidationException when the roster has duplicate ids or a constraint names an unknown worker or slot
     * @throws ConstraintConflictException when two constraints cannot both hold
     */
    public void validate(Event event, List<Worker> roster) {
        Map<String, Worker> workers = new HashMap<>();
        for (Worker worker : roster) {
            if (workers.put(worker.getId(), worker) != null) {
                throw new ValidationException("duplicate worker id " + worker.getId(), worker.getId());
            }
        }
        ConstraintSet constraints = event.getConstraints();
        for (String workerId : constraints.getForcedRest()) {
            requireWorker(workers, workerId, event);
        }
        for (Pin pin : constraints.getLocks()) {
            requirePin(workers, pin, event);
        }
        for (Pin pin : constraints.getRejections()) {
            requirePin(workers, pin, event);
        }

        List<String> conflicts = new ArrayList<>();
        Map<String, Pin> lockBySlot = new HashMap<>();
        Map<String, Pin> lockByWorker = new HashMap<>();
        Set<Pin> seen = new HashSet<>();
        for (Pin lock : constraints.getLocks()) {
            if (!seen.add(lock)) {
                continue;
            }
            if (constraints.isRejected(lock.getWorkerId(), lock.getSlotId())) {
                conflicts.add("lock " + lock + " contradicts rejection " + lock);
            }
            Pin sameSlot = lockBySlot.putIfAbsent(lock.getSlotId(), lock);
            if (sameSlot != null) {
                conflicts.add("locks " + sameSlot + " and " + lock + " target the same slot");
            }
            Pin sameWorker = lockByWorker.putIfAbsent(lock.getWorkerId(), lock);
            if (sameWorker != null) {
                conflicts.add("locks " + sameWorker + " and " + lock + " target the same worker");
            }
            Worker worker = workers.get(lock.getWorkerId());
            if (constraints.isForcedRest(lock.getWorkerId()) || !worker.isAvailable()) {
                conflicts.add("lock " + lock + " targets a worker who must rest");
            }
        }
        if (!conflicts.isEmpty()) {
            throw new ConstraintConflictException(event.getId(), conflicts);
        }
    }

    private static void requirePin(Map<String, Worker> workers, Pin pin, Event event) {
        requireWorker(workers, pin.getWorkerId(), event);
        if (!event.getFormation().findSlot(pin.getSlotId()).isPresent()) {
            throw new ValidationException("event " + event.getId() + " has no slot " + pin.getSlotId(),
                    event.getId(), pin.getSlotId());
        }
    }

    private static void requireWorker(Map<String, Worker> workers, String workerId, Event event) {
        if (!workers.containsKey(workerId)) {
            throw new ValidationException("event " + event.getId() + " names unknown worker " + workerId,
                    event.getId(), workerId);
        }
    }
}
