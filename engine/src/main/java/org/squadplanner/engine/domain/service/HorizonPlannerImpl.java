package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.Assignment;
import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.engine.domain.model.EventSchedule;
import org.squadplanner.engine.domain.model.HorizonPlan;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ShadowPrice;
import org.squadplanner.engine.domain.model.SlotAssignment;
import org.squadplanner.simulation.engine.Participation;
import org.squadplanner.simulation.engine.StatePropagationEngine;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Implementation of HorizonPlanner.
 *
 * Every event's constraints are checked against the roster first, so a conflict anywhere in the horizon
 * fails the plan before anything is solved. Then for each event k: price shadows over k+1..k+H, solve k,
 * propagate every worker by the days to k+1.
 */
public final class HorizonPlannerImpl implements HorizonPlanner {

    private static final Logger LOG = Logger.getLogger(HorizonPlannerImpl.class.getName());

    private final ShadowPricingService shadowPricingService;
    private final AssignmentService assignmentService;
    private final StatePropagationEngine propagationEngine;
    private final ConstraintValidator validator;

    public HorizonPlannerImpl(ShadowPricingService shadowPricingService, AssignmentService assignmentService,
                              StatePropagationEngine propagationEngine) {
        this(shadowPricingService, assignmentService, propagationEngine, new ConstraintValidator());
    }

    public HorizonPlannerImpl(ShadowPricingService shadowPricingService, AssignmentService assignmentService,
                              StatePropagationEngine propagationEngine, ConstraintValidator validator) {
        this.shadowPricingService = Objects.requireNonNull(shadowPricingService,
                "shadowPricingService must not be null");
        this.assignmentService = Objects.requireNonNull(assignmentService, "assignmentService must not be null");
        this.propagationEngine = Objects.requireNonNull(propagationEngine, "propagationEngine must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    @Override
    public HorizonPlan plan(List<Worker> roster, List<Event> events, AssignmentHistory history,
                            PlannerConfig config) {
        Objects.requireNonNull(roster, "roster must not be null");
        Objects.requireNonNull(history, "history must not be null");
        Objects.requireNonNull(config, "config must not be null");
        EventSchedule schedule = new EventSchedule(events);
        for (Event event : schedule.getEvents()) {
            validator.validate(event, roster);
        }

        LOG.info(() -> String.format("Planning %d events for %d workers (H=%d, discount=%.2f)",
                schedule.size(), roster.size(), config.getHorizonLength(), config.getDiscountFactor()));

        List<Worker> current = new ArrayList<>(roster);
        List<Map<String, Worker>> trajectory = new ArrayList<>();
        List<Assignment> assignments = new ArrayList<>();
        AssignmentHistory previous = history;
        trajectory.add(index(current));

        for (int k = 0; k < schedule.size(); k++) {
            Event event = schedule.get(k);
            Map<String, ShadowPrice> shadows = shadowPricingService.price(current, schedule, k, config);
            Assignment assignment = assignmentService.assign(event, current, shadows, previous, config);
            assignments.add(assignment);
            logAssignment(assignment);

            int days = schedule.daysAfter(k, config.getFinalRestDays());
            current = advance(current, assignment, event, days, config);
            previous = previous.record(assignment, ids(current));
            trajectory.add(index(current));
        }

        HorizonPlan plan = new HorizonPlan(schedule, assignments, trajectory);
        LOG.info(() -> "Planned " + plan);
        return plan;
    }

    private List<Worker> advance(List<Worker> workers, Assignment assignment, Event event, int days,
                                 PlannerConfig config) {
        List<Worker> next = new ArrayList<>(workers.size());
        for (Worker worker : workers) {
            Optional<SlotAssignment> slot = assignment.findByWorker(worker.getId());
            Participation participation = slot.isPresent()
                    ? Participation.played(config.getDefaultMinutes(), event.getImportance(),
                    slot.get().getSlot().getInPossessionTask())
                    : Participation.rested();
            next.add(propagationEngine.propagate(worker, participation, days));
        }
        return next;
    }

    private static void logAssignment(Assignment assignment) {
        LOG.info(() -> String.format("%s (%s): gss=%.1f, rested=%d, lineup=%s",
                assignment.getEventId(), assignment.getImportance(), assignment.getTotalGss(),
                assignment.getRestedWorkerIds().size(), assignment.toLineup()));
    }

    private static Map<String, Worker> index(List<Worker> workers) {
        Map<String, Worker> byId = new LinkedHashMap<>();
        for (Worker worker : workers) {
            byId.put(worker.getId(), worker);
        }
        return byId;
    }

    private static List<String> ids(List<Worker> workers) {
        return workers.stream().map(Worker::getId).collect(Collectors.toList());
    }
}
