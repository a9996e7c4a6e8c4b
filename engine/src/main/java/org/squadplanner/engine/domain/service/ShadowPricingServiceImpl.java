package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.EventSchedule;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ShadowPrice;
import org.squadplanner.simulation.engine.Participation;
import org.squadplanner.simulation.engine.StatePropagationEngine;
import org.squadplanner.simulation.model.ConstraintSet;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Implementation of ShadowPricingService using two-branch projection.
 *
 * For a worker at event k, with best slot b at k:
 *   rested = the worker rested from k on
 *   played = the worker started in b at k, then started again at every later event where it is
 *            above the readiness floor and still beats its replacement
 *   for m in k+1 .. min(k+H, last), with s the worker's best slot at m:
 *     replacement = GSS of the next alternative for s once the other slots with the same tasks are filled,
 *                   every alternative rested from k on
 *     value += discount^(m-k) x importance_weight[m]
 *              x (max(0, gss(rested, s) - replacement) - max(0, gss(played, s) - replacement))
 *   shadow = max(0, value) x (1 + scarcity_weight x scarcity)
 *
 * Both branches go through the same propagation engine as the real state.
 */
public final class ShadowPricingServiceImpl implements ShadowPricingService {

    private static final Logger LOG = Logger.getLogger(ShadowPricingServiceImpl.class.getName());

    private final ScoringService scoringService;
    private final StatePropagationEngine propagationEngine;

    public ShadowPricingServiceImpl(ScoringService scoringService, StatePropagationEngine propagationEngine) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
        this.propagationEngine = Objects.requireNonNull(propagationEngine, "propagationEngine must not be null");
    }

    @Override
    public Map<String, ShadowPrice> price(List<Worker> roster, EventSchedule schedule, int eventIndex,
                                          PlannerConfig config) {
        Objects.requireNonNull(roster, "roster must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Event event = schedule.get(eventIndex);

        int steps = Math.min(config.getHorizonLength(), schedule.size() - 1 - eventIndex);
        int last = eventIndex + steps;
        double[][] current = scoreMatrix(roster, event, config);
        List<double[][]> ahead = scoreRestedAhead(roster, schedule, eventIndex, last, config);

        Map<String, ShadowPrice> prices = new LinkedHashMap<>();
        for (int i = 0; i < roster.size(); i++) {
            Worker worker = roster.get(i);
            if (!canPlay(worker, event.getConstraints())) {
                prices.put(worker.getId(), ShadowPrice.zero(worker.getId(), event.getId()));
                continue;
            }
            double preservation = calculatePreservationValue(i, worker, current[i], ahead, schedule, eventIndex,
                    last, config);
            double scarcity = calculateScarcity(i, current, event.getFormation().getSlots());
            double value = preservation * (1 + config.getScarcityWeight() * scarcity);
            prices.put(worker.getId(), new ShadowPrice(worker.getId(), event.getId(), preservation, scarcity, value));
        }

        LOG.fine(() -> String.format("Priced %d workers for %s over %d later events",
                prices.size(), event.getId(), steps));
        return prices;
    }

    @Override
    public List<ShadowPrice> rankByShadowPrice(List<Worker> roster, EventSchedule schedule, int eventIndex,
                                               PlannerConfig config, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        List<ShadowPrice> ranked = new ArrayList<>(price(roster, schedule, eventIndex, config).values());
        Collections.sort(ranked);
        return ranked.subList(0, Math.min(limit, ranked.size()));
    }

    /**
     * Discounted future value over replacement lost by starting the worker now rather than resting.
     */
    private double calculatePreservationValue(int row, Worker worker, double[] currentScores, List<double[][]> ahead,
                                              EventSchedule schedule, int eventIndex, int last,
                                              PlannerConfig config) {
        int bestSlot = argMax(currentScores);
        if (bestSlot < 0 || last <= eventIndex) {
            return 0.0;
        }

        Event event = schedule.get(eventIndex);
        TaskSlot slot = event.getFormation().getSlots().get(bestSlot);
        Worker played = propagationEngine.propagate(worker,
                Participation.played(config.getDefaultMinutes(), event.getImportance(), slot.getInPossessionTask()),
                schedule.daysAfter(eventIndex, config.getFinalRestDays()));

        double value = 0.0;
        double discount = 1.0;
        for (int m = eventIndex + 1; m <= last; m++) {
            discount *= config.getDiscountFactor();
            Event future = schedule.get(m);
            double[][] scores = ahead.get(m - eventIndex - 1);
            int target = argMax(scores[row]);
            boolean startsAgain = false;
            Participation next = Participation.rested();
            if (target >= 0) {
                List<TaskSlot> slots = future.getFormation().getSlots();
                TaskSlot futureSlot = slots.get(target);
                double replacement = replacementScore(scores, row, target, sameTaskSlots(slots, futureSlot));
                double restedGss = scores[row][target];
                double playedGss = scoringService.gss(played, futureSlot, future.getImportance(), config);
                value += discount * config.getImportanceWeight(future.getImportance())
                        * (Math.max(0.0, restedGss - replacement) - Math.max(0.0, playedGss - replacement));
                startsAgain = played.getReadiness() >= config.getReadinessFloor() && playedGss > replacement;
                if (startsAgain) {
                    next = Participation.played(config.getDefaultMinutes(), future.getImportance(),
                            futureSlot.getInPossessionTask());
                }
            }
            if (m < last) {
                played = propagationEngine.propagate(played, next, schedule.daysAfter(m, config.getFinalRestDays()));
            }
        }
        return Math.max(0.0, value);
    }

    /**
     * Scores of the whole roster at each later event, every worker rested from now until then.
     */
    private List<double[][]> scoreRestedAhead(List<Worker> roster, EventSchedule schedule, int eventIndex, int last,
                                             PlannerConfig config) {
        List<double[][]> ahead = new ArrayList<>();
        List<Worker> states = roster;
        for (int m = eventIndex + 1; m <= last; m++) {
            int days = schedule.daysAfter(m - 1, config.getFinalRestDays());
            List<Worker> rested = new ArrayList<>(states.size());
            for (Worker worker : states) {
                rested.add(propagationEngine.rest(worker, days));
            }
            states = rested;
            ahead.add(scoreMatrix(states, schedule.get(m), config));
        }
        return ahead;
    }

    // GSS of every candidate at the event, 0 for workers who cannot play
    private double[][] scoreMatrix(List<Worker> workers, Event event, PlannerConfig config) {
        List<TaskSlot> slots = event.getFormation().getSlots();
        double[][] scores = new double[workers.size()][slots.size()];
        for (int i = 0; i < workers.size(); i++) {
            Worker worker = workers.get(i);
            if (!canPlay(worker, event.getConstraints())) {
                continue;
            }
            for (int j = 0; j < slots.size(); j++) {
                scores[i][j] = scoringService.gss(worker, slots.get(j), event.getImportance(), config);
            }
        }
        return scores;
    }

    /**
     * Relative gap to the first alternative not needed elsewhere, maximised over the slots the worker could fill.
     */
    private static double calculateScarcity(int row, double[][] scores, List<TaskSlot> slots) {
        double scarcity = 0.0;
        for (int j = 0; j < slots.size(); j++) {
            double own = scores[row][j];
            if (own <= 0) {
                continue;
            }
            double replacement = replacementScore(scores, row, j, sameTaskSlots(slots, slots.get(j)));
            scarcity = Math.max(scarcity, Math.max(0.0, Math.min(1.0, 1 - replacement / own)));
        }
        return scarcity;
    }

    /**
     * The {@code needed}-th best score in the column among the other workers, 0 when there are too few.
     * The better ones fill the remaining slots that share the column's tasks.
     */
    private static double replacementScore(double[][] scores, int row, int column, int needed) {
        List<Double> others = new ArrayList<>(scores.length);
        for (int i = 0; i < scores.length; i++) {
            if (i != row && scores[i][column] > 0) {
                others.add(scores[i][column]);
            }
        }
        if (others.size() < needed) {
            return 0.0;
        }
        others.sort(Collections.reverseOrder());
        return others.get(needed - 1);
    }

    private static int sameTaskSlots(List<TaskSlot> slots, TaskSlot slot) {
        int count = 0;
        for (TaskSlot other : slots) {
            if (other.getInPossessionTask().equals(slot.getInPossessionTask())
                    && other.getOutOfPossessionTask().equals(slot.getOutOfPossessionTask())) {
                count++;
            }
        }
        return count;
    }

    private static int argMax(double[] values) {
        int best = -1;
        for (int j = 0; j < values.length; j++) {
            if (values[j] > 0 && (best < 0 || values[j] > values[best])) {
                best = j;
            }
        }
        return best;
    }

    private static boolean canPlay(Worker worker, ConstraintSet constraints) {
        return worker.isAvailable() && !constraints.isForcedRest(worker.getId());
    }
}
