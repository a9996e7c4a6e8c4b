package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.error.InfeasibleAssignmentException;
import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.engine.domain.model.CellCost;
import org.squadplanner.engine.domain.model.CostMatrix;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ScoreBreakdown;
import org.squadplanner.engine.domain.model.ShadowPrice;
import org.squadplanner.simulation.model.ConstraintSet;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.Pin;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds the square cost matrix of one event.
 *
 * Play cell (lower = better):
 *   cost = -GSS - development_bonus
 *        + shadow_scale[importance] x shadow_price
 *        + stability (-continuity_bonus if same slot as last event, +switch_cost otherwise,
 *                     + anchor_multiplier x switch_cost when leaving a long-held slot)
 *
 * Rest cell:
 *   cost = rest_utility_weight x mean eligible GSS
 *        - relief_weight[importance] x best_base x ((1 - load_multiplier) + (1 - readiness))
 *        + need_weight[importance] x best_base x (1 - sharpness)
 *
 * Hard constraints replace the cell total with the forbidden cost.
 */
public final class CostMatrixBuilder {

    private static final Logger LOG = Logger.getLogger(CostMatrixBuilder.class.getName());

    private final ScoringService scoringService;

    public CostMatrixBuilder(ScoringService scoringService) {
        this.scoringService = Objects.requireNonNull(scoringService, "scoringService must not be null");
    }

    /**
     * @throws InfeasibleAssignmentException when the roster is smaller than the formation or some slot
     *         has no permitted worker at all
     */
    public CostMatrix build(Event event, List<Worker> roster, Map<String, ShadowPrice> shadowPrices,
                            AssignmentHistory history, PlannerConfig config) {
        List<TaskSlot> slots = event.getFormation().getSlots();
        int n = roster.size();
        if (n < slots.size()) {
            throw new InfeasibleAssignmentException(event.getId(), slots.get(n).getId(),
                    "roster has " + n + " workers for " + slots.size() + " slots", Collections.emptyMap());
        }

        ConstraintSet constraints = event.getConstraints();
        Importance importance = event.getImportance();
        double forbidden = config.getForbiddenCost();
        boolean goalkeeperAvailable = hasEligibleGoalkeeper(event, roster, config);
        List<String> relaxations = new ArrayList<>();
        if (!goalkeeperAvailable) {
            String note = "no eligible goalkeeper for " + event.getId() + ", goalkeeper slot opened to all workers";
            relaxations.add(note);
            LOG.warning(note);
        }

        CellCost[][] cells = new CellCost[n][n];
        ScoreBreakdown[][] scores = new ScoreBreakdown[n][slots.size()];

        for (int i = 0; i < n; i++) {
            Worker worker = roster.get(i);
            double shadow = shadowPrices.containsKey(worker.getId())
                    ? shadowPrices.get(worker.getId()).getValue() : 0.0;
            String restReason = restReason(worker, constraints);
            Optional<Pin> lock = constraints.findLock(worker.getId());

            double eligibleUtility = 0.0;
            int eligibleCount = 0;
            double bestBase = 0.0;
            for (int j = 0; j < slots.size(); j++) {
                TaskSlot slot = slots.get(j);
                ScoreBreakdown score = scoringService.score(worker, slot, importance, config);
                scores[i][j] = score;
                bestBase = Math.max(bestBase, score.getBaseRating());

                CellCost cell = CellCost.play(
                        -score.getGss() - score.getDevelopmentBonus(),
                        config.getShadowScale(importance) * shadow,
                        calculateStabilityCost(worker.getId(), slot.getId(), history, config));
                String reason = playReason(worker, slot, score, restReason, lock, constraints, goalkeeperAvailable);
                if (reason != null) {
                    cells[i][j] = cell.forbid(forbidden, reason);
                } else {
                    cells[i][j] = cell;
                    eligibleUtility += score.getGss();
                    eligibleCount++;
                }
            }

            CellCost rest = restReason != null
                    ? CellCost.rest(0.0)
                    : CellCost.rest(calculateRestCost(worker, eligibleCount == 0 ? 0.0 : eligibleUtility / eligibleCount,
                    bestBase, importance, config));
            if (lock.isPresent()) {
                rest = rest.forbid(forbidden, "locked to " + lock.get().getSlotId());
            }
            for (int j = slots.size(); j < n; j++) {
                cells[i][j] = rest;
            }
        }

        applyLocks(event, roster, cells);
        checkEverySlotHasCandidate(event, roster, cells);

        LOG.fine(() -> String.format("Built %dx%d cost matrix for %s (%d rest sinks)",
                n, n, event.getId(), n - slots.size()));
        return new CostMatrix(event, roster, cells, scores, relaxations);
    }

    /**
     * Continuity discount for keeping last event's slot, switch penalty otherwise.
     * Leaving a slot held for the anchor threshold adds a fixed anchor penalty that the stability weight does not scale.
     */
    private double calculateStabilityCost(String workerId, String slotId, AssignmentHistory history,
                                          PlannerConfig config) {
        Optional<String> previous = history.previousSlot(workerId);
        if (!previous.isPresent()) {
            return 0.0;
        }
        double weight = config.getStabilityWeight();
        if (previous.get().equals(slotId)) {
            return -weight * config.getContinuityBonus();
        }
        double cost = weight * config.getSwitchCost();
        if (history.consecutiveInSlot(workerId, previous.get()) >= config.getAnchorThreshold()) {
            cost += config.getAnchorMultiplier() * config.getSwitchCost();
        }
        return cost;
    }

    private double calculateRestCost(Worker worker, double averageUtility, double bestBase,
                                     Importance importance, PlannerConfig config) {
        double relief = (1 - config.getLoadMultiplier(worker.getLoad())) + (1 - worker.getReadiness());
        double need = 1 - worker.getSharpness();
        return config.getRestUtilityWeight() * averageUtility
                - config.getReliefWeight(importance) * bestBase * relief
                + config.getNeedWeight(importance) * bestBase * need;
    }

    private static String restReason(Worker worker, ConstraintSet constraints) {
        if (worker.isInjured()) {
            return "injured";
        }
        if (worker.isSuspended()) {
            return "suspended";
        }
        if (constraints.isForcedRest(worker.getId())) {
            return "forced rest";
        }
        return null;
    }

    private static String playReason(Worker worker, TaskSlot slot, ScoreBreakdown score, String restReason,
                                     Optional<Pin> lock, ConstraintSet constraints, boolean goalkeeperAvailable) {
        if (restReason != null) {
            return restReason;
        }
        if (score.isBelowReadinessFloor() && !constraints.isOverrideReadinessFloor()) {
            return "readiness below floor";
        }
        if (lock.isPresent()) {
            return lock.get().getSlotId().equals(slot.getId()) ? null : "locked to " + lock.get().getSlotId();
        }
        for (Pin other : constraints.getLocks()) {
            if (other.getSlotId().equals(slot.getId())) {
                return "slot locked for " + other.getWorkerId();
            }
        }
        if (constraints.isRejected(worker.getId(), slot.getId())) {
            return "rejected";
        }
        if (slot.isGoalkeeper() && !worker.isGoalkeeper() && goalkeeperAvailable) {
            return "not a goalkeeper";
        }
        return null;
    }

    /**
     * An eligible goalkeeper is one who could legally take the goalkeeper slot.
     */
    private static boolean hasEligibleGoalkeeper(Event event, List<Worker> roster, PlannerConfig config) {
        ConstraintSet constraints = event.getConstraints();
        TaskSlot slot = event.getFormation().getSlots().stream()
                .filter(TaskSlot::isGoalkeeper)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("formation without goalkeeper slot"));
        for (Worker worker : roster) {
            if (!worker.isGoalkeeper() || restReason(worker, constraints) != null) {
                continue;
            }
            if (worker.getReadiness() < config.getReadinessFloor() && !constraints.isOverrideReadinessFloor()) {
                continue;
            }
            if (constraints.isRejected(worker.getId(), slot.getId())) {
                continue;
            }
            Optional<Pin> lock = constraints.findLock(worker.getId());
            if (lock.isPresent() && !lock.get().getSlotId().equals(slot.getId())) {
                continue;
            }
            return true;
        }
        return false;
    }

    /**
     * Locked cell goes below every other finite cost so the solver always takes it.
     */
    private static void applyLocks(Event event, List<Worker> roster, CellCost[][] cells) {
        double minFinite = 0.0;
        for (CellCost[] row : cells) {
            for (CellCost cell : row) {
                if (!cell.isForbidden()) {
                    minFinite = Math.min(minFinite, cell.getTotal());
                }
            }
        }
        List<TaskSlot> slots = event.getFormation().getSlots();
        for (Pin lock : event.getConstraints().getLocks()) {
            int row = indexOf(roster, lock.getWorkerId());
            int column = event.getFormation().indexOf(lock.getSlotId());
            if (row >= 0 && column >= 0 && !cells[row][column].isForbidden()) {
                cells[row][column] = cells[row][column].pin(minFinite - 1.0);
                LOG.fine(() -> "Locked " + lock.getWorkerId() + " into " + slots.get(column).getId());
            }
        }
    }

    private static void checkEverySlotHasCandidate(Event event, List<Worker> roster, CellCost[][] cells) {
        List<TaskSlot> slots = event.getFormation().getSlots();
        for (int j = 0; j < slots.size(); j++) {
            Map<String, String> reasons = new LinkedHashMap<>();
            boolean candidate = false;
            for (int i = 0; i < roster.size(); i++) {
                if (cells[i][j].isForbidden()) {
                    reasons.put(roster.get(i).getId(), cells[i][j].getForbiddenReason());
                } else {
                    candidate = true;
                    break;
                }
            }
            if (!candidate) {
                throw new InfeasibleAssignmentException(event.getId(), slots.get(j).getId(),
                        "no eligible worker", reasons);
            }
        }
    }

    private static int indexOf(List<Worker> roster, String workerId) {
        for (int i = 0; i < roster.size(); i++) {
            if (roster.get(i).getId().equals(workerId)) {
                return i;
            }
        }
        return -1;
    }
}
