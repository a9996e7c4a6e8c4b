package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.error.InfeasibleAssignmentException;
import org.squadplanner.engine.domain.model.Assignment;
import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.engine.domain.model.CellCost;
import org.squadplanner.engine.domain.model.CostMatrix;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.model.ShadowPrice;
import org.squadplanner.engine.domain.model.SlotAssignment;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Pin;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.Worker;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Implementation of AssignmentService.
 * Validates constraints, builds the cost matrix, solves it and verifies no forbidden cell was used.
 */
public final class AssignmentServiceImpl implements AssignmentService {

    private static final Logger LOG = Logger.getLogger(AssignmentServiceImpl.class.getName());

    private final ConstraintValidator validator;
    private final CostMatrixBuilder matrixBuilder;
    private final AssignmentSolver solver;

    public AssignmentServiceImpl(ConstraintValidator validator, CostMatrixBuilder matrixBuilder,
                                 AssignmentSolver solver) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.matrixBuilder = Objects.requireNonNull(matrixBuilder, "matrixBuilder must not be null");
        this.solver = Objects.requireNonNull(solver, "solver must not be null");
    }

    public AssignmentServiceImpl(ScoringService scoringService) {
        this(new ConstraintValidator(), new CostMatrixBuilder(scoringService), new HungarianAssignmentSolver());
    }

    @Override
    public Assignment assign(Event event, List<Worker> roster, Map<String, ShadowPrice> shadowPrices,
                             AssignmentHistory history, PlannerConfig config) {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(roster, "roster must not be null");
        Objects.requireNonNull(shadowPrices, "shadowPrices must not be null");
        Objects.requireNonNull(history, "history must not be null");
        Objects.requireNonNull(config, "config must not be null");

        validator.validate(event, roster);
        CostMatrix matrix = matrixBuilder.build(event, roster, shadowPrices, history, config);
        int[] columns = solver.solve(matrix.toArray());
        verify(matrix, columns);

        Assignment assignment = toAssignment(matrix, columns, shadowPrices);
        LOG.fine(() -> "Solved " + assignment);
        return assignment;
    }

    private static void verify(CostMatrix matrix, int[] columns) {
        Event event = matrix.getEvent();
        for (int row = 0; row < columns.length; row++) {
            CellCost chosen = matrix.cell(row, columns[row]);
            if (!chosen.isForbidden()) {
                continue;
            }
            String slotId = blockedSlot(matrix, row, columns[row]);
            int column = event.getFormation().indexOf(slotId);
            Map<String, String> reasons = new LinkedHashMap<>();
            for (int i = 0; i < matrix.size(); i++) {
                CellCost cell = matrix.cell(i, column);
                reasons.put(matrix.getWorkers().get(i).getId(),
                        cell.isForbidden() ? cell.getForbiddenReason() : "needed elsewhere");
            }
            throw new InfeasibleAssignmentException(event.getId(), slotId,
                    "no lineup satisfies every hard constraint", reasons);
        }
    }

    /**
     * Slot to blame for a forbidden pick: the slot itself, or the slot a worker forced off rest was locked to.
     */
    private static String blockedSlot(CostMatrix matrix, int row, int column) {
        if (!matrix.isRestColumn(column)) {
            return matrix.getSlots().get(column).getId();
        }
        String workerId = matrix.getWorkers().get(row).getId();
        Optional<Pin> lock = matrix.getEvent().getConstraints().findLock(workerId);
        return lock.map(Pin::getSlotId).orElse(matrix.getSlots().get(0).getId());
    }

    private static Assignment toAssignment(CostMatrix matrix, int[] columns, Map<String, ShadowPrice> shadowPrices) {
        List<TaskSlot> slots = matrix.getSlots();
        SlotAssignment[] filled = new SlotAssignment[slots.size()];
        Set<String> rested = new LinkedHashSet<>();
        double total = 0.0;
        for (int row = 0; row < columns.length; row++) {
            int column = columns[row];
            Worker worker = matrix.getWorkers().get(row);
            total += matrix.cell(row, column).getTotal();
            if (matrix.isRestColumn(column)) {
                rested.add(worker.getId());
            } else {
                filled[column] = new SlotAssignment(slots.get(column), worker.getId(),
                        matrix.score(row, column), matrix.cell(row, column));
            }
        }
        Map<String, Double> shadows = new LinkedHashMap<>();
        for (Worker worker : matrix.getWorkers()) {
            ShadowPrice price = shadowPrices.get(worker.getId());
            shadows.put(worker.getId(), price != null ? price.getValue() : 0.0);
        }
        return new Assignment(matrix.getEvent().getId(), matrix.getEvent().getImportance(),
                Arrays.asList(filled), rested, shadows, matrix.getRelaxations(), total);
    }
}
