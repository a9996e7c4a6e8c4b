package org.squadplanner.engine.domain.service;

import org.junit.jupiter.api.Test;
import org.squadplanner.engine.SquadFixtures;
import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.engine.domain.model.FormationResult;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.simulation.engine.StatePropagationEngine;
import org.squadplanner.simulation.engine.StatePropagationEngineImpl;
import org.squadplanner.simulation.model.ConstraintSet;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Formation;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.Worker;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormationEvaluatorTest {

    private final ScoringService scoring = new ScoringServiceImpl();
    private final StatePropagationEngine engine = new StatePropagationEngineImpl();
    private final HorizonPlanner planner = new HorizonPlannerImpl(
            new ShadowPricingServiceImpl(scoring, engine), new AssignmentServiceImpl(scoring), engine);
    private final PlannerConfig config = PlannerConfig.defaults();
    private final Formation fourFourTwo = SquadFixtures.fourFourTwo();
    private final Formation fourThreeThree = SquadFixtures.fourThreeThree();

    @Test
    void formationMatchingTheSquadRanksFirst() {
        // No attacking midfielders in a squad built for 4-4-2
        List<Worker> squad = SquadFixtures.squad(fourFourTwo, 150, 130);
        List<Event> events = SquadFixtures.schedule(fourFourTwo, new int[]{0, 3, 7},
                Importance.MEDIUM, Importance.MEDIUM, Importance.HIGH);

        List<FormationResult> ranking;
        try (FormationEvaluator evaluator = new FormationEvaluator(planner, 2)) {
            ranking = evaluator.evaluate(squad, events, Arrays.asList(fourThreeThree, fourFourTwo),
                    AssignmentHistory.empty(), config);
        }

        assertEquals(2, ranking.size());
        assertEquals("4-4-2", ranking.get(0).getFormationName());
        assertEquals("4-3-3", ranking.get(1).getFormationName());
        assertTrue(ranking.get(0).isFeasible());
        assertTrue(ranking.get(0).getTotalGss() > ranking.get(1).getTotalGss());
        assertEquals(3, ranking.get(0).getPlan().get().getAssignments().size());
    }

    @Test
    void formationThatCannotBePlannedIsReportedNotThrown() {
        List<Worker> squad = SquadFixtures.squad(fourFourTwo, 150, 130);
        // ML exists only in 4-4-2
        Event event = SquadFixtures.event("e0", 0, Importance.MEDIUM, fourFourTwo,
                ConstraintSet.builder().lock("ML-0", "ML").build());

        List<FormationResult> ranking;
        try (FormationEvaluator evaluator = new FormationEvaluator(planner, 1)) {
            ranking = evaluator.evaluate(squad, Collections.singletonList(event),
                    Arrays.asList(fourThreeThree, fourFourTwo), AssignmentHistory.empty(), config);
        }

        assertTrue(ranking.get(0).isFeasible());
        FormationResult failed = ranking.get(1);
        assertEquals("4-3-3", failed.getFormationName());
        assertFalse(failed.isFeasible());
        assertFalse(failed.getPlan().isPresent());
        assertTrue(failed.getFailure().get().contains("ML"));
        assertEquals(0.0, failed.getTotalGss(), 0.0);
    }

    @Test
    void threadCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new FormationEvaluator(planner, 0));
    }
}
