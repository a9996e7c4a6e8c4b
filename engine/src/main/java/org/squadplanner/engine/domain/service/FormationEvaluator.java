package org.squadplanner.engine.domain.service;

import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.engine.domain.model.FormationResult;
import org.squadplanner.engine.domain.model.HorizonPlan;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Formation;
import org.squadplanner.simulation.model.PlanningException;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Plans the same horizon in several candidate formations in parallel and ranks them by total GSS.
 * Each run works on its own immutable copy of the roster, so runs share no mutable state.
 */
public final class FormationEvaluator implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(FormationEvaluator.class.getName());

    private final HorizonPlanner planner;
    private final ExecutorService executor;

    public FormationEvaluator(HorizonPlanner planner, int threads) {
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "formation-evaluator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Plans every event of the horizon in each candidate formation.
     *
     * @return one result per candidate; feasible plans first, best total GSS first
     */
    public List<FormationResult> evaluate(List<Worker> roster, List<Event> events, List<Formation> candidates,
                                          AssignmentHistory history, PlannerConfig config) {
        Objects.requireNonNull(candidates, "candidates must not be null");
        List<Worker> snapshot = Collections.unmodifiableList(new ArrayList<>(roster));

        List<Future<FormationResult>> futures = new ArrayList<>();
        for (Formation formation : candidates) {
            List<Event> reshaped = events.stream()
                    .map(e -> e.withFormation(formation))
                    .collect(Collectors.toList());
            futures.add(executor.submit(() -> planIn(formation, snapshot, reshaped, history, config)));
        }

        List<FormationResult> results = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), candidates.get(i)));
        }
        Collections.sort(results);
        LOG.info(() -> "Formation ranking: " + results);
        return results;
    }

    private FormationResult planIn(Formation formation, List<Worker> roster, List<Event> events,
                                   AssignmentHistory history, PlannerConfig config) {
        try {
            HorizonPlan plan = planner.plan(roster, events, history, config);
            return FormationResult.success(formation.getName(), plan);
        } catch (PlanningException e) {
            LOG.log(Level.WARNING, e, () -> "Formation " + formation.getName() + " cannot be planned");
            return FormationResult.failure(formation.getName(), e.getMessage());
        }
    }

    private static FormationResult await(Future<FormationResult> future, Formation formation) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while evaluating " + formation.getName(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("evaluation of " + formation.getName() + " failed", e.getCause());
        }
    }

    /**
     * Stop the worker threads.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
