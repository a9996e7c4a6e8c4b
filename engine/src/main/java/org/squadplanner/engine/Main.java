package org.squadplanner.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.squadplanner.engine.api.ParameterApiClientImpl;
import org.squadplanner.engine.api.ParameterFileSource;
import org.squadplanner.engine.api.ParameterSource;
import org.squadplanner.engine.api.dto.HorizonPlanDto;
import org.squadplanner.engine.api.dto.ParameterSetDto;
import org.squadplanner.engine.api.dto.PlanningRequestDto;
import org.squadplanner.engine.cache.ParameterCache;
import org.squadplanner.engine.cache.ParameterCacheImpl;
import org.squadplanner.engine.config.EngineConfig;
import org.squadplanner.engine.domain.model.FormationResult;
import org.squadplanner.engine.domain.model.HorizonPlan;
import org.squadplanner.engine.domain.model.PlannerConfig;
import org.squadplanner.engine.domain.service.AssignmentServiceImpl;
import org.squadplanner.engine.domain.service.FormationEvaluator;
import org.squadplanner.engine.domain.service.HorizonPlanner;
import org.squadplanner.engine.domain.service.HorizonPlannerImpl;
import org.squadplanner.engine.domain.service.ScoringService;
import org.squadplanner.engine.domain.service.ScoringServiceImpl;
import org.squadplanner.engine.domain.service.ShadowPricingServiceImpl;
import org.squadplanner.engine.io.PlanMapper;
import org.squadplanner.engine.io.PlanningJson;
import org.squadplanner.engine.io.PlanningRequest;
import org.squadplanner.engine.io.RequestMapper;
import org.squadplanner.simulation.engine.StatePropagationEngine;
import org.squadplanner.simulation.engine.StatePropagationEngineImpl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Batch entry point of the squad planner.
 *
 * Usage: {@code Main <request.json> <plan.json>}
 *
 * Reads a roster snapshot with the upcoming events, plans the horizon and writes one lineup per
 * event with its cost components and the forecast worker states. When the request lists
 * candidate formations, each is planned in parallel and the best feasible plan is written
 * together with the ranking.
 */
public final class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    public static void main(String[] args) {
        try {
            new Main().run(args);
        } catch (Exception e) {
            LOG.log(Level.SEVERE, "Planning run failed", e);
            System.exit(1);
        }
    }

    private void run(String[] args) throws IOException {
        if (args.length != 2) {
            throw new IllegalArgumentException("usage: Main <request.json> <plan.json>");
        }
        Path requestFile = Paths.get(args[0]);
        Path planFile = Paths.get(args[1]);

        LOG.info("=== Squad Planner ===");

        EngineConfig config = EngineConfig.fromEnvironment();
        LOG.info(() -> "Configuration: " + config);
        configureLogging(config);

        ParameterCache cache = new ParameterCacheImpl(parameterSource(config));
        cache.refresh();
        if (!cache.isInitialized()) {
            LOG.warning("Parameters not loaded, using defaults");
        }
        PlannerConfig plannerConfig = cache.getConfig();

        StatePropagationEngine propagationEngine =
                new StatePropagationEngineImpl(plannerConfig.toPropagationParameters());
        ScoringService scoringService = new ScoringServiceImpl();
        HorizonPlanner planner = new HorizonPlannerImpl(
                new ShadowPricingServiceImpl(scoringService, propagationEngine),
                new AssignmentServiceImpl(scoringService),
                propagationEngine);

        ObjectMapper mapper = PlanningJson.mapper();
        PlanningRequestDto requestDto = mapper.readValue(requestFile.toFile(), PlanningRequestDto.class);
        PlanningRequest request = new RequestMapper(propagationEngine).toDomain(requestDto);

        HorizonPlanDto output;
        if (request.hasCandidateFormations()) {
            try (FormationEvaluator evaluator = new FormationEvaluator(planner, config.getThreads())) {
                List<FormationResult> ranked = evaluator.evaluate(request.getRoster(), request.getEvents(),
                        request.getCandidateFormations(), request.getHistory(), plannerConfig);
                output = PlanMapper.toDto(ranked);
            }
        } else {
            HorizonPlan plan = planner.plan(request.getRoster(), request.getEvents(), request.getHistory(),
                    plannerConfig);
            output = PlanMapper.toDto(request.getEvents().get(0).getFormation().getName(), plan);
        }

        Path target = planFile.toAbsolutePath();
        if (target.getParent() != null) {
            Files.createDirectories(target.getParent());
        }
        mapper.writeValue(target.toFile(), output);
        LOG.info(() -> "Plan written to " + target);
    }

    private static ParameterSource parameterSource(EngineConfig config) {
        if (config.hasParameterApi()) {
            LOG.info(() -> "Parameter API configured for: " + config.getParameterApiUrl());
            return new ParameterApiClientImpl(config.getParameterApiUrl(), config.getParameterApiToken());
        }
        if (config.hasParameterFile()) {
            return new ParameterFileSource(Paths.get(config.getParameterFile()));
        }
        return new BuiltInParameters();
    }

    /**
     * Configure file logging if enabled.
     */
    private void configureLogging(EngineConfig config) {
        Logger root = Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = Paths.get(config.getLogFilePath()).toAbsolutePath();

        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
            LOG.info(() -> "File logging enabled: " + target);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }

    /**
     * Source used when neither an API nor a file is configured.
     */
    private static final class BuiltInParameters implements ParameterSource {
        @Override
        public ParameterSetDto fetchParameters() {
            return new ParameterSetDto();
        }

        @Override
        public String describe() {
            return "built-in defaults";
        }
    }
}
