package org.squadplanner.engine.io;

import org.squadplanner.engine.api.dto.EventDto;
import org.squadplanner.engine.api.dto.PlanningRequestDto;
import org.squadplanner.engine.api.dto.WorkerDto;
import org.squadplanner.engine.domain.model.AssignmentHistory;
import org.squadplanner.simulation.engine.StatePropagationEngine;
import org.squadplanner.simulation.model.Appearance;
import org.squadplanner.simulation.model.ConstraintSet;
import org.squadplanner.simulation.model.Event;
import org.squadplanner.simulation.model.Formation;
import org.squadplanner.simulation.model.Importance;
import org.squadplanner.simulation.model.LoadCategory;
import org.squadplanner.simulation.model.TaskSlot;
import org.squadplanner.simulation.model.TrainingIntensity;
import org.squadplanner.simulation.model.ValidationException;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Maps a planning request document to the domain model.
 * Missing optional state falls back to the worker defaults; an absent load category is derived
 * from the appearance window.
 */
public final class RequestMapper {

    private static final Logger LOG = Logger.getLogger(RequestMapper.class.getName());

    private final StatePropagationEngine propagationEngine;

    public RequestMapper(StatePropagationEngine propagationEngine) {
        this.propagationEngine = Objects.requireNonNull(propagationEngine, "propagationEngine must not be null");
    }

    public PlanningRequest toDomain(PlanningRequestDto dto) {
        Objects.requireNonNull(dto, "dto must not be null");
        if (dto.getWorkers() == null || dto.getWorkers().isEmpty()) {
            throw new ValidationException("request has no workers");
        }
        if (dto.getEvents() == null || dto.getEvents().isEmpty()) {
            throw new ValidationException("request has no events");
        }

        List<Worker> roster = new ArrayList<>();
        for (WorkerDto w : dto.getWorkers()) {
            roster.add(toWorker(w));
        }
        List<Event> events = new ArrayList<>();
        for (EventDto e : dto.getEvents()) {
            events.add(toEvent(e));
        }
        List<Formation> candidates = new ArrayList<>();
        if (dto.getCandidateFormations() != null) {
            for (EventDto.FormationDto f : dto.getCandidateFormations()) {
                candidates.add(toFormation(f, "candidate"));
            }
        }
        AssignmentHistory history = dto.getPreviousLineup() == null
                ? AssignmentHistory.empty()
                : AssignmentHistory.fromPrevious(dto.getPreviousLineup());

        LOG.info(() -> String.format("Mapped request: %d workers, %d events, %d candidate formations",
                roster.size(), events.size(), candidates.size()));
        return new PlanningRequest(roster, events, history, candidates);
    }

    Worker toWorker(WorkerDto dto) {
        if (dto.getId() == null || dto.getId().trim().isEmpty()) {
            throw new ValidationException("worker without id");
        }
        Worker.Builder builder = new Worker.Builder()
                .id(dto.getId())
                .name(dto.getName() != null ? dto.getName() : dto.getId())
                .goalkeeper(dto.isGoalkeeper())
                .consecutiveAppearances(dto.getConsecutiveAppearances())
                .daysSinceLastAppearance(dto.getDaysSinceLastAppearance())
                .injured(dto.isInjured())
                .suspended(dto.isSuspended());
        if (dto.getAge() != null) {
            builder.age(dto.getAge());
        }
        if (dto.getNaturalFitness() != null) {
            builder.naturalFitness(dto.getNaturalFitness());
        }
        if (dto.getStamina() != null) {
            builder.stamina(dto.getStamina());
        }
        if (dto.getTrainingIntensity() != null) {
            builder.trainingIntensity(parseEnum(TrainingIntensity.class, dto.getTrainingIntensity(), dto.getId()));
        }
        if (dto.getReadiness() != null) {
            builder.readiness(dto.getReadiness());
        }
        if (dto.getSharpness() != null) {
            builder.sharpness(dto.getSharpness());
        }

        Map<String, WorkerDto.FamiliarityDto> familiarity = dto.getFamiliarity() != null
                ? dto.getFamiliarity() : Collections.<String, WorkerDto.FamiliarityDto>emptyMap();
        if (dto.getRatings() != null) {
            for (Map.Entry<String, Double> rating : dto.getRatings().entrySet()) {
                WorkerDto.FamiliarityDto f = familiarity.get(rating.getKey());
                if (f == null) {
                    // Rated tasks without familiarity data count as fully learned
                    builder.natural(rating.getKey(), rating.getValue());
                } else {
                    builder.rating(rating.getKey(), rating.getValue())
                            .familiarity(rating.getKey(), f.getInPossession(), f.getOutOfPossession());
                }
            }
        }

        List<Appearance> appearances = new ArrayList<>();
        if (dto.getAppearances() != null) {
            for (WorkerDto.AppearanceDto a : dto.getAppearances()) {
                appearances.add(new Appearance(a.getDaysAgo(), a.getMinutes()));
            }
        }
        builder.appearances(appearances);

        if (dto.getLoad() != null) {
            return builder.load(parseEnum(LoadCategory.class, dto.getLoad(), dto.getId())).build();
        }
        Worker unclassified = builder.build();
        return builder.load(propagationEngine.classifyLoad(unclassified)).build();
    }

    Event toEvent(EventDto dto) {
        if (dto.getId() == null || dto.getDate() == null) {
            throw new ValidationException("event requires id and date", String.valueOf(dto.getId()));
        }
        if (dto.getFormation() == null) {
            throw new ValidationException("event " + dto.getId() + " has no formation", dto.getId());
        }
        return new Event(dto.getId(), dto.getDate(), parseImportance(dto.getImportance(), dto.getId()),
                toFormation(dto.getFormation(), dto.getId()), toConstraints(dto.getConstraints()));
    }

    Formation toFormation(EventDto.FormationDto dto, String ownerId) {
        if (dto.getSlots() == null) {
            throw new ValidationException("formation without slots", ownerId);
        }
        List<TaskSlot> slots = new ArrayList<>();
        for (EventDto.SlotDto s : dto.getSlots()) {
            String ip = s.getInPossessionTask() != null ? s.getInPossessionTask() : s.getTask();
            String oop = s.getOutOfPossessionTask() != null ? s.getOutOfPossessionTask() : s.getTask();
            if (s.getId() == null || ip == null || oop == null) {
                throw new ValidationException("slot requires id and tasks", ownerId);
            }
            slots.add(new TaskSlot(s.getId(), ip, oop, s.isGoalkeeper()));
        }
        return new Formation(dto.getName() != null ? dto.getName() : ownerId, slots);
    }

    static ConstraintSet toConstraints(EventDto.ConstraintsDto dto) {
        if (dto == null) {
            return ConstraintSet.empty();
        }
        ConstraintSet.Builder builder = ConstraintSet.builder()
                .overrideReadinessFloor(dto.isOverrideReadinessFloor());
        if (dto.getForcedRest() != null) {
            for (String workerId : dto.getForcedRest()) {
                builder.forceRest(workerId);
            }
        }
        if (dto.getLocks() != null) {
            for (EventDto.PinDto pin : dto.getLocks()) {
                builder.lock(pin.getWorkerId(), pin.getSlotId());
            }
        }
        if (dto.getRejections() != null) {
            for (EventDto.PinDto pin : dto.getRejections()) {
                builder.reject(pin.getWorkerId(), pin.getSlotId());
            }
        }
        return builder.build();
    }

    /**
     * Accepts "High", "medium", "Sharpness-building" and similar spellings.
     */
    static Importance parseImportance(String value, String ownerId) {
        if (value == null) {
            throw new ValidationException("event importance is missing", ownerId);
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if (normalized.startsWith("SHARPNESS")) {
            return Importance.SHARPNESS;
        }
        return parseEnum(Importance.class, normalized, ownerId);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String ownerId) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown " + type.getSimpleName() + " " + value, ownerId);
        }
    }
}
