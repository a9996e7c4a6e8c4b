package org.squadplanner.engine.io;

import org.squadplanner.engine.api.dto.HorizonPlanDto;
import org.squadplanner.engine.domain.model.Assignment;
import org.squadplanner.engine.domain.model.CellCost;
import org.squadplanner.engine.domain.model.FormationResult;
import org.squadplanner.engine.domain.model.HorizonPlan;
import org.squadplanner.engine.domain.model.ScoreBreakdown;
import org.squadplanner.engine.domain.model.SlotAssignment;
import org.squadplanner.simulation.model.Worker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Maps a horizon plan to its output document.
 */
public final class PlanMapper {

    private PlanMapper() {
    }

    public static HorizonPlanDto toDto(String formation, HorizonPlan plan) {
        HorizonPlanDto dto = new HorizonPlanDto();
        dto.setFormation(formation);
        dto.setTotalGss(plan.getTotalGss());

        List<HorizonPlanDto.EventPlanDto> events = new ArrayList<>();
        for (Assignment assignment : plan.getAssignments()) {
            events.add(toEventDto(assignment));
        }
        dto.setEvents(events);

        List<Map<String, HorizonPlanDto.WorkerStateDto>> trajectory = new ArrayList<>();
        for (Map<String, Worker> states : plan.getTrajectory()) {
            Map<String, HorizonPlanDto.WorkerStateDto> point = new TreeMap<>();
            for (Worker worker : states.values()) {
                point.put(worker.getId(), toStateDto(worker));
            }
            trajectory.add(point);
        }
        dto.setTrajectory(trajectory);
        return dto;
    }

    /**
     * Maps the best feasible result and attaches the ranking of every candidate.
     */
    public static HorizonPlanDto toDto(List<FormationResult> ranked) {
        HorizonPlanDto dto = ranked.stream()
                .filter(FormationResult::isFeasible)
                .findFirst()
                .map(best -> toDto(best.getFormationName(), best.getPlan().get()))
                .orElseGet(HorizonPlanDto::new);

        List<HorizonPlanDto.FormationRankDto> ranking = new ArrayList<>();
        for (FormationResult result : ranked) {
            HorizonPlanDto.FormationRankDto rank = new HorizonPlanDto.FormationRankDto();
            rank.setFormation(result.getFormationName());
            rank.setFeasible(result.isFeasible());
            rank.setTotalGss(result.getTotalGss());
            rank.setFailure(result.getFailure().orElse(null));
            ranking.add(rank);
        }
        dto.setFormationRanking(ranking);
        return dto;
    }

    static HorizonPlanDto.EventPlanDto toEventDto(Assignment assignment) {
        HorizonPlanDto.EventPlanDto dto = new HorizonPlanDto.EventPlanDto();
        dto.setEventId(assignment.getEventId());
        dto.setImportance(assignment.getImportance().name());
        dto.setTotalGss(assignment.getTotalGss());
        dto.setTotalCost(assignment.getTotalCost());

        List<HorizonPlanDto.SlotPlanDto> lineup = new ArrayList<>();
        for (SlotAssignment slot : assignment.getSlots()) {
            lineup.add(toSlotDto(slot));
        }
        dto.setLineup(lineup);
        dto.setRested(new ArrayList<>(new TreeSet<>(assignment.getRestedWorkerIds())));
        dto.setShadowPrices(new LinkedHashMap<>(assignment.getShadowPrices()));
        if (!assignment.getRelaxations().isEmpty()) {
            dto.setRelaxations(new ArrayList<>(assignment.getRelaxations()));
        }
        return dto;
    }

    private static HorizonPlanDto.SlotPlanDto toSlotDto(SlotAssignment slot) {
        ScoreBreakdown score = slot.getScore();
        CellCost cost = slot.getCost();
        HorizonPlanDto.SlotPlanDto dto = new HorizonPlanDto.SlotPlanDto();
        dto.setSlotId(slot.getSlot().getId());
        dto.setWorkerId(slot.getWorkerId());
        dto.setGss(score.getGss());
        dto.setBaseRating(score.getBaseRating());
        dto.setReadinessFactor(score.getReadinessFactor());
        dto.setSharpnessFactor(score.getSharpnessFactor());
        dto.setFamiliarityFactor(score.getFamiliarityFactor());
        dto.setLoadFactor(score.getLoadFactor());
        dto.setLimitingFactor(score.getLimitingFactor());
        dto.setUtilityCost(cost.getUtilityCost());
        dto.setShadowCost(cost.getShadowCost());
        dto.setStabilityCost(cost.getStabilityCost());
        dto.setTotalCost(cost.getTotal());
        return dto;
    }

    private static HorizonPlanDto.WorkerStateDto toStateDto(Worker worker) {
        HorizonPlanDto.WorkerStateDto dto = new HorizonPlanDto.WorkerStateDto();
        dto.setReadiness(worker.getReadiness());
        dto.setSharpness(worker.getSharpness());
        dto.setLoad(worker.getLoad().name());
        dto.setWindowMinutes(worker.getWindowMinutes());
        return dto;
    }
}
