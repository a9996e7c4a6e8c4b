package org.squadplanner.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Output document of a batch planning run: per-event lineups with their cost components
 * and the worker state trajectory over the horizon.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class HorizonPlanDto {

    @JsonProperty("formation")
    private String formation;

    @JsonProperty("total_gss")
    private double totalGss;

    @JsonProperty("events")
    private List<EventPlanDto> events;

    // One map per point in time: before each event, then after the horizon
    @JsonProperty("trajectory")
    private List<Map<String, WorkerStateDto>> trajectory;

    @JsonProperty("formation_ranking")
    private List<FormationRankDto> formationRanking;

    public String getFormation() {
        return formation;
    }

    public void setFormation(String formation) {
        this.formation = formation;
    }

    public double getTotalGss() {
        return totalGss;
    }

    public void setTotalGss(double totalGss) {
        this.totalGss = totalGss;
    }

    public List<EventPlanDto> getEvents() {
        return events;
    }

    public void setEvents(List<EventPlanDto> events) {
        this.events = events;
    }

    public List<Map<String, WorkerStateDto>> getTrajectory() {
        return trajectory;
    }

    public void setTrajectory(List<Map<String, WorkerStateDto>> trajectory) {
        this.trajectory = trajectory;
    }

    public List<FormationRankDto> getFormationRanking() {
        return formationRanking;
    }

    public void setFormationRanking(List<FormationRankDto> formationRanking) {
        this.formationRanking = formationRanking;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class EventPlanDto {
        @JsonProperty("event_id")
        private String eventId;

        @JsonProperty("importance")
        private String importance;

        @JsonProperty("total_gss")
        private double totalGss;

        @JsonProperty("total_cost")
        private double totalCost;

        @JsonProperty("lineup")
        private List<SlotPlanDto> lineup;

        @JsonProperty("rested")
        private List<String> rested;

        @JsonProperty("shadow_prices")
        private Map<String, Double> shadowPrices;

        @JsonProperty("relaxations")
        private List<String> relaxations;

        public String getEventId() {
            return eventId;
        }

        public void setEventId(String eventId) {
            this.eventId = eventId;
        }

        public String getImportance() {
            return importance;
        }

        public void setImportance(String importance) {
            this.importance = importance;
        }

        public double getTotalGss() {
            return totalGss;
        }

        public void setTotalGss(double totalGss) {
            this.totalGss = totalGss;
        }

        public double getTotalCost() {
            return totalCost;
        }

        public void setTotalCost(double totalCost) {
            this.totalCost = totalCost;
        }

        public List<SlotPlanDto> getLineup() {
            return lineup;
        }

        public void setLineup(List<SlotPlanDto> lineup) {
            this.lineup = lineup;
        }

        public List<String> getRested() {
            return rested;
        }

        public void setRested(List<String> rested) {
            this.rested = rested;
        }

        public Map<String, Double> getShadowPrices() {
            return shadowPrices;
        }

        public void setShadowPrices(Map<String, Double> shadowPrices) {
            this.shadowPrices = shadowPrices;
        }

        public List<String> getRelaxations() {
            return relaxations;
        }

        public void setRelaxations(List<String> relaxations) {
            this.relaxations = relaxations;
        }
    }

    public static final class SlotPlanDto {
        @JsonProperty("slot_id")
        private String slotId;

        @JsonProperty("worker_id")
        private String workerId;

        @JsonProperty("gss")
        private double gss;

        @JsonProperty("base_rating")
        private double baseRating;

        @JsonProperty("readiness_factor")
        private double readinessFactor;

        @JsonProperty("sharpness_factor")
        private double sharpnessFactor;

        @JsonProperty("familiarity_factor")
        private double familiarityFactor;

        @JsonProperty("load_factor")
        private double loadFactor;

        @JsonProperty("limiting_factor")
        private String limitingFactor;

        @JsonProperty("utility_cost")
        private double utilityCost;

        @JsonProperty("shadow_cost")
        private double shadowCost;

        @JsonProperty("stability_cost")
        private double stabilityCost;

        @JsonProperty("total_cost")
        private double totalCost;

        public String getSlotId() {
            return slotId;
        }

        public void setSlotId(String slotId) {
            this.slotId = slotId;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public double getGss() {
            return gss;
        }

        public void setGss(double gss) {
            this.gss = gss;
        }

        public double getBaseRating() {
            return baseRating;
        }

        public void setBaseRating(double baseRating) {
            this.baseRating = baseRating;
        }

        public double getReadinessFactor() {
            return readinessFactor;
        }

        public void setReadinessFactor(double readinessFactor) {
            this.readinessFactor = readinessFactor;
        }

        public double getSharpnessFactor() {
            return sharpnessFactor;
        }

        public void setSharpnessFactor(double sharpnessFactor) {
            this.sharpnessFactor = sharpnessFactor;
        }

        public double getFamiliarityFactor() {
            return familiarityFactor;
        }

        public void setFamiliarityFactor(double familiarityFactor) {
            this.familiarityFactor = familiarityFactor;
        }

        public double getLoadFactor() {
            return loadFactor;
        }

        public void setLoadFactor(double loadFactor) {
            this.loadFactor = loadFactor;
        }

        public String getLimitingFactor() {
            return limitingFactor;
        }

        public void setLimitingFactor(String limitingFactor) {
            this.limitingFactor = limitingFactor;
        }

        public double getUtilityCost() {
            return utilityCost;
        }

        public void setUtilityCost(double utilityCost) {
            this.utilityCost = utilityCost;
        }

        public double getShadowCost() {
            return shadowCost;
        }

        public void setShadowCost(double shadowCost) {
            this.shadowCost = shadowCost;
        }

        public double getStabilityCost() {
            return stabilityCost;
        }

        public void setStabilityCost(double stabilityCost) {
            this.stabilityCost = stabilityCost;
        }

        public double getTotalCost() {
            return totalCost;
        }

        public void setTotalCost(double totalCost) {
            this.totalCost = totalCost;
        }
    }

    public static final class WorkerStateDto {
        @JsonProperty("readiness")
        private double readiness;

        @JsonProperty("sharpness")
        private double sharpness;

        @JsonProperty("load")
        private String load;

        @JsonProperty("window_minutes")
        private int windowMinutes;

        public double getReadiness() {
            return readiness;
        }

        public void setReadiness(double readiness) {
            this.readiness = readiness;
        }

        public double getSharpness() {
            return sharpness;
        }

        public void setSharpness(double sharpness) {
            this.sharpness = sharpness;
        }

        public String getLoad() {
            return load;
        }

        public void setLoad(String load) {
            this.load = load;
        }

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class FormationRankDto {
        @JsonProperty("formation")
        private String formation;

        @JsonProperty("feasible")
        private boolean feasible;

        @JsonProperty("total_gss")
        private double totalGss;

        @JsonProperty("failure")
        private String failure;

        public String getFormation() {
            return formation;
        }

        public void setFormation(String formation) {
            this.formation = formation;
        }

        public boolean isFeasible() {
            return feasible;
        }

        public void setFeasible(boolean feasible) {
            this.feasible = feasible;
        }

        public double getTotalGss() {
            return totalGss;
        }

        public void setTotalGss(double totalGss) {
            this.totalGss = totalGss;
        }

        public String getFailure() {
            return failure;
        }

        public void setFailure(String failure) {
            this.failure = failure;
        }
    }
}
