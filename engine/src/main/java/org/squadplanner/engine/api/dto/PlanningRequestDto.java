package org.squadplanner.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Input document of a batch planning run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PlanningRequestDto {

    @JsonProperty("workers")
    private List<WorkerDto> workers;

    @JsonProperty("events")
    private List<EventDto> events;

    // worker id -> slot id held at the last event before the horizon
    @JsonProperty("previous_lineup")
    private Map<String, String> previousLineup;

    // Candidate formations to compare; empty to plan the events as given
    @JsonProperty("candidate_formations")
    private List<EventDto.FormationDto> candidateFormations;

    public List<WorkerDto> getWorkers() {
        return workers;
    }

    public void setWorkers(List<WorkerDto> workers) {
        this.workers = workers;
    }

    public List<EventDto> getEvents() {
        return events;
    }

    public void setEvents(List<EventDto> events) {
        this.events = events;
    }

    public Map<String, String> getPreviousLineup() {
        return previousLineup;
    }

    public void setPreviousLineup(Map<String, String> previousLineup) {
        this.previousLineup = previousLineup;
    }

    public List<EventDto.FormationDto> getCandidateFormations() {
        return candidateFormations;
    }

    public void setCandidateFormations(List<EventDto.FormationDto> candidateFormations) {
        this.candidateFormations = candidateFormations;
    }
}
