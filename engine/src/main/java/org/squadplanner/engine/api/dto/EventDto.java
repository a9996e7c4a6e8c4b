package org.squadplanner.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Scheduled event of a planning request, with its formation and constraints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class EventDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("date")
    private LocalDate date;

    // High, Medium, Low or Sharpness
    @JsonProperty("importance")
    private String importance;

    @JsonProperty("formation")
    private FormationDto formation;

    @JsonProperty("constraints")
    private ConstraintsDto constraints;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public String getImportance() {
        return importance;
    }

    public void setImportance(String importance) {
        this.importance = importance;
    }

    public FormationDto getFormation() {
        return formation;
    }

    public void setFormation(FormationDto formation) {
        this.formation = formation;
    }

    public ConstraintsDto getConstraints() {
        return constraints;
    }

    public void setConstraints(ConstraintsDto constraints) {
        this.constraints = constraints;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FormationDto {
        @JsonProperty("name")
        private String name;

        @JsonProperty("slots")
        private List<SlotDto> slots;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public List<SlotDto> getSlots() {
            return slots;
        }

        public void setSlots(List<SlotDto> slots) {
            this.slots = slots;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class SlotDto {
        @JsonProperty("id")
        private String id;

        // Used for both phases unless a phase task is given
        @JsonProperty("task")
        private String task;

        @JsonProperty("in_possession_task")
        private String inPossessionTask;

        @JsonProperty("out_of_possession_task")
        private String outOfPossessionTask;

        @JsonProperty("goalkeeper")
        private boolean goalkeeper;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getTask() {
            return task;
        }

        public void setTask(String task) {
            this.task = task;
        }

        public String getInPossessionTask() {
            return inPossessionTask;
        }

        public void setInPossessionTask(String inPossessionTask) {
            this.inPossessionTask = inPossessionTask;
        }

        public String getOutOfPossessionTask() {
            return outOfPossessionTask;
        }

        public void setOutOfPossessionTask(String outOfPossessionTask) {
            this.outOfPossessionTask = outOfPossessionTask;
        }

        public boolean isGoalkeeper() {
            return goalkeeper;
        }

        public void setGoalkeeper(boolean goalkeeper) {
            this.goalkeeper = goalkeeper;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConstraintsDto {
        @JsonProperty("forced_rest")
        private List<String> forcedRest;

        @JsonProperty("locks")
        private List<PinDto> locks;

        @JsonProperty("rejections")
        private List<PinDto> rejections;

        @JsonProperty("override_readiness_floor")
        private boolean overrideReadinessFloor;

        public List<String> getForcedRest() {
            return forcedRest;
        }

        public void setForcedRest(List<String> forcedRest) {
            this.forcedRest = forcedRest;
        }

        public List<PinDto> getLocks() {
            return locks;
        }

        public void setLocks(List<PinDto> locks) {
            this.locks = locks;
        }

        public List<PinDto> getRejections() {
            return rejections;
        }

        public void setRejections(List<PinDto> rejections) {
            this.rejections = rejections;
        }

        public boolean isOverrideReadinessFloor() {
            return overrideReadinessFloor;
        }

        public void setOverrideReadinessFloor(boolean overrideReadinessFloor) {
            this.overrideReadinessFloor = overrideReadinessFloor;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class PinDto {
        @JsonProperty("worker_id")
        private String workerId;

        @JsonProperty("slot_id")
        private String slotId;

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }

        public String getSlotId() {
            return slotId;
        }

        public void setSlotId(String slotId) {
            this.slotId = slotId;
        }
    }
}
