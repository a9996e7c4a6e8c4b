package org.squadplanner.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Roster entry of a planning request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class WorkerDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("age")
    private Integer age;

    @JsonProperty("natural_fitness")
    private Integer naturalFitness;

    @JsonProperty("stamina")
    private Integer stamina;

    @JsonProperty("goalkeeper")
    private boolean goalkeeper;

    @JsonProperty("training_intensity")
    private String trainingIntensity;

    // task -> rating
    @JsonProperty("ratings")
    private Map<String, Double> ratings;

    @JsonProperty("familiarity")
    private Map<String, FamiliarityDto> familiarity;

    @JsonProperty("readiness")
    private Double readiness;

    @JsonProperty("sharpness")
    private Double sharpness;

    @JsonProperty("load")
    private String load;

    @JsonProperty("appearances")
    private List<AppearanceDto> appearances;

    @JsonProperty("consecutive_appearances")
    private int consecutiveAppearances;

    @JsonProperty("days_since_last_appearance")
    private int daysSinceLastAppearance;

    @JsonProperty("injured")
    private boolean injured;

    @JsonProperty("suspended")
    private boolean suspended;

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }

    public Integer getNaturalFitness() {
        return naturalFitness;
    }

    public void setNaturalFitness(Integer naturalFitness) {
        this.naturalFitness = naturalFitness;
    }

    public Integer getStamina() {
        return stamina;
    }

    public void setStamina(Integer stamina) {
        this.stamina = stamina;
    }

    public boolean isGoalkeeper() {
        return goalkeeper;
    }

    public void setGoalkeeper(boolean goalkeeper) {
        this.goalkeeper = goalkeeper;
    }

    public String getTrainingIntensity() {
        return trainingIntensity;
    }

    public void setTrainingIntensity(String trainingIntensity) {
        this.trainingIntensity = trainingIntensity;
    }

    public Map<String, Double> getRatings() {
        return ratings;
    }

    public void setRatings(Map<String, Double> ratings) {
        this.ratings = ratings;
    }

    public Map<String, FamiliarityDto> getFamiliarity() {
        return familiarity;
    }

    public void setFamiliarity(Map<String, FamiliarityDto> familiarity) {
        this.familiarity = familiarity;
    }

    public Double getReadiness() {
        return readiness;
    }

    public void setReadiness(Double readiness) {
        this.readiness = readiness;
    }

    public Double getSharpness() {
        return sharpness;
    }

    public void setSharpness(Double sharpness) {
        this.sharpness = sharpness;
    }

    public String getLoad() {
        return load;
    }

    public void setLoad(String load) {
        this.load = load;
    }

    public List<AppearanceDto> getAppearances() {
        return appearances;
    }

    public void setAppearances(List<AppearanceDto> appearances) {
        this.appearances = appearances;
    }

    public int getConsecutiveAppearances() {
        return consecutiveAppearances;
    }

    public void setConsecutiveAppearances(int consecutiveAppearances) {
        this.consecutiveAppearances = consecutiveAppearances;
    }

    public int getDaysSinceLastAppearance() {
        return daysSinceLastAppearance;
    }

    public void setDaysSinceLastAppearance(int daysSinceLastAppearance) {
        this.daysSinceLastAppearance = daysSinceLastAppearance;
    }

    public boolean isInjured() {
        return injured;
    }

    public void setInjured(boolean injured) {
        this.injured = injured;
    }

    public boolean isSuspended() {
        return suspended;
    }

    public void setSuspended(boolean suspended) {
        this.suspended = suspended;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class FamiliarityDto {
        @JsonProperty("in_possession")
        private double inPossession;

        @JsonProperty("out_of_possession")
        private double outOfPossession;

        public double getInPossession() {
            return inPossession;
        }

        public void setInPossession(double inPossession) {
            this.inPossession = inPossession;
        }

        public double getOutOfPossession() {
            return outOfPossession;
        }

        public void setOutOfPossession(double outOfPossession) {
            this.outOfPossession = outOfPossession;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class AppearanceDto {
        @JsonProperty("days_ago")
        private int daysAgo;

        @JsonProperty("minutes")
        private int minutes;

        public int getDaysAgo() {
            return daysAgo;
        }

        public void setDaysAgo(int daysAgo) {
            this.daysAgo = daysAgo;
        }

        public int getMinutes() {
            return minutes;
        }

        public void setMinutes(int minutes) {
            this.minutes = minutes;
        }
    }
}
