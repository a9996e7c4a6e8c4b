package org.squadplanner.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for GET /v1/planner/parameters, also the format of a local parameter file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParameterSetDto {

    @JsonProperty("config")
    private List<ConfigItemDto> config;

    @JsonProperty("curves")
    private List<CurveDto> curves;

    public List<ConfigItemDto> getConfig() {
        return config;
    }

    public void setConfig(List<ConfigItemDto> config) {
        this.config = config;
    }

    public List<CurveDto> getCurves() {
        return curves;
    }

    public void setCurves(List<CurveDto> curves) {
        this.curves = curves;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class ConfigItemDto {
        @JsonProperty("key")
        private String key;

        @JsonProperty("value")
        private double value;

        @JsonProperty("description")
        private String description;

        @JsonProperty("min_value")
        private Double minValue;

        @JsonProperty("max_value")
        private Double maxValue;

        public ConfigItemDto() {
        }

        public ConfigItemDto(String key, double value) {
            this.key = key;
            this.value = value;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public double getValue() {
            return value;
        }

        public void setValue(double value) {
            this.value = value;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public Double getMinValue() {
            return minValue;
        }

        public void setMinValue(Double minValue) {
            this.minValue = minValue;
        }

        public Double getMaxValue() {
            return maxValue;
        }

        public void setMaxValue(Double maxValue) {
            this.maxValue = maxValue;
        }

        /**
         * Whether the value respects the declared bounds, if any.
         */
        public boolean isWithinBounds() {
            return (minValue == null || value >= minValue) && (maxValue == null || value <= maxValue);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class CurveDto {
        // e.g. "readiness_high"
        @JsonProperty("name")
        private String name;

        @JsonProperty("kind")
        private String kind;

        @JsonProperty("parameters")
        private Map<String, Double> parameters;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getKind() {
            return kind;
        }

        public void setKind(String kind) {
            this.kind = kind;
        }

        public Map<String, Double> getParameters() {
            return parameters;
        }

        public void setParameters(Map<String, Double> parameters) {
            this.parameters = parameters;
        }
    }
}
