package com.cfo.forecastengine.domain.service.montecarlo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SimulationRequest {

    private Integer numSimulations;
    private Integer horizonMonths;
    private Map<String, DriverInput> drivers;
    private Map<String, Object> baselineAssumptions;
    private Long seed;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DriverInput {
        private String id;
        private String name;
        private String distribution;
        private Double mean;
        private Double stdDev;
        private Double min;
        private Double max;
        private String unit;
        private String impact;
    }
}
