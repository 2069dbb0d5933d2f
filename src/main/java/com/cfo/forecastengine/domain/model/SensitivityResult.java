package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SensitivityResult {

    private String method;
    private int samplesPerDriver;
    private double baselineTerminalCash;

    private List<Entry> tornadoData;

    private List<TopDriver> topDrivers;

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Entry {
        private String driverId;
        private String driverName;
        private String unit;
        private double baselineValue;
        private double lowOutcome;
        private double highOutcome;
        private double upsideImpact;
        private double downsideImpact;
        private double totalImpact;
        private double variance;
        private double contributionPercentage;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TopDriver {
        private int rank;
        private String driverId;
        private String name;
        private double contributionPercentage;
        private double totalImpact;
        private String description;
    }
}
