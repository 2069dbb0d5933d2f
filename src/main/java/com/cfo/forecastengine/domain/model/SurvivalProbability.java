package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SurvivalProbability {

    private Overall overall;

    private Map<String, RunwayThreshold> runwayThresholds;

    private List<MonthSurvival> byMonth;
    private List<HistogramBucket> runwayHistogram;
    private Summary summary;

    public static String thresholdKey(int months) {
        return months + "_months";
    }

    public enum RiskLevel {
        LOW, MEDIUM, HIGH;

        public static RiskLevel fromSurvival(double probability) {
            if (probability < 0.5) return HIGH;
            if (probability < 0.8) return MEDIUM;
            return LOW;
        }
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Overall {
        private double probabilitySurvivingFullPeriod;
        private double percentageSurvivingFullPeriod;
        private Double averageMonthsToFailure;
        private Double medianMonthsToFailure;
        private int totalSimulations;
        private int simulationsSurvived;
        private int simulationsFailed;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RunwayThreshold {
        private int thresholdMonths;
        private double probability;
        private double percentage;
        private int simulationsSurvived;
        private int simulationsFailed;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MonthSurvival {
        private String month;
        private int monthIndex;
        private double probability;
        private double percentage;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HistogramBucket {
        private String label;
        private int fromMonth;
        private Integer toMonth;
        private int count;
        private double probability;
    }

    @Getter
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Summary {
        private String keyMessage;
        private RiskLevel riskLevel;
    }
}
