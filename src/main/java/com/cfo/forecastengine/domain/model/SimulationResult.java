package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
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
public class SimulationResult {

    public static final String SERIES_CASH = "cashBalance";
    public static final String SERIES_REVENUE = "revenue";

    @JsonProperty("percentiles_table")
    private PercentileTable percentilesTable;

    private Map<String, PercentileTable> series;

    @JsonProperty("confidence_intervals")
    private Map<String, ConfidenceInterval> confidenceIntervals;

    @JsonProperty("fan_chart_summary")
    private FanChartSummary fanChartSummary;

    @JsonProperty("confidence_metrics")
    private ConfidenceMetrics confidenceMetrics;

    @JsonProperty("survival_probability")
    private SurvivalProbability survivalProbability;

    private SensitivityResult sensitivity;

    private SimulationMeta meta;
}
