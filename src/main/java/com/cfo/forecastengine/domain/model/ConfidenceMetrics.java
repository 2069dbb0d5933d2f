package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ConfidenceMetrics {

    private double terminalMean;
    private double terminalStdDev;
    private double coefficientOfVariation;
    private double valueAtRisk5;
    private double expectedShortfall5;
}
