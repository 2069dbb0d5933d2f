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
public class SimulationMeta {

    private int requestedSimulations;
    private int completedSimulations;
    private int discardedSimulations;
    private int horizonMonths;
    private Long seed;
    private String generatedAt;
    private long durationMs;
}
