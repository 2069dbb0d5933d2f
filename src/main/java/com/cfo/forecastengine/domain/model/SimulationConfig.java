package com.cfo.forecastengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.util.Collections;
import java.util.Map;

@Getter
@Builder
public class SimulationConfig {

    private final int numSimulations;
    private final int horizonMonths;

    private final Map<String, DriverSpec> drivers;

    @Builder.Default
    private final Map<String, Object> baselineAssumptions = Collections.emptyMap();

    private final Long seed;

    public boolean hasSeed() {
        return seed != null;
    }
}
