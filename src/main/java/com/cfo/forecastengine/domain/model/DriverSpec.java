package com.cfo.forecastengine.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class DriverSpec {

    private final String id;
    private final String name;
    private final DistributionType distribution;
    private final double mean;
    private final double stdDev;
    private final double min;
    private final double max;
    private final String unit;
    private final ImpactLevel impact;

    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
