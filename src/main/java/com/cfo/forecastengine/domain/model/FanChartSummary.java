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
public class FanChartSummary {

    private int month;
    private double medianProjection;
    private double range80Low;
    private double range80High;
    private double range90Low;
    private double range90High;
    private double uncertaintySpreadPct;
}
