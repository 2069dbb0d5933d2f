package com.cfo.forecastengine.domain.service.montecarlo;

import lombok.Getter;

import java.util.List;
import java.util.Map;

@Getter
public class SimulationIntegrityException extends RuntimeException {

    private final int discardedTrials;
    private final int attemptedTrials;
    private final double discardRatio;
    private final List<Map<String, Double>> sampleFailingDrivers;

    public SimulationIntegrityException(int discardedTrials, int attemptedTrials, double maxRatio,
                                        List<Map<String, Double>> sampleFailingDrivers) {
        super(String.format("폐기된 시행 비율 초과: discarded=%d, attempted=%d, ratio=%.4f, max=%.4f",
                discardedTrials, attemptedTrials,
                attemptedTrials == 0 ? 0.0 : (double) discardedTrials / attemptedTrials, maxRatio));
        this.discardedTrials = discardedTrials;
        this.attemptedTrials = attemptedTrials;
        this.discardRatio = attemptedTrials == 0 ? 0.0 : (double) discardedTrials / attemptedTrials;
        this.sampleFailingDrivers = List.copyOf(sampleFailingDrivers);
    }
}
