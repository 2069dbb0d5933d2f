package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.SensitivityResult;
import com.cfo.forecastengine.domain.model.SimulationConfig;
import com.cfo.forecastengine.domain.model.SimulationMeta;
import com.cfo.forecastengine.domain.model.SimulationResult;
import org.springframework.stereotype.Component;

import java.time.Instant;

@Component
public class ResultAssembler {

    public SimulationResult assemble(SimulationConfig config,
                                     long seed,
                                     PercentileAggregator percentiles,
                                     SurvivalAnalyzer survival,
                                     SensitivityResult sensitivity,
                                     int discardedTrials,
                                     long durationMs) {
        percentiles.seal();

        return SimulationResult.builder()
                .percentilesTable(percentiles.cashTable())
                .series(percentiles.seriesTables())
                .confidenceIntervals(percentiles.confidenceIntervals())
                .fanChartSummary(percentiles.fanChartSummary())
                .confidenceMetrics(percentiles.confidenceMetrics())
                .survivalProbability(survival.result())
                .sensitivity(sensitivity)
                .meta(SimulationMeta.builder()
                        .requestedSimulations(config.getNumSimulations())
                        .completedSimulations(percentiles.size())
                        .discardedSimulations(discardedTrials)
                        .horizonMonths(config.getHorizonMonths())
                        .seed(seed)
                        .generatedAt(Instant.now().toString())
                        .durationMs(durationMs)
                        .build())
                .build();
    }
}
