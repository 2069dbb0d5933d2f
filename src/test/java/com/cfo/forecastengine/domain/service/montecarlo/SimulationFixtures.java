package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.DistributionType;
import com.cfo.forecastengine.domain.model.DriverSpec;
import com.cfo.forecastengine.domain.model.ImpactLevel;
import com.cfo.forecastengine.domain.model.MonthlyRecord;
import com.cfo.forecastengine.domain.model.SimulationConfig;
import com.cfo.forecastengine.domain.model.Trajectory;
import com.cfo.forecastengine.domain.service.projection.MonthlyProjectionFormula;
import com.cfo.forecastengine.domain.service.projection.SaasProjectionFormula;
import com.cfo.forecastengine.domain.service.projection.TrialProjector;
import com.cfo.forecastengine.domain.service.sensitivity.SensitivityAnalyzer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

public final class SimulationFixtures {

    private SimulationFixtures() {
    }

    public static SimulationProperties properties() {
        SimulationProperties properties = new SimulationProperties();
        properties.setWorkerThreads(2);
        properties.setBatchSize(100);
        properties.setSensitivitySamplesPerDriver(50);
        return properties;
    }

    public static SimulationRunner runner(MonthlyProjectionFormula formula,
                                          SimulationProperties properties,
                                          ExecutorService pool) {
        DistributionSampler sampler = new DistributionSampler();
        TrialProjector projector = new TrialProjector(formula);
        SensitivityAnalyzer sensitivity = new SensitivityAnalyzer(sampler, projector, properties);
        return new SimulationRunner(sampler, projector, sensitivity, new ResultAssembler(),
                properties, pool, new SimpleMeterRegistry());
    }

    public static SimulationRunner runner(SimulationProperties properties, ExecutorService pool) {
        return runner(new SaasProjectionFormula(), properties, pool);
    }

    public static DriverSpec normal(String id, double mean, double stdDev, double min, double max) {
        return DriverSpec.builder()
                .id(id)
                .name(id)
                .distribution(DistributionType.NORMAL)
                .mean(mean)
                .stdDev(stdDev)
                .min(min)
                .max(max)
                .unit("%")
                .impact(ImpactLevel.HIGH)
                .build();
    }

    public static SimulationConfig config(int trials, int horizon, Long seed,
                                          Map<String, Object> baseline, DriverSpec... drivers) {
        Map<String, DriverSpec> map = new LinkedHashMap<>();
        for (DriverSpec driver : drivers) {
            map.put(driver.getId(), driver);
        }
        return SimulationConfig.builder()
                .numSimulations(trials)
                .horizonMonths(horizon)
                .drivers(map)
                .baselineAssumptions(baseline)
                .seed(seed)
                .build();
    }

    public static Trajectory cashPath(double... cash) {
        Trajectory trajectory = new Trajectory(cash.length);
        for (int m = 0; m < cash.length; m++) {
            trajectory.set(m, new MonthlyRecord(0.0, 0.0, cash[m]));
        }
        return trajectory;
    }
}
