package com.cfo.forecastengine.domain.service.montecarlo;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {

    private boolean enabled = true;
    private int minSimulations = 100;
    private int maxSimulations = 100_000;
    private int maxHorizonMonths = 60;
    private int workerThreads = Runtime.getRuntime().availableProcessors();
    private int batchSize = 500;
    private double maxDiscardRatio = 0.05;
    private int sensitivitySamplesPerDriver = 200;
    private List<Integer> runwayThresholds = List.of(3, 6, 9, 12, 18, 24);
    private Duration jobTimeout = Duration.ofMinutes(5);
    private Duration cacheTtl = Duration.ofDays(30);
    private long progressBroadcastIntervalMs = 1000;

    public int[] runwayThresholdsArray() {
        return runwayThresholds.stream().mapToInt(Integer::intValue).sorted().toArray();
    }
}
