package com.cfo.forecastengine.domain.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

@Getter
@Builder
public class SimulationJobView {

    private final String jobId;
    private final SimulationStatus status;
    private final double progress;
    private final List<String> logs;
    private final String errorMessage;
    private final Instant createdAt;
    private final Instant finishedAt;
}
