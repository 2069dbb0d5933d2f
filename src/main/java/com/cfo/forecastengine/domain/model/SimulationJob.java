package com.cfo.forecastengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "simulation_job", indexes = {
        @Index(name = "idx_sim_job_status", columnList = "status"),
        @Index(name = "idx_sim_job_created", columnList = "createdAt"),
        @Index(name = "idx_sim_job_params_hash", columnList = "paramsHash")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationJob {

    @Id
    @Column(length = 36)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private SimulationStatus status;

    private double progress;
    private int numSimulations;
    private int horizonMonths;
    private Long seed;

    @Column(length = 64)
    private String paramsHash;

    @Lob
    private String logsJson;

    @Lob
    private String resultJson;

    @Column(length = 2000)
    private String errorMessage;

    private boolean cancelRequested;

    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;
}
