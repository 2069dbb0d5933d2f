package com.cfo.forecastengine.domain.repository;

import com.cfo.forecastengine.domain.model.SimulationJob;
import com.cfo.forecastengine.domain.model.SimulationStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface SimulationJobRepository extends JpaRepository<SimulationJob, String> {

    List<SimulationJob> findByStatusIn(List<SimulationStatus> statuses);

    Optional<SimulationJob> findFirstByParamsHashAndStatusAndCreatedAtAfter(
            String paramsHash, SimulationStatus status, Instant createdAfter);
}
