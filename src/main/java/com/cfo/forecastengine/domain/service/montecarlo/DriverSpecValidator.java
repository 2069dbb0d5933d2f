package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.DistributionType;
import com.cfo.forecastengine.domain.model.DriverSpec;
import com.cfo.forecastengine.domain.model.ImpactLevel;
import com.cfo.forecastengine.domain.model.SimulationConfig;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationRequest.DriverInput;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationValidationException.FieldError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class DriverSpecValidator {

    private final SimulationProperties properties;

    public SimulationConfig validate(SimulationRequest request) {
        if (request == null) {
            throw new SimulationValidationException(List.of(new FieldError("request", "요청 본문이 비어 있습니다")));
        }

        List<FieldError> errors = new ArrayList<>();

        Integer numSimulations = request.getNumSimulations();
        if (numSimulations == null) {
            errors.add(new FieldError("numSimulations", "numSimulations는 필수입니다"));
        } else if (numSimulations < properties.getMinSimulations() || numSimulations > properties.getMaxSimulations()) {
            errors.add(new FieldError("numSimulations", String.format("numSimulations는 %d~%d 범위여야 합니다 (입력값=%d)",
                    properties.getMinSimulations(), properties.getMaxSimulations(), numSimulations)));
        }

        Integer horizonMonths = request.getHorizonMonths();
        if (horizonMonths == null) {
            errors.add(new FieldError("horizonMonths", "horizonMonths는 필수입니다"));
        } else if (horizonMonths < 1 || horizonMonths > properties.getMaxHorizonMonths()) {
            errors.add(new FieldError("horizonMonths", String.format("horizonMonths는 1~%d 범위여야 합니다 (입력값=%d)",
                    properties.getMaxHorizonMonths(), horizonMonths)));
        }

        Map<String, DriverInput> rawDrivers = request.getDrivers() != null ? request.getDrivers() : Map.of();
        Map<String, DriverSpec> drivers = new LinkedHashMap<>();
        for (Map.Entry<String, DriverInput> entry : rawDrivers.entrySet()) {
            validateDriver(entry.getKey(), entry.getValue(), errors).ifPresent(spec -> drivers.put(spec.getId(), spec));
        }

        if (!errors.isEmpty()) {
            log.info("[Validator] 설정 거부: errors={}, fields={}", errors.size(),
                    errors.stream().map(FieldError::field).toList());
            throw new SimulationValidationException(errors);
        }

        Map<String, Object> baseline = request.getBaselineAssumptions() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(request.getBaselineAssumptions()))
                : Map.of();

        return SimulationConfig.builder()
                .numSimulations(numSimulations)
                .horizonMonths(horizonMonths)
                .drivers(Collections.unmodifiableMap(drivers))
                .baselineAssumptions(baseline)
                .seed(request.getSeed())
                .build();
    }

    private Optional<DriverSpec> validateDriver(String key, DriverInput input, List<FieldError> errors) {
        String prefix = "drivers." + key;
        int before = errors.size();

        if (key == null || key.isBlank()) {
            errors.add(new FieldError("drivers", "드라이버 키는 비어 있을 수 없습니다"));
            return Optional.empty();
        }
        if (input == null) {
            errors.add(new FieldError(prefix, "드라이버 정의가 비어 있습니다"));
            return Optional.empty();
        }
        if (input.getId() != null && !input.getId().equals(key)) {
            errors.add(new FieldError(prefix + ".id", "id가 드라이버 키와 다릅니다: " + input.getId()));
        }

        Optional<DistributionType> distribution = DistributionType.fromValue(input.getDistribution());
        if (distribution.isEmpty()) {
            errors.add(new FieldError(prefix + ".distribution",
                    "지원하지 않는 분포입니다: " + input.getDistribution()));
        }

        ImpactLevel impact = ImpactLevel.MEDIUM;
        if (input.getImpact() != null && !input.getImpact().isBlank()) {
            Optional<ImpactLevel> parsed = ImpactLevel.fromValue(input.getImpact());
            if (parsed.isPresent()) {
                impact = parsed.get();
            } else {
                errors.add(new FieldError(prefix + ".impact",
                        "impact는 high, medium, low 중 하나여야 합니다: " + input.getImpact()));
            }
        }

        Double mean = requireFinite(input.getMean(), prefix + ".mean", errors);
        Double min = requireFinite(input.getMin(), prefix + ".min", errors);
        Double max = requireFinite(input.getMax(), prefix + ".max", errors);

        double stdDev = 0.0;
        boolean needsStdDev = distribution.map(d -> d != DistributionType.TRIANGULAR).orElse(false);
        if (needsStdDev) {
            Double raw = requireFinite(input.getStdDev(), prefix + ".stdDev", errors);
            if (raw != null) {
                if (raw < 0) {
                    errors.add(new FieldError(prefix + ".stdDev", "stdDev는 0 이상이어야 합니다"));
                }
                stdDev = raw;
            }
        } else if (input.getStdDev() != null && Double.isFinite(input.getStdDev())) {
            stdDev = Math.max(0.0, input.getStdDev());
        }

        if (min != null && max != null && min > max) {
            errors.add(new FieldError(prefix + ".min", String.format("min(%s)이 max(%s)보다 큽니다", min, max)));
        } else if (mean != null && min != null && max != null && (mean < min || mean > max)) {
            errors.add(new FieldError(prefix + ".mean",
                    String.format("mean(%s)은 [%s, %s] 범위여야 합니다", mean, min, max)));
        }

        if (distribution.orElse(null) == DistributionType.LOGNORMAL && mean != null && mean <= 0) {
            errors.add(new FieldError(prefix + ".mean", "lognormal 분포의 mean은 양수여야 합니다"));
        }

        if (errors.size() > before) {
            return Optional.empty();
        }

        return Optional.of(DriverSpec.builder()
                .id(key)
                .name(input.getName() != null ? input.getName() : key)
                .distribution(distribution.get())
                .mean(mean)
                .stdDev(stdDev)
                .min(min)
                .max(max)
                .unit(input.getUnit())
                .impact(impact)
                .build());
    }

    private Double requireFinite(Double value, String field, List<FieldError> errors) {
        if (value == null) {
            errors.add(new FieldError(field, field + "는 필수입니다"));
            return null;
        }
        if (!Double.isFinite(value)) {
            errors.add(new FieldError(field, field + "는 유한한 숫자여야 합니다"));
            return null;
        }
        return value;
    }
}
