package com.cfo.forecastengine.domain.service.montecarlo;

import lombok.Getter;

import java.util.List;

@Getter
public class SimulationValidationException extends RuntimeException {

    private final List<FieldError> errors;

    public SimulationValidationException(List<FieldError> errors) {
        super("시뮬레이션 설정 검증 실패: " + errors.size() + "건");
        this.errors = List.copyOf(errors);
    }

    public record FieldError(String field, String message) {
    }
}
