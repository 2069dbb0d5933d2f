package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PercentileTable {

    public static final List<String> LABELS = List.of("p5", "p10", "p25", "p50", "p75", "p90", "p95");

    private List<String> months;
    private List<Double> p5;
    private List<Double> p10;
    private List<Double> p25;
    private List<Double> p50;
    private List<Double> p75;
    private List<Double> p90;
    private List<Double> p95;

    @JsonIgnore
    public List<Double> valuesFor(String label) {
        return switch (label) {
            case "p5" -> p5;
            case "p10" -> p10;
            case "p25" -> p25;
            case "p50" -> p50;
            case "p75" -> p75;
            case "p90" -> p90;
            case "p95" -> p95;
            default -> throw new IllegalArgumentException("지원하지 않는 퍼센타일 라벨: " + label);
        };
    }
}
