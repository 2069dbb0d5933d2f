package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

public enum DistributionType {

    NORMAL("normal", "Normal (Gaussian)", List.of("mean", "stdDev", "min", "max"),
            "Symmetric bell curve clamped to [min, max]"),
    LOGNORMAL("lognormal", "Log-Normal", List.of("mean", "stdDev", "min", "max"),
            "Right-skewed; arithmetic mean matches the driver mean"),
    TRIANGULAR("triangular", "Triangular", List.of("min", "mean", "max"),
            "Triangular distribution with the driver mean as mode");

    private final String value;
    private final String displayName;
    private final List<String> params;
    private final String description;

    DistributionType(String value, String displayName, List<String> params, String description) {
        this.value = value;
        this.displayName = displayName;
        this.params = params;
        this.description = description;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public List<String> getParams() {
        return params;
    }

    public String getDescription() {
        return description;
    }

    public static Optional<DistributionType> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.value.equals(normalized))
                .findFirst();
    }
}
