package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ImpactLevel {
    HIGH, MEDIUM, LOW;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ImpactLevel> fromValue(String raw) {
        if (raw == null) return Optional.empty();
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(level -> level.toJson().equals(normalized))
                .findFirst();
    }
}
