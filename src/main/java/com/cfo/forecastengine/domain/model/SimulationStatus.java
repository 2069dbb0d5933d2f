package com.cfo.forecastengine.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SimulationStatus {
    QUEUED, RUNNING, DONE, FAILED, CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }
}
