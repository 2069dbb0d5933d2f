package com.cfo.forecastengine.domain.service.projection;

public record MonthlyFlow(double revenue, double expenses) {
}
