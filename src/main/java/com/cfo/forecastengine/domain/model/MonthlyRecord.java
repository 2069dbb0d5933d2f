package com.cfo.forecastengine.domain.model;

public record MonthlyRecord(double revenue, double expenses, double cashBalance) {

    public boolean isFinite() {
        return Double.isFinite(revenue) && Double.isFinite(expenses) && Double.isFinite(cashBalance);
    }
}
