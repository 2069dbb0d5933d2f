package com.cfo.forecastengine.domain.service.projection;

import com.cfo.forecastengine.domain.model.MonthlyRecord;

import java.util.Map;

/**
 * Deterministic single-month financial formula owned by the model layer. The engine only drives it:
 * sampled driver values arrive in {@code assumptions} under their driver id, replacing the baseline value.
 */
public interface MonthlyProjectionFormula {

    double openingCash(Map<String, Object> assumptions);

    /**
     * @param month    0-based month index
     * @param previous the previous month, or {@code null} for month 0
     */
    MonthlyFlow project(int month, MonthlyRecord previous, Map<String, Object> assumptions);
}
