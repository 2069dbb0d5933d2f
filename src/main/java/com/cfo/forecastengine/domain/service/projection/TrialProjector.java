package com.cfo.forecastengine.domain.service.projection;

import com.cfo.forecastengine.domain.model.MonthlyRecord;
import com.cfo.forecastengine.domain.model.Trajectory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class TrialProjector {

    private final MonthlyProjectionFormula formula;

    public Trajectory project(Map<String, Double> sampledDrivers,
                              Map<String, Object> baselineAssumptions,
                              int horizonMonths) {
        Map<String, Object> assumptions = new HashMap<>(baselineAssumptions);
        assumptions.putAll(sampledDrivers);

        Trajectory trajectory = new Trajectory(horizonMonths);
        double cash = formula.openingCash(assumptions);
        MonthlyRecord previous = null;

        for (int m = 0; m < horizonMonths; m++) {
            MonthlyFlow flow = formula.project(m, previous, assumptions);
            cash = cash + flow.revenue() - flow.expenses();
            MonthlyRecord record = new MonthlyRecord(flow.revenue(), flow.expenses(), cash);
            trajectory.set(m, record);
            previous = record;
        }
        return trajectory;
    }
}
