package com.cfo.forecastengine.domain.service.projection;

import com.cfo.forecastengine.domain.model.MonthlyRecord;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Default recurring-revenue formula used when the model layer does not plug in its own.
 *
 * <pre>
 * revenue[m]  = revenue[m-1] * (1 + revenue_growth% - churn_rate%) + newCustomers * avg_deal_size / 12
 * expenses[m] = expenses * (1 + expense_growth%)^(m+1) + cogs_percentage% * revenue[m] + newCustomers * cac
 * newCustomers = leads * conversion_rate%
 * </pre>
 * Percent-valued keys are given in percent (8 means 8%). Missing keys default to zero.
 */
@Component
public class SaasProjectionFormula implements MonthlyProjectionFormula {

    public static final String CASH = "cash";
    public static final String REVENUE = "revenue";
    public static final String REVENUE_GROWTH = "revenue_growth";
    public static final String CHURN_RATE = "churn_rate";
    public static final String EXPENSES = "expenses";
    public static final String EXPENSE_GROWTH = "expense_growth";
    public static final String COGS_PERCENTAGE = "cogs_percentage";
    public static final String LEADS = "leads";
    public static final String CONVERSION_RATE = "conversion_rate";
    public static final String AVG_DEAL_SIZE = "avg_deal_size";
    public static final String CAC = "cac";

    @Override
    public double openingCash(Map<String, Object> assumptions) {
        if (assumptions.containsKey(CASH)) return number(assumptions, CASH);
        if (assumptions.containsKey("cashBalance")) return number(assumptions, "cashBalance");
        return number(assumptions, "initialCash");
    }

    @Override
    public MonthlyFlow project(int month, MonthlyRecord previous, Map<String, Object> assumptions) {
        double priorRevenue = previous != null ? previous.revenue() : number(assumptions, REVENUE);
        double growth = number(assumptions, REVENUE_GROWTH) / 100.0;
        double churn = number(assumptions, CHURN_RATE) / 100.0;

        double newCustomers = number(assumptions, LEADS) * number(assumptions, CONVERSION_RATE) / 100.0;
        double newRevenue = newCustomers * number(assumptions, AVG_DEAL_SIZE) / 12.0;

        double revenue = priorRevenue * (1.0 + growth - churn) + newRevenue;

        double expenseGrowth = number(assumptions, EXPENSE_GROWTH) / 100.0;
        double fixedExpenses = number(assumptions, EXPENSES) * Math.pow(1.0 + expenseGrowth, month + 1);
        double cogs = revenue * number(assumptions, COGS_PERCENTAGE) / 100.0;
        double acquisition = newCustomers * number(assumptions, CAC);

        return new MonthlyFlow(revenue, fixedExpenses + cogs + acquisition);
    }

    static double number(Map<String, Object> assumptions, String key) {
        Object raw = assumptions.get(key);
        if (raw == null) return 0.0;
        if (raw instanceof Number n) return n.doubleValue();
        if (raw instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("숫자가 아닌 가정값: " + key + "=" + s, e);
            }
        }
        throw new IllegalArgumentException("숫자가 아닌 가정값: " + key + "=" + raw);
    }
}
