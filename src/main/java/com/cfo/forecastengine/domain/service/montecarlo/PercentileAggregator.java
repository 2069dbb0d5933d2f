package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.ConfidenceInterval;
import com.cfo.forecastengine.domain.model.ConfidenceMetrics;
import com.cfo.forecastengine.domain.model.FanChartSummary;
import com.cfo.forecastengine.domain.model.PercentileTable;
import com.cfo.forecastengine.domain.model.SimulationResult;
import com.cfo.forecastengine.domain.model.Trajectory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class PercentileAggregator {

    static final double[] PERCENTILES = {5, 10, 25, 50, 75, 90, 95};
    static final double[] CONFIDENCE_LEVELS = {0.80, 0.90, 0.95};

    private final int horizonMonths;
    private double[][] cash;
    private double[][] revenue;
    private int size;
    private boolean sealed;

    public PercentileAggregator(int horizonMonths, int expectedTrials) {
        if (horizonMonths <= 0) {
            throw new IllegalArgumentException("horizonMonths는 양수여야 합니다");
        }
        int capacity = Math.max(expectedTrials, 16);
        this.horizonMonths = horizonMonths;
        this.cash = new double[horizonMonths][capacity];
        this.revenue = new double[horizonMonths][capacity];
    }

    public void accept(Trajectory trajectory) {
        checkOpen();
        if (trajectory.months() != horizonMonths) {
            throw new IllegalArgumentException("trajectory 길이 불일치: expected=" + horizonMonths
                    + ", actual=" + trajectory.months());
        }
        ensureCapacity(size + 1);
        for (int m = 0; m < horizonMonths; m++) {
            cash[m][size] = trajectory.cashBalance(m);
            revenue[m][size] = trajectory.revenue(m);
        }
        size++;
    }

    public void merge(PercentileAggregator other) {
        checkOpen();
        if (other.horizonMonths != horizonMonths) {
            throw new IllegalArgumentException("horizon이 다른 집계기는 병합할 수 없습니다");
        }
        ensureCapacity(size + other.size);
        for (int m = 0; m < horizonMonths; m++) {
            System.arraycopy(other.cash[m], 0, cash[m], size, other.size);
            System.arraycopy(other.revenue[m], 0, revenue[m], size, other.size);
        }
        size += other.size;
    }

    public int size() {
        return size;
    }

    public int horizonMonths() {
        return horizonMonths;
    }

    public void seal() {
        if (sealed) return;
        if (size == 0) {
            throw new IllegalStateException("집계할 시행이 없습니다");
        }
        for (int m = 0; m < horizonMonths; m++) {
            Arrays.sort(cash[m], 0, size);
            Arrays.sort(revenue[m], 0, size);
        }
        sealed = true;
    }

    public PercentileTable cashTable() {
        return table(cash);
    }

    public PercentileTable revenueTable() {
        return table(revenue);
    }

    public Map<String, PercentileTable> seriesTables() {
        Map<String, PercentileTable> series = new LinkedHashMap<>();
        series.put(SimulationResult.SERIES_CASH, cashTable());
        series.put(SimulationResult.SERIES_REVENUE, revenueTable());
        return series;
    }

    public Map<String, ConfidenceInterval> confidenceIntervals() {
        requireSealed();
        Map<String, ConfidenceInterval> intervals = new LinkedHashMap<>();
        for (double level : CONFIDENCE_LEVELS) {
            double alpha = 1.0 - level;
            double lowerP = alpha / 2 * 100;
            double upperP = (1 - alpha / 2) * 100;

            List<Double> lower = new ArrayList<>(horizonMonths);
            List<Double> upper = new ArrayList<>(horizonMonths);
            List<Double> width = new ArrayList<>(horizonMonths);
            for (int m = 0; m < horizonMonths; m++) {
                double lo = round2(percentile(cash[m], size, lowerP));
                double hi = round2(percentile(cash[m], size, upperP));
                lower.add(lo);
                upper.add(hi);
                width.add(round2(hi - lo));
            }
            intervals.put("ci_" + Math.round(level * 100), ConfidenceInterval.builder()
                    .level(level)
                    .lower(lower)
                    .upper(upper)
                    .width(width)
                    .build());
        }
        return intervals;
    }

    public FanChartSummary fanChartSummary() {
        requireSealed();
        double[] terminal = cash[horizonMonths - 1];
        double p5 = percentile(terminal, size, 5);
        double p10 = percentile(terminal, size, 10);
        double p50 = percentile(terminal, size, 50);
        double p90 = percentile(terminal, size, 90);
        double p95 = percentile(terminal, size, 95);
        double spread = p50 == 0.0 ? 0.0 : (p95 - p5) / (2 * Math.abs(p50)) * 100;

        return FanChartSummary.builder()
                .month(horizonMonths)
                .medianProjection(round2(p50))
                .range80Low(round2(p10))
                .range80High(round2(p90))
                .range90Low(round2(p5))
                .range90High(round2(p95))
                .uncertaintySpreadPct(round2(spread))
                .build();
    }

    public ConfidenceMetrics confidenceMetrics() {
        requireSealed();
        double[] terminal = cash[horizonMonths - 1];

        double sum = 0;
        for (int i = 0; i < size; i++) sum += terminal[i];
        double mean = sum / size;

        double sq = 0;
        for (int i = 0; i < size; i++) {
            double d = terminal[i] - mean;
            sq += d * d;
        }
        double stdDev = size > 1 ? Math.sqrt(sq / (size - 1)) : 0.0;

        int tail = Math.max(1, (int) Math.ceil(size * 0.05));
        double tailSum = 0;
        for (int i = 0; i < tail; i++) tailSum += terminal[i];

        return ConfidenceMetrics.builder()
                .terminalMean(round2(mean))
                .terminalStdDev(round2(stdDev))
                .coefficientOfVariation(mean == 0.0 ? 0.0 : round4(stdDev / Math.abs(mean)))
                .valueAtRisk5(round2(mean - percentile(terminal, size, 5)))
                .expectedShortfall5(round2(tailSum / tail))
                .build();
    }

    public static List<String> monthLabels(int horizonMonths) {
        List<String> labels = new ArrayList<>(horizonMonths);
        for (int m = 1; m <= horizonMonths; m++) labels.add("M" + m);
        return labels;
    }

    static double percentile(double[] sorted, int length, double p) {
        double index = (p / 100.0) * (length - 1);
        int lower = (int) Math.floor(index);
        int upper = Math.min(lower + 1, length - 1);
        double fraction = index - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    private PercentileTable table(double[][] buffer) {
        requireSealed();
        List<List<Double>> columns = new ArrayList<>(PERCENTILES.length);
        for (int i = 0; i < PERCENTILES.length; i++) columns.add(new ArrayList<>(horizonMonths));

        for (int m = 0; m < horizonMonths; m++) {
            for (int i = 0; i < PERCENTILES.length; i++) {
                columns.get(i).add(round2(percentile(buffer[m], size, PERCENTILES[i])));
            }
        }

        return PercentileTable.builder()
                .months(monthLabels(horizonMonths))
                .p5(columns.get(0))
                .p10(columns.get(1))
                .p25(columns.get(2))
                .p50(columns.get(3))
                .p75(columns.get(4))
                .p90(columns.get(5))
                .p95(columns.get(6))
                .build();
    }

    private void ensureCapacity(int required) {
        int capacity = cash[0].length;
        if (required <= capacity) return;
        int grown = Math.max(required, capacity * 2);
        for (int m = 0; m < horizonMonths; m++) {
            cash[m] = Arrays.copyOf(cash[m], grown);
            revenue[m] = Arrays.copyOf(revenue[m], grown);
        }
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("이미 봉인된 집계기입니다");
        }
    }

    private void requireSealed() {
        if (!sealed) {
            throw new IllegalStateException("seal() 호출 전에는 퍼센타일을 계산할 수 없습니다");
        }
    }

    static double round2(double value) {
        return round(value, 2);
    }

    static double round4(double value) {
        return round(value, 4);
    }

    private static double round(double value, int scale) {
        if (!Double.isFinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
