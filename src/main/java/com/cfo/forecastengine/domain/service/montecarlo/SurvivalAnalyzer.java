package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.SurvivalProbability;
import com.cfo.forecastengine.domain.model.SurvivalProbability.HistogramBucket;
import com.cfo.forecastengine.domain.model.SurvivalProbability.MonthSurvival;
import com.cfo.forecastengine.domain.model.SurvivalProbability.Overall;
import com.cfo.forecastengine.domain.model.SurvivalProbability.RiskLevel;
import com.cfo.forecastengine.domain.model.SurvivalProbability.RunwayThreshold;
import com.cfo.forecastengine.domain.model.SurvivalProbability.Summary;
import com.cfo.forecastengine.domain.model.Trajectory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class SurvivalAnalyzer {

    static final int[] HISTOGRAM_EDGES = {0, 3, 6, 12, 18, 24};

    private final int horizonMonths;
    private final int[] runwayThresholds;

    private final int[] exhaustedAt;
    private int survivors;
    private int total;

    public SurvivalAnalyzer(int horizonMonths, int[] runwayThresholds) {
        this.horizonMonths = horizonMonths;
        this.runwayThresholds = runwayThresholds.clone();
        this.exhaustedAt = new int[horizonMonths];
    }

    public void accept(Trajectory trajectory) {
        int index = findExhaustion(trajectory);
        if (index < 0) {
            survivors++;
        } else {
            exhaustedAt[index]++;
        }
        total++;
    }

    public void merge(SurvivalAnalyzer other) {
        if (other.horizonMonths != horizonMonths) {
            throw new IllegalArgumentException("horizon이 다른 생존 분석기는 병합할 수 없습니다");
        }
        for (int m = 0; m < horizonMonths; m++) {
            exhaustedAt[m] += other.exhaustedAt[m];
        }
        survivors += other.survivors;
        total += other.total;
    }

    public int total() {
        return total;
    }

    /**
     * @return 0-based index of the first month with negative cash, or -1 when cash never goes negative
     */
    static int findExhaustion(Trajectory trajectory) {
        for (int m = 0; m < trajectory.months(); m++) {
            if (trajectory.cashBalance(m) < 0) {
                return m;
            }
        }
        return -1;
    }

    public SurvivalProbability result() {
        if (total == 0) {
            throw new IllegalStateException("분석할 시행이 없습니다");
        }

        int failed = total - survivors;
        double fullPeriod = (double) survivors / total;

        return SurvivalProbability.builder()
                .overall(Overall.builder()
                        .probabilitySurvivingFullPeriod(fullPeriod)
                        .percentageSurvivingFullPeriod(fullPeriod * 100)
                        .averageMonthsToFailure(failed == 0 ? null : averageFailureMonth(failed))
                        .medianMonthsToFailure(failed == 0 ? null : medianFailureMonth(failed))
                        .totalSimulations(total)
                        .simulationsSurvived(survivors)
                        .simulationsFailed(failed)
                        .build())
                .runwayThresholds(thresholds())
                .byMonth(byMonth())
                .runwayHistogram(histogram())
                .summary(Summary.builder()
                        .keyMessage(String.format(Locale.US,
                                "Probability of survival: %.1f%% chance of surviving the full %d-month forecast period",
                                fullPeriod * 100, horizonMonths))
                        .riskLevel(RiskLevel.fromSurvival(fullPeriod))
                        .build())
                .build();
    }

    int survivingThrough(int k) {
        int exhaustedBefore = 0;
        for (int m = 0; m < Math.min(k, horizonMonths); m++) {
            exhaustedBefore += exhaustedAt[m];
        }
        return total - exhaustedBefore;
    }

    private Map<String, RunwayThreshold> thresholds() {
        Map<String, RunwayThreshold> result = new LinkedHashMap<>();
        for (int k : runwayThresholds) {
            if (k < 1 || k > horizonMonths) continue;
            int survived = survivingThrough(k);
            double probability = (double) survived / total;
            result.put(SurvivalProbability.thresholdKey(k), RunwayThreshold.builder()
                    .thresholdMonths(k)
                    .probability(probability)
                    .percentage(probability * 100)
                    .simulationsSurvived(survived)
                    .simulationsFailed(total - survived)
                    .build());
        }
        return result;
    }

    private List<MonthSurvival> byMonth() {
        List<MonthSurvival> months = new ArrayList<>(horizonMonths);
        List<String> labels = PercentileAggregator.monthLabels(horizonMonths);
        for (int k = 1; k <= horizonMonths; k++) {
            double probability = (double) survivingThrough(k) / total;
            months.add(MonthSurvival.builder()
                    .month(labels.get(k - 1))
                    .monthIndex(k)
                    .probability(probability)
                    .percentage(probability * 100)
                    .build());
        }
        return months;
    }

    private List<HistogramBucket> histogram() {
        List<HistogramBucket> buckets = new ArrayList<>();
        for (int i = 0; i < HISTOGRAM_EDGES.length; i++) {
            int from = HISTOGRAM_EDGES[i];
            if (from >= horizonMonths) break;
            Integer to = i + 1 < HISTOGRAM_EDGES.length ? HISTOGRAM_EDGES[i + 1] : null;

            int count = 0;
            for (int m = 0; m < horizonMonths; m++) {
                int month = m + 1;
                if (month > from && (to == null || month <= to)) {
                    count += exhaustedAt[m];
                }
            }
            buckets.add(HistogramBucket.builder()
                    .label(to == null ? from + "+" : from + "-" + to)
                    .fromMonth(from)
                    .toMonth(to)
                    .count(count)
                    .probability((double) count / total)
                    .build());
        }
        buckets.add(HistogramBucket.builder()
                .label("survived")
                .fromMonth(horizonMonths)
                .toMonth(null)
                .count(survivors)
                .probability((double) survivors / total)
                .build());
        return buckets;
    }

    private double averageFailureMonth(int failed) {
        long sum = 0;
        for (int m = 0; m < horizonMonths; m++) {
            sum += (long) exhaustedAt[m] * (m + 1);
        }
        return (double) sum / failed;
    }

    private double medianFailureMonth(int failed) {
        double lowerRank = (failed - 1) / 2.0;
        int lo = (int) Math.floor(lowerRank);
        int hi = (int) Math.ceil(lowerRank);
        return (monthAtRank(lo) + monthAtRank(hi)) / 2.0;
    }

    private int monthAtRank(int rank) {
        int seen = 0;
        for (int m = 0; m < horizonMonths; m++) {
            seen += exhaustedAt[m];
            if (rank < seen) return m + 1;
        }
        return horizonMonths;
    }
}
