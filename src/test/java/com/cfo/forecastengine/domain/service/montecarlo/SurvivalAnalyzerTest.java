package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.SurvivalProbability;
import com.cfo.forecastengine.domain.model.SurvivalProbability.HistogramBucket;
import com.cfo.forecastengine.domain.model.SurvivalProbability.MonthSurvival;
import com.cfo.forecastengine.domain.model.SurvivalProbability.RiskLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SurvivalAnalyzerTest {

    @Test
    @DisplayName("현금이 처음 음수가 되는 달을 소진 시점으로 본다")
    void findsFirstNegativeMonth() {
        assertThat(SurvivalAnalyzer.findExhaustion(SimulationFixtures.cashPath(100, -5, 10))).isEqualTo(1);
        assertThat(SurvivalAnalyzer.findExhaustion(SimulationFixtures.cashPath(-1, 5, 5))).isZero();
        assertThat(SurvivalAnalyzer.findExhaustion(SimulationFixtures.cashPath(100, 0, 20))).isEqualTo(-1);
    }

    @Test
    @DisplayName("알려진 경로로 임계치별 생존 확률과 실패 통계를 계산한다")
    void computesThresholdsFromKnownPaths() {
        SurvivalAnalyzer analyzer = new SurvivalAnalyzer(3, new int[]{1, 2, 3, 6});
        analyzer.accept(SimulationFixtures.cashPath(100, -5, 10));
        analyzer.accept(SimulationFixtures.cashPath(100, 50, 20));
        analyzer.accept(SimulationFixtures.cashPath(-1, 5, 5));

        SurvivalProbability result = analyzer.result();

        assertThat(result.getRunwayThresholds()).containsOnlyKeys("1_months", "2_months", "3_months");
        assertThat(result.getRunwayThresholds().get("1_months").getProbability()).isCloseTo(2.0 / 3, within(1e-9));
        assertThat(result.getRunwayThresholds().get("2_months").getProbability()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(result.getRunwayThresholds().get("3_months").getSimulationsSurvived()).isEqualTo(1);

        assertThat(result.getOverall().getProbabilitySurvivingFullPeriod()).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(result.getOverall().getSimulationsFailed()).isEqualTo(2);
        assertThat(result.getOverall().getAverageMonthsToFailure()).isEqualTo(1.5);
        assertThat(result.getOverall().getMedianMonthsToFailure()).isEqualTo(1.5);
        assertThat(result.getSummary().getRiskLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(result.getSummary().getKeyMessage()).contains("33.3%").contains("3-month");

        assertThat(result.getRunwayHistogram()).extracting(HistogramBucket::getLabel).containsExactly("0-3", "survived");
        assertThat(result.getRunwayHistogram()).extracting(HistogramBucket::getCount).containsExactly(2, 1);
    }

    @Test
    @DisplayName("월별 생존 확률은 누적이므로 회복한 경로도 소진 이후 생존으로 세지 않는다")
    void byMonthIsCumulativeAcrossRecovery() {
        SurvivalAnalyzer analyzer = new SurvivalAnalyzer(3, new int[]{1, 3});
        analyzer.accept(SimulationFixtures.cashPath(10, -5, 20));

        SurvivalProbability result = analyzer.result();

        assertThat(result.getByMonth()).extracting(MonthSurvival::getMonth).containsExactly("M1", "M2", "M3");
        assertThat(result.getByMonth()).extracting(MonthSurvival::getProbability).containsExactly(1.0, 0.0, 0.0);
        assertThat(result.getByMonth().get(2).getPercentage()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("실패한 시행이 없으면 평균 소진 월은 null 이다")
    void noFailuresMeansNoAverage() {
        SurvivalAnalyzer analyzer = new SurvivalAnalyzer(2, new int[]{1, 2});
        analyzer.accept(SimulationFixtures.cashPath(10, 20));
        analyzer.accept(SimulationFixtures.cashPath(0, 0));

        SurvivalProbability result = analyzer.result();
        assertThat(result.getOverall().getAverageMonthsToFailure()).isNull();
        assertThat(result.getOverall().getMedianMonthsToFailure()).isNull();
        assertThat(result.getOverall().getPercentageSurvivingFullPeriod()).isEqualTo(100.0);
        assertThat(result.getSummary().getRiskLevel()).isEqualTo(RiskLevel.LOW);
    }

    @Test
    @DisplayName("생존 확률은 임계치와 월이 늘어날수록 증가하지 않는다")
    void survivalIsNonIncreasing() {
        Random random = new Random(13);
        SurvivalAnalyzer left = new SurvivalAnalyzer(24, new int[]{3, 6, 9, 12, 18, 24});
        SurvivalAnalyzer right = new SurvivalAnalyzer(24, new int[]{3, 6, 9, 12, 18, 24});
        for (int t = 0; t < 2_000; t++) {
            double[] cash = new double[24];
            double balance = 50;
            for (int m = 0; m < 24; m++) {
                balance += random.nextGaussian() * 10 - 1;
                cash[m] = balance;
            }
            (t % 2 == 0 ? left : right).accept(SimulationFixtures.cashPath(cash));
        }
        left.merge(right);

        SurvivalProbability result = left.result();
        assertThat(left.total()).isEqualTo(2_000);
        assertThat(result.getRunwayThresholds().get("6_months").getProbability())
                .isGreaterThanOrEqualTo(result.getRunwayThresholds().get("12_months").getProbability());
        assertThat(result.getRunwayThresholds().get("12_months").getProbability())
                .isGreaterThanOrEqualTo(result.getRunwayThresholds().get("18_months").getProbability());
        assertThat(result.getByMonth()).extracting(MonthSurvival::getProbability).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertThat(result.getByMonth().get(23).getProbability())
                .isEqualTo(result.getOverall().getProbabilitySurvivingFullPeriod());
        assertThat(result.getRunwayHistogram().stream().mapToInt(HistogramBucket::getCount).sum()).isEqualTo(2_000);
    }
}
