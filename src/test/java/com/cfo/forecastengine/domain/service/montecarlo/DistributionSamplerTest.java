package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.DistributionType;
import com.cfo.forecastengine.domain.model.DriverSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DistributionSamplerTest {

    private final DistributionSampler sampler = new DistributionSampler();

    @Test
    @DisplayName("정규분포 샘플은 항상 [min, max] 범위 안에 있다")
    void normalSamplesStayWithinBounds() {
        DriverSpec spec = SimulationFixtures.normal("revenue_growth", 8.0, 3.0, 2.0, 15.0);
        SplittableRandom rng = new SplittableRandom(7L);

        double sum = 0;
        for (int i = 0; i < 10_000; i++) {
            double value = sampler.sample(spec, rng);
            assertThat(value).isBetween(2.0, 15.0);
            sum += value;
        }
        assertThat(sum / 10_000).isCloseTo(8.0, within(0.2));
    }

    @Test
    @DisplayName("로그정규 샘플의 산술평균은 드라이버 mean에 수렴한다")
    void lognormalMatchesArithmeticMean() {
        DriverSpec spec = spec(DistributionType.LOGNORMAL, 125.0, 25.0, 0.0, 10_000.0);
        SplittableRandom rng = new SplittableRandom(11L);

        double sum = 0;
        for (int i = 0; i < 20_000; i++) {
            double value = sampler.sample(spec, rng);
            assertThat(value).isPositive();
            sum += value;
        }
        assertThat(sum / 20_000).isCloseTo(125.0, within(1.5));
    }

    @Test
    @DisplayName("삼각분포는 범위를 지키고 평균이 (min + mode + max) / 3 이다")
    void triangularRespectsBoundsAndMean() {
        DriverSpec spec = spec(DistributionType.TRIANGULAR, 3.5, 0.0, 1.5, 6.0);
        SplittableRandom rng = new SplittableRandom(3L);

        double sum = 0;
        for (int i = 0; i < 10_000; i++) {
            double value = sampler.sample(spec, rng);
            assertThat(value).isBetween(1.5, 6.0);
            sum += value;
        }
        assertThat(sum / 10_000).isCloseTo((1.5 + 3.5 + 6.0) / 3, within(0.05));
    }

    @Test
    @DisplayName("분산이 0이거나 범위가 한 점이면 해당 값을 그대로 반환한다")
    void degenerateDriversReturnFixedValue() {
        SplittableRandom rng = new SplittableRandom(1L);

        assertThat(sampler.sample(SimulationFixtures.normal("flat", 5.0, 0.0, 0.0, 10.0), rng)).isEqualTo(5.0);
        assertThat(sampler.sample(spec(DistributionType.TRIANGULAR, 4.0, 0.0, 4.0, 4.0), rng)).isEqualTo(4.0);
        assertThat(sampler.sample(spec(DistributionType.LOGNORMAL, 9.0, 0.0, 1.0, 20.0), rng)).isEqualTo(9.0);
    }

    @Test
    @DisplayName("범위를 벗어난 값은 재샘플링 없이 경계로 clamp 된다")
    void clampsInsteadOfResampling() {
        DriverSpec spec = SimulationFixtures.normal("wide", 0.0, 1_000.0, -1.0, 1.0);
        SplittableRandom rng = new SplittableRandom(5L);

        int atBound = 0;
        for (int i = 0; i < 1_000; i++) {
            double value = sampler.sample(spec, rng);
            if (value == -1.0 || value == 1.0) atBound++;
        }
        assertThat(atBound).isGreaterThan(990);
    }

    @Test
    @DisplayName("같은 시드는 같은 샘플 시퀀스를 만든다")
    void sameSeedSameSequence() {
        List<DriverSpec> drivers = List.of(
                SimulationFixtures.normal("a", 8.0, 3.0, 2.0, 15.0),
                spec(DistributionType.LOGNORMAL, 125.0, 25.0, 80.0, 200.0),
                spec(DistributionType.TRIANGULAR, 3.5, 0.0, 1.5, 6.0));

        SplittableRandom first = new SplittableRandom(42L);
        SplittableRandom second = new SplittableRandom(42L);
        for (int i = 0; i < 100; i++) {
            Map<String, Double> a = sampler.sampleAll(drivers, first);
            Map<String, Double> b = sampler.sampleAll(drivers, second);
            assertThat(a).isEqualTo(b);
        }
    }

    @Test
    @DisplayName("min > max 인 드라이버는 샘플링을 거부한다")
    void rejectsInvertedRange() {
        DriverSpec spec = SimulationFixtures.normal("broken", 5.0, 1.0, 10.0, 0.0);

        assertThatThrownBy(() -> sampler.sample(spec, new SplittableRandom(1L)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("broken");
    }

    private static DriverSpec spec(DistributionType type, double mean, double stdDev, double min, double max) {
        return DriverSpec.builder()
                .id(type.getValue())
                .name(type.getDisplayName())
                .distribution(type)
                .mean(mean)
                .stdDev(stdDev)
                .min(min)
                .max(max)
                .build();
    }
}
