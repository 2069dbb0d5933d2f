package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.DistributionType;
import com.cfo.forecastengine.domain.model.ImpactLevel;
import com.cfo.forecastengine.domain.model.SimulationConfig;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationRequest.DriverInput;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationValidationException.FieldError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DriverSpecValidatorTest {

    private DriverSpecValidator validator;

    @BeforeEach
    void setUp() {
        validator = new DriverSpecValidator(new SimulationProperties());
    }

    @Test
    @DisplayName("유효한 설정은 드라이버 순서를 유지한 채 변환된다")
    void acceptsValidConfiguration() {
        Map<String, DriverInput> drivers = new LinkedHashMap<>();
        drivers.put("revenue_growth", driver("normal", 8.0, 3.0, 2.0, 15.0));
        drivers.put("cac", driver("lognormal", 125.0, 25.0, 80.0, 200.0));
        drivers.put("conversion_rate", driver("Triangular", 3.5, null, 1.5, 6.0));

        SimulationConfig config = validator.validate(SimulationRequest.builder()
                .numSimulations(1000)
                .horizonMonths(12)
                .drivers(drivers)
                .baselineAssumptions(Map.of("revenue", 45_000))
                .seed(42L)
                .build());

        assertThat(config.getNumSimulations()).isEqualTo(1000);
        assertThat(config.getHorizonMonths()).isEqualTo(12);
        assertThat(config.getSeed()).isEqualTo(42L);
        assertThat(config.getDrivers()).containsOnlyKeys("revenue_growth", "cac", "conversion_rate");
        assertThat(config.getDrivers().keySet()).containsExactly("revenue_growth", "cac", "conversion_rate");
        assertThat(config.getDrivers().get("conversion_rate").getDistribution()).isEqualTo(DistributionType.TRIANGULAR);
        assertThat(config.getDrivers().get("cac").getName()).isEqualTo("cac");
        assertThat(config.getDrivers().get("cac").getImpact()).isEqualTo(ImpactLevel.MEDIUM);
        assertThat(config.getBaselineAssumptions()).containsEntry("revenue", 45_000);
    }

    @Test
    @DisplayName("모든 오류를 한 번에 모아서 보고한다")
    void aggregatesEveryError() {
        Map<String, DriverInput> drivers = new LinkedHashMap<>();
        drivers.put("churn_rate", driver("normal", 5.0, 2.0, 10.0, 2.0));
        drivers.put("deal_size", driver("poisson", 2400.0, 400.0, 1500.0, 4000.0));
        drivers.put("revenue_growth", driver("normal", 8.0, 3.0, 2.0, 15.0));

        SimulationValidationException ex = catchThrowableOfType(() -> validator.validate(SimulationRequest.builder()
                .numSimulations(50)
                .horizonMonths(12)
                .drivers(drivers)
                .build()), SimulationValidationException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrors()).extracting(FieldError::field)
                .containsExactlyInAnyOrder("numSimulations", "drivers.churn_rate.min", "drivers.deal_size.distribution");
    }

    @Test
    @DisplayName("알 수 없는 impact 값은 필드 오류로 보고하고 대소문자는 무시한다")
    void validatesImpactLevel() {
        Map<String, DriverInput> drivers = new LinkedHashMap<>();
        drivers.put("x", withImpact("critical"));
        drivers.put("y", withImpact(" HIGH "));
        drivers.put("z", withImpact(""));

        SimulationValidationException ex = catchThrowableOfType(() -> validator.validate(SimulationRequest.builder()
                .numSimulations(1000)
                .horizonMonths(12)
                .drivers(drivers)
                .build()), SimulationValidationException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getErrors()).extracting(FieldError::field).containsExactly("drivers.x.impact");
        assertThat(ex.getErrors().get(0).message()).contains("critical");

        drivers.remove("x");
        SimulationConfig config = validator.validate(SimulationRequest.builder()
                .numSimulations(1000)
                .horizonMonths(12)
                .drivers(drivers)
                .build());
        assertThat(config.getDrivers().get("y").getImpact()).isEqualTo(ImpactLevel.HIGH);
        assertThat(config.getDrivers().get("z").getImpact()).isEqualTo(ImpactLevel.MEDIUM);
    }

    @Test
    @DisplayName("범위를 벗어난 horizon과 시뮬레이션 수를 거부한다")
    void rejectsOutOfRangeBounds() {
        assertThatThrownBy(() -> validator.validate(SimulationRequest.builder()
                .numSimulations(100_001)
                .horizonMonths(61)
                .build()))
                .isInstanceOfSatisfying(SimulationValidationException.class, e ->
                        assertThat(e.getErrors()).extracting(FieldError::field)
                                .containsExactly("numSimulations", "horizonMonths"));
    }

    @Test
    @DisplayName("mean이 범위 밖이거나 stdDev가 음수면 거부한다")
    void rejectsMeanOutsideRangeAndNegativeStdDev() {
        Map<String, DriverInput> drivers = new LinkedHashMap<>();
        drivers.put("a", driver("normal", 20.0, 3.0, 2.0, 15.0));
        drivers.put("b", driver("normal", 5.0, -1.0, 2.0, 15.0));
        drivers.put("c", driver("lognormal", 0.0, 1.0, 0.0, 5.0));

        assertThatThrownBy(() -> validator.validate(SimulationRequest.builder()
                .numSimulations(100)
                .horizonMonths(6)
                .drivers(drivers)
                .build()))
                .isInstanceOfSatisfying(SimulationValidationException.class, e ->
                        assertThat(e.getErrors()).extracting(FieldError::field)
                                .containsExactly("drivers.a.mean", "drivers.b.stdDev", "drivers.c.mean"));
    }

    @Test
    @DisplayName("필수 필드 누락을 필드별로 보고한다")
    void reportsMissingFields() {
        Map<String, DriverInput> drivers = new LinkedHashMap<>();
        drivers.put("x", DriverInput.builder().distribution("normal").build());

        assertThatThrownBy(() -> validator.validate(SimulationRequest.builder().drivers(drivers).build()))
                .isInstanceOfSatisfying(SimulationValidationException.class, e ->
                        assertThat(e.getErrors()).extracting(FieldError::field)
                                .containsExactly("numSimulations", "horizonMonths",
                                        "drivers.x.mean", "drivers.x.min", "drivers.x.max", "drivers.x.stdDev"));
    }

    private static DriverInput withImpact(String impact) {
        return DriverInput.builder()
                .distribution("normal")
                .mean(8.0)
                .stdDev(3.0)
                .min(2.0)
                .max(15.0)
                .impact(impact)
                .build();
    }

    private static DriverInput driver(String distribution, Double mean, Double stdDev, Double min, Double max) {
        return DriverInput.builder()
                .distribution(distribution)
                .mean(mean)
                .stdDev(stdDev)
                .min(min)
                .max(max)
                .unit("%")
                .build();
    }
}
