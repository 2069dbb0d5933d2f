package com.cfo.forecastengine.domain.service.sensitivity;

import com.cfo.forecastengine.domain.model.DriverSpec;
import com.cfo.forecastengine.domain.model.SensitivityResult;
import com.cfo.forecastengine.domain.model.SensitivityResult.Entry;
import com.cfo.forecastengine.domain.model.SensitivityResult.TopDriver;
import com.cfo.forecastengine.domain.model.SimulationConfig;
import com.cfo.forecastengine.domain.model.Trajectory;
import com.cfo.forecastengine.domain.service.montecarlo.DistributionSampler;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationProperties;
import com.cfo.forecastengine.domain.service.projection.TrialProjector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SplittableRandom;

@Slf4j
@Component
@RequiredArgsConstructor
// One-at-a-time sweep around driver means; interactions between drivers are not captured.
public class SensitivityAnalyzer {

    static final String METHOD = "one-at-a-time";
    static final int TOP_DRIVER_COUNT = 3;

    private final DistributionSampler sampler;
    private final TrialProjector projector;
    private final SimulationProperties properties;

    public SensitivityResult analyze(SimulationConfig config, long seed) {
        long startNano = System.nanoTime();
        int samples = Math.max(2, properties.getSensitivitySamplesPerDriver());

        Map<String, Double> baseline = baselineValues(config);
        double baselineTerminal = terminalCash(baseline, config);
        if (!Double.isFinite(baselineTerminal)) {
            log.warn("[Sensitivity] 기준 시나리오가 유한하지 않음, 민감도 0으로 처리: drivers={}",
                    config.getDrivers().keySet());
        }

        SplittableRandom master = new SplittableRandom(seed);
        List<Entry> entries = new ArrayList<>(config.getDrivers().size());
        for (DriverSpec driver : config.getDrivers().values()) {
            SplittableRandom rng = master.split();
            entries.add(sweep(driver, baseline, baselineTerminal, samples, rng, config));
        }

        double impactSum = entries.stream().mapToDouble(Entry::getTotalImpact).sum();
        List<Entry> ranked = entries.stream()
                .map(e -> withContribution(e, impactSum))
                .sorted(Comparator.comparingDouble(Entry::getTotalImpact).reversed()
                        .thenComparing(Entry::getDriverId))
                .toList();

        log.debug("[Sensitivity] 완료: drivers={}, samplesPerDriver={}, elapsed={}ms",
                ranked.size(), samples, (System.nanoTime() - startNano) / 1_000_000);

        return SensitivityResult.builder()
                .method(METHOD)
                .samplesPerDriver(samples)
                .baselineTerminalCash(Double.isFinite(baselineTerminal) ? baselineTerminal : 0.0)
                .tornadoData(ranked)
                .topDrivers(topDrivers(ranked, config))
                .build();
    }

    private Entry sweep(DriverSpec driver, Map<String, Double> baseline, double baselineTerminal,
                        int samples, SplittableRandom rng, SimulationConfig config) {
        double[] outcomes = new double[samples];
        int valid = 0;

        for (int i = 0; i < samples; i++) {
            double value;
            if (i == 0) {
                value = driver.getMin();
            } else if (i == 1) {
                value = driver.getMax();
            } else {
                value = sampler.sample(driver, rng);
            }
            Map<String, Double> drivers = new LinkedHashMap<>(baseline);
            drivers.put(driver.getId(), value);
            double terminal = terminalCash(drivers, config);
            if (Double.isFinite(terminal)) {
                outcomes[valid++] = terminal;
            }
        }

        if (valid == 0 || !Double.isFinite(baselineTerminal)) {
            return Entry.builder()
                    .driverId(driver.getId())
                    .driverName(driver.displayName())
                    .unit(driver.getUnit())
                    .baselineValue(driver.getMean())
                    .lowOutcome(0.0)
                    .highOutcome(0.0)
                    .build();
        }

        double low = Double.POSITIVE_INFINITY;
        double high = Double.NEGATIVE_INFINITY;
        double sum = 0;
        for (int i = 0; i < valid; i++) {
            low = Math.min(low, outcomes[i]);
            high = Math.max(high, outcomes[i]);
            sum += outcomes[i];
        }
        double mean = sum / valid;
        double sq = 0;
        for (int i = 0; i < valid; i++) {
            double d = outcomes[i] - mean;
            sq += d * d;
        }

        double upside = Math.max(0.0, high - baselineTerminal);
        double downside = Math.min(0.0, low - baselineTerminal);

        return Entry.builder()
                .driverId(driver.getId())
                .driverName(driver.displayName())
                .unit(driver.getUnit())
                .baselineValue(driver.getMean())
                .lowOutcome(low)
                .highOutcome(high)
                .upsideImpact(upside)
                .downsideImpact(downside)
                .totalImpact(upside + Math.abs(downside))
                .variance(valid > 1 ? sq / (valid - 1) : 0.0)
                .build();
    }

    private Entry withContribution(Entry e, double impactSum) {
        return Entry.builder()
                .driverId(e.getDriverId())
                .driverName(e.getDriverName())
                .unit(e.getUnit())
                .baselineValue(e.getBaselineValue())
                .lowOutcome(e.getLowOutcome())
                .highOutcome(e.getHighOutcome())
                .upsideImpact(e.getUpsideImpact())
                .downsideImpact(e.getDownsideImpact())
                .totalImpact(e.getTotalImpact())
                .variance(e.getVariance())
                .contributionPercentage(impactSum > 0 ? e.getTotalImpact() / impactSum * 100 : 0.0)
                .build();
    }

    private List<TopDriver> topDrivers(List<Entry> ranked, SimulationConfig config) {
        List<TopDriver> top = new ArrayList<>(TOP_DRIVER_COUNT);
        for (int i = 0; i < Math.min(TOP_DRIVER_COUNT, ranked.size()); i++) {
            Entry e = ranked.get(i);
            DriverSpec spec = config.getDrivers().get(e.getDriverId());
            top.add(TopDriver.builder()
                    .rank(i + 1)
                    .driverId(e.getDriverId())
                    .name(e.getDriverName())
                    .contributionPercentage(e.getContributionPercentage())
                    .totalImpact(e.getTotalImpact())
                    .description(describe(e, spec))
                    .build());
        }
        return top;
    }

    static String describe(Entry e, DriverSpec spec) {
        if (e.getTotalImpact() == 0.0) {
            return String.format(Locale.US, "%s has no measurable effect on ending cash within its range.",
                    e.getDriverName());
        }
        String weight;
        if (e.getContributionPercentage() >= 40) {
            weight = "Dominant source of forecast uncertainty";
        } else if (e.getContributionPercentage() >= 20) {
            weight = "Major source of forecast uncertainty";
        } else {
            weight = "Moderate source of forecast uncertainty";
        }
        String unit = spec.getUnit() != null ? spec.getUnit() : "";
        return String.format(Locale.US,
                "%s (%.1f%% of total swing): moving %s between %s%s and %s%s shifts ending cash from %s to %s.",
                weight, e.getContributionPercentage(), e.getDriverName(),
                formatNumber(spec.getMin()), unit, formatNumber(spec.getMax()), unit,
                formatMoney(e.getLowOutcome()), formatMoney(e.getHighOutcome()));
    }

    private Map<String, Double> baselineValues(SimulationConfig config) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (DriverSpec driver : config.getDrivers().values()) {
            values.put(driver.getId(), driver.getMean());
        }
        return values;
    }

    private double terminalCash(Map<String, Double> drivers, SimulationConfig config) {
        Trajectory trajectory = projector.project(drivers, config.getBaselineAssumptions(), config.getHorizonMonths());
        return trajectory.isFinite() ? trajectory.terminalCash() : Double.NaN;
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value)
                ? String.format(Locale.US, "%.0f", value)
                : String.format(Locale.US, "%.2f", value);
    }

    private static String formatMoney(double value) {
        double abs = Math.abs(value);
        String sign = value < 0 ? "-" : "";
        if (abs >= 1_000_000) return String.format(Locale.US, "%s$%.2fM", sign, abs / 1_000_000);
        if (abs >= 1_000) return String.format(Locale.US, "%s$%.0fK", sign, abs / 1_000);
        return String.format(Locale.US, "%s$%.0f", sign, abs);
    }
}
