package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.DriverSpec;
import com.cfo.forecastengine.domain.model.SensitivityResult;
import com.cfo.forecastengine.domain.model.SimulationConfig;
import com.cfo.forecastengine.domain.model.SimulationResult;
import com.cfo.forecastengine.domain.model.SimulationStatus;
import com.cfo.forecastengine.domain.model.Trajectory;
import com.cfo.forecastengine.domain.service.projection.TrialProjector;
import com.cfo.forecastengine.domain.service.sensitivity.SensitivityAnalyzer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SplittableRandom;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

@Slf4j
@Service
public class SimulationRunner {

    static final int MAX_FAILING_SAMPLES = 5;

    private final DistributionSampler sampler;
    private final TrialProjector projector;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final ResultAssembler resultAssembler;
    private final SimulationProperties properties;
    private final ExecutorService workerPool;
    private final MeterRegistry meterRegistry;

    private final Counter discardedCounter;
    private final Timer runTimer;

    public SimulationRunner(DistributionSampler sampler,
                            TrialProjector projector,
                            SensitivityAnalyzer sensitivityAnalyzer,
                            ResultAssembler resultAssembler,
                            SimulationProperties properties,
                            @Qualifier("simulationWorkerPool") ExecutorService workerPool,
                            MeterRegistry meterRegistry) {
        this.sampler = sampler;
        this.projector = projector;
        this.sensitivityAnalyzer = sensitivityAnalyzer;
        this.resultAssembler = resultAssembler;
        this.properties = properties;
        this.workerPool = workerPool;
        this.meterRegistry = meterRegistry;
        this.discardedCounter = Counter.builder("simulation.trials.discarded")
                .description("Trials discarded because the projection produced non-finite figures")
                .register(meterRegistry);
        this.runTimer = Timer.builder("simulation.run.duration")
                .description("Wall time of a complete simulation run")
                .register(meterRegistry);
    }

    public SimulationRun newRun(SimulationConfig config) {
        return new SimulationRun(UUID.randomUUID().toString(), config.getNumSimulations());
    }

    public SimulationRun execute(SimulationConfig config) {
        SimulationRun run = newRun(config);
        run(config, run);
        return run;
    }

    public void run(SimulationConfig config, SimulationRun run) {
        if (!run.start()) {
            log.info("[MC] 시작 전 종료된 실행, 스킵: runId={}, status={}", run.getRunId(), run.getStatus());
            return;
        }

        long startNano = System.nanoTime();
        long seed = config.hasSeed() ? config.getSeed() : new SplittableRandom().nextLong();
        log.info("[MC] 시뮬레이션 시작: runId={}, trials={}, horizon={}, drivers={}, seed={}",
                run.getRunId(), config.getNumSimulations(), config.getHorizonMonths(),
                config.getDrivers().keySet(), seed);

        try {
            TrialTotals totals = runTrials(config, run, seed);
            if (totals == null || run.isCancelRequested()) {
                finishCancelled(run);
                return;
            }

            int discarded = totals.discarded();
            if (discarded > 0) {
                String warning = String.format("integrity warning: discarded %d of %d trials (%.2f%%), continuing with %d",
                        discarded, config.getNumSimulations(),
                        100.0 * discarded / config.getNumSimulations(), totals.percentiles().size());
                run.log(warning);
                log.warn("[MC] 폐기 시행 발생, 축소된 표본으로 진행: runId={}, discarded={}, kept={}",
                        run.getRunId(), discarded, totals.percentiles().size());
            }

            SensitivityResult sensitivity = sensitivityAnalyzer.analyze(config, seed);
            if (run.isCancelRequested()) {
                finishCancelled(run);
                return;
            }

            long durationMs = (System.nanoTime() - startNano) / 1_000_000;
            SimulationResult result = resultAssembler.assemble(config, seed, totals.percentiles(),
                    totals.survival(), sensitivity, discarded, durationMs);
            run.complete(result);
            record(run, startNano);

            log.info("[MC] 시뮬레이션 완료: runId={}, kept={}, discarded={}, survival={}, elapsed={}ms",
                    run.getRunId(), totals.percentiles().size(), discarded,
                    String.format("%.3f", result.getSurvivalProbability().getOverall().getProbabilitySurvivingFullPeriod()),
                    durationMs);
        } catch (SimulationIntegrityException e) {
            run.log("SimulationIntegrityError: " + e.getMessage());
            run.log("sample failing drivers: " + e.getSampleFailingDrivers());
            run.fail(e.getMessage());
            record(run, startNano);
            log.error("[MC] 무결성 오류로 실패: runId={}, discarded={}, attempted={}, samples={}",
                    run.getRunId(), e.getDiscardedTrials(), e.getAttemptedTrials(), e.getSampleFailingDrivers());
        } catch (RuntimeException e) {
            run.log("error: " + e.getMessage());
            run.fail(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            record(run, startNano);
            log.error("[MC] 시뮬레이션 실패: runId={}", run.getRunId(), e);
        }
    }

    private TrialTotals runTrials(SimulationConfig config, SimulationRun run, long seed) {
        int total = config.getNumSimulations();
        int horizon = config.getHorizonMonths();
        int batchSize = Math.max(1, properties.getBatchSize());
        int wave = Math.max(1, properties.getWorkerThreads());
        int maxDiscarded = (int) Math.floor(total * properties.getMaxDiscardRatio());
        int[] thresholds = properties.runwayThresholdsArray();
        List<DriverSpec> drivers = new ArrayList<>(config.getDrivers().values());

        SplittableRandom master = new SplittableRandom(seed);
        PercentileAggregator percentiles = new PercentileAggregator(horizon, total);
        SurvivalAnalyzer survival = new SurvivalAnalyzer(horizon, thresholds);
        List<Map<String, Double>> failingSamples = new ArrayList<>();
        int discarded = 0;
        int nextTrial = 0;

        while (nextTrial < total) {
            if (run.isCancelRequested()) return null;

            List<Future<BatchOutcome>> futures = new ArrayList<>(wave);
            for (int w = 0; w < wave && nextTrial < total; w++) {
                int count = Math.min(batchSize, total - nextTrial);
                long[] trialSeeds = new long[count];
                for (int i = 0; i < count; i++) trialSeeds[i] = master.nextLong();
                futures.add(workerPool.submit(() -> runBatch(config, drivers, trialSeeds, thresholds, run)));
                nextTrial += count;
            }

            boolean cancelled = false;
            for (Future<BatchOutcome> future : futures) {
                BatchOutcome batch = await(future, futures);
                percentiles.merge(batch.percentiles());
                survival.merge(batch.survival());
                discarded += batch.discarded();
                for (Map<String, Double> sample : batch.failingSamples()) {
                    if (failingSamples.size() < MAX_FAILING_SAMPLES) failingSamples.add(sample);
                }
                cancelled |= batch.cancelled();
            }
            if (cancelled) return null;

            if (discarded > maxDiscarded) {
                discardedCounter.increment(discarded);
                throw new SimulationIntegrityException(discarded, nextTrial,
                        properties.getMaxDiscardRatio(), failingSamples);
            }
            log.debug("[MC] 배치 병합: runId={}, progress={}/{}", run.getRunId(), nextTrial, total);
        }

        if (discarded > 0) discardedCounter.increment(discarded);
        return new TrialTotals(percentiles, survival, discarded);
    }

    private BatchOutcome runBatch(SimulationConfig config, List<DriverSpec> drivers, long[] trialSeeds,
                                  int[] thresholds, SimulationRun run) {
        int horizon = config.getHorizonMonths();
        PercentileAggregator percentiles = new PercentileAggregator(horizon, trialSeeds.length);
        SurvivalAnalyzer survival = new SurvivalAnalyzer(horizon, thresholds);
        List<Map<String, Double>> failing = new ArrayList<>();
        int discarded = 0;

        for (long trialSeed : trialSeeds) {
            if (run.isCancelRequested()) {
                return new BatchOutcome(percentiles, survival, discarded, failing, true);
            }

            Map<String, Double> sampled = sampler.sampleAll(drivers, new SplittableRandom(trialSeed));
            Trajectory trajectory = projector.project(sampled, config.getBaselineAssumptions(), horizon);
            if (trajectory.isFinite()) {
                percentiles.accept(trajectory);
                survival.accept(trajectory);
            } else {
                discarded++;
                if (failing.size() < MAX_FAILING_SAMPLES) failing.add(sampled);
                log.debug("[MC] 비유한 시행 폐기: runId={}, drivers={}", run.getRunId(), sampled);
            }
            run.trialCompleted();
        }
        return new BatchOutcome(percentiles, survival, discarded, failing, false);
    }

    private BatchOutcome await(Future<BatchOutcome> future, List<Future<BatchOutcome>> siblings) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            siblings.forEach(f -> f.cancel(true));
            throw new IllegalStateException("시뮬레이션 스레드 인터럽트", e);
        } catch (ExecutionException e) {
            siblings.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new IllegalStateException("시행 배치 실패", cause);
        }
    }

    private void finishCancelled(SimulationRun run) {
        run.cancel();
        meterRegistry.counter("simulation.runs", "status", SimulationStatus.CANCELLED.toJson()).increment();
        log.info("[MC] 시뮬레이션 취소: runId={}, reason={}, completedTrials={}",
                run.getRunId(), run.getCancelReason(), run.getCompletedTrials());
    }

    private void record(SimulationRun run, long startNano) {
        runTimer.record(System.nanoTime() - startNano, TimeUnit.NANOSECONDS);
        meterRegistry.counter("simulation.runs", "status", run.getStatus().toJson()).increment();
    }

    private record BatchOutcome(PercentileAggregator percentiles,
                                SurvivalAnalyzer survival,
                                int discarded,
                                List<Map<String, Double>> failingSamples,
                                boolean cancelled) {
    }

    private record TrialTotals(PercentileAggregator percentiles, SurvivalAnalyzer survival, int discarded) {
    }
}
