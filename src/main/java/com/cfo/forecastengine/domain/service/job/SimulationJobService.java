package com.cfo.forecastengine.domain.service.job;

import com.cfo.forecastengine.domain.model.SimulationConfig;
import com.cfo.forecastengine.domain.model.SimulationJob;
import com.cfo.forecastengine.domain.model.SimulationJobView;
import com.cfo.forecastengine.domain.model.SimulationResult;
import com.cfo.forecastengine.domain.model.SimulationStatus;
import com.cfo.forecastengine.domain.repository.SimulationJobRepository;
import com.cfo.forecastengine.domain.service.montecarlo.DriverSpecValidator;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationProperties;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationRequest;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationRun;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationRunner;
import com.cfo.forecastengine.infra.websocket.SimulationProgressBroadcaster;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.HexFormat;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class SimulationJobService {

    private static final TypeReference<List<String>> LOG_LIST = new TypeReference<>() {
    };
    private static final Duration CANCEL_GRACE = Duration.ofSeconds(30);

    private final DriverSpecValidator validator;
    private final SimulationRunner runner;
    private final SimulationJobRepository repository;
    private final SimulationProperties properties;
    private final SimulationProgressBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;
    private final ExecutorService jobExecutor;

    private final Map<String, ActiveJob> activeJobs = new ConcurrentHashMap<>();

    public SimulationJobService(DriverSpecValidator validator,
                                SimulationRunner runner,
                                SimulationJobRepository repository,
                                SimulationProperties properties,
                                SimulationProgressBroadcaster broadcaster,
                                ObjectMapper objectMapper,
                                @Qualifier("simulationJobExecutor") ExecutorService jobExecutor) {
        this.validator = validator;
        this.runner = runner;
        this.repository = repository;
        this.properties = properties;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.canonicalMapper = objectMapper.copy()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.jobExecutor = jobExecutor;
    }

    @PostConstruct
    public void failOrphanedJobs() {
        List<SimulationJob> orphaned = repository.findByStatusIn(
                List.of(SimulationStatus.QUEUED, SimulationStatus.RUNNING));
        for (SimulationJob job : orphaned) {
            job.setStatus(SimulationStatus.FAILED);
            job.setErrorMessage("interrupted by service restart");
            job.setFinishedAt(Instant.now());
            repository.save(job);
        }
        if (!orphaned.isEmpty()) {
            log.warn("[Job] 재시작으로 중단된 잡 실패 처리: count={}", orphaned.size());
        }
    }

    public SimulationJob submit(SimulationRequest request) {
        requireEnabled();
        SimulationConfig config = validator.validate(request);
        String paramsHash = paramsHash(config);

        if (config.hasSeed()) {
            Optional<SimulationJob> cached = findCached(paramsHash);
            if (cached.isPresent()) {
                log.info("[Job] 캐시된 결과 재사용: jobId={}, paramsHash={}", cached.get().getId(), paramsHash);
                return cached.get();
            }
        }

        SimulationRun run = runner.newRun(config);

        SimulationJob job = SimulationJob.builder()
                .id(run.getRunId())
                .status(SimulationStatus.QUEUED)
                .progress(0.0)
                .numSimulations(config.getNumSimulations())
                .horizonMonths(config.getHorizonMonths())
                .seed(config.getSeed())
                .paramsHash(paramsHash)
                .logsJson("[]")
                .createdAt(Instant.now())
                .build();
        repository.save(job);
        activeJobs.put(job.getId(), new ActiveJob(run, job.getCreatedAt()));

        try {
            jobExecutor.submit(() -> execute(config, run));
        } catch (RejectedExecutionException e) {
            activeJobs.remove(job.getId());
            run.requestCancel("executor rejected job");
            persistTerminal(run);
            throw new IllegalStateException("시뮬레이션 잡을 실행 대기열에 넣을 수 없습니다", e);
        }

        log.info("[Job] 시뮬레이션 잡 등록: jobId={}, trials={}, horizon={}, drivers={}",
                job.getId(), config.getNumSimulations(), config.getHorizonMonths(), config.getDrivers().size());
        return job;
    }

    public SimulationRun runNow(SimulationRequest request) {
        requireEnabled();
        SimulationConfig config = validator.validate(request);
        SimulationRun run = runner.newRun(config);
        Future<?> future = jobExecutor.submit(() -> runner.run(config, run));

        Duration timeout = properties.getJobTimeout();
        try {
            if (timeout == null) {
                future.get();
            } else {
                future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (TimeoutException e) {
            run.requestCancel("timeout after " + timeout);
            log.warn("[Job] 동기 실행 타임아웃으로 취소: runId={}, timeout={}, progress={}",
                    run.getRunId(), timeout, String.format("%.3f", run.getProgress()));
            awaitCancellation(future, run);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.requestCancel("interrupted");
        } catch (ExecutionException e) {
            throw new IllegalStateException("동기 시뮬레이션 실행 실패: runId=" + run.getRunId(), e.getCause());
        }
        return run;
    }

    private void awaitCancellation(Future<?> future, SimulationRun run) {
        try {
            future.get(CANCEL_GRACE.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Job] 취소 대기 중 종료되지 않음: runId={}, status={}", run.getRunId(), run.getStatus(), e);
        }
    }

    public Optional<SimulationJobView> getStatus(String jobId) {
        ActiveJob active = activeJobs.get(jobId);
        if (active != null) {
            return Optional.of(view(active.run()));
        }
        return repository.findById(jobId).map(this::view);
    }

    public Optional<SimulationResult> getResult(String jobId) {
        return repository.findById(jobId)
                .filter(job -> job.getStatus() == SimulationStatus.DONE && job.getResultJson() != null)
                .map(job -> readResult(job.getResultJson()));
    }

    public boolean cancel(String jobId) {
        ActiveJob active = activeJobs.get(jobId);
        if (active == null || active.run().getStatus().isTerminal()) {
            return false;
        }
        active.run().requestCancel("cancel requested");
        repository.findById(jobId).ifPresent(job -> {
            job.setCancelRequested(true);
            repository.save(job);
        });
        log.info("[Job] 취소 요청: jobId={}, status={}", jobId, active.run().getStatus());
        return true;
    }

    @Scheduled(fixedDelayString = "${simulation.progress-broadcast-interval-ms:1000}")
    public void sweepActiveJobs() {
        Duration timeout = properties.getJobTimeout();
        Instant now = Instant.now();

        for (Map.Entry<String, ActiveJob> entry : activeJobs.entrySet()) {
            SimulationRun run = entry.getValue().run();
            if (run.getStatus().isTerminal()) continue;

            if (timeout != null && Duration.between(entry.getValue().submittedAt(), now).compareTo(timeout) > 0
                    && !run.isCancelRequested()) {
                run.requestCancel("timeout after " + timeout);
                log.warn("[Job] 타임아웃으로 취소: jobId={}, timeout={}, progress={}",
                        entry.getKey(), timeout, String.format("%.3f", run.getProgress()));
            }

            persistProgress(entry.getKey(), run);
            broadcaster.broadcast(view(run));
        }
    }

    void execute(SimulationConfig config, SimulationRun run) {
        try {
            runner.run(config, run);
        } finally {
            persistTerminal(run);
            activeJobs.remove(run.getRunId());
            broadcaster.broadcast(view(run));
        }
    }

    private synchronized void persistProgress(String jobId, SimulationRun run) {
        repository.findById(jobId).ifPresent(job -> {
            if (run.getStatus().isTerminal() || (job.getStatus() != null && job.getStatus().isTerminal())) return;
            if (job.getStatus() != run.getStatus() || job.getProgress() != run.getProgress()) {
                job.setStatus(run.getStatus());
                job.setProgress(run.getProgress());
                job.setStartedAt(run.getStartedAt());
                repository.save(job);
            }
        });
    }

    private synchronized void persistTerminal(SimulationRun run) {
        SimulationJob job = repository.findById(run.getRunId()).orElse(null);
        if (job == null) {
            log.error("[Job] 저장된 잡을 찾을 수 없음: jobId={}", run.getRunId());
            return;
        }

        job.setStatus(run.getStatus());
        job.setProgress(run.getProgress());
        job.setStartedAt(run.getStartedAt());
        job.setFinishedAt(run.getFinishedAt() != null ? run.getFinishedAt() : Instant.now());
        job.setErrorMessage(truncate(run.getErrorMessage()));
        job.setCancelRequested(run.isCancelRequested());

        if (run.getStatus() == SimulationStatus.DONE) {
            try {
                job.setResultJson(objectMapper.writeValueAsString(run.getResult()));
            } catch (JsonProcessingException e) {
                log.error("[Job] 결과 직렬화 실패: jobId={}", run.getRunId(), e);
                job.setStatus(SimulationStatus.FAILED);
                job.setErrorMessage(truncate("result serialization failed: " + e.getOriginalMessage()));
            }
        }
        job.setLogsJson(writeLogs(run.getLogs()));
        repository.save(job);

        log.info("[Job] 잡 종료: jobId={}, status={}, progress={}",
                job.getId(), job.getStatus(), String.format("%.3f", job.getProgress()));
    }

    private Optional<SimulationJob> findCached(String paramsHash) {
        Duration ttl = properties.getCacheTtl();
        if (ttl == null || ttl.isZero() || ttl.isNegative()) return Optional.empty();
        return repository.findFirstByParamsHashAndStatusAndCreatedAtAfter(
                        paramsHash, SimulationStatus.DONE, Instant.now().minus(ttl))
                .filter(job -> job.getResultJson() != null);
    }

    String paramsHash(SimulationConfig config) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsString(config).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("파라미터 해시 계산 실패", e);
        }
    }

    private SimulationJobView view(SimulationRun run) {
        return SimulationJobView.builder()
                .jobId(run.getRunId())
                .status(run.getStatus())
                .progress(run.getProgress())
                .logs(run.getLogs())
                .errorMessage(run.getErrorMessage())
                .finishedAt(run.getFinishedAt())
                .build();
    }

    private SimulationJobView view(SimulationJob job) {
        return SimulationJobView.builder()
                .jobId(job.getId())
                .status(job.getStatus())
                .progress(job.getProgress())
                .logs(readLogs(job.getLogsJson()))
                .errorMessage(job.getErrorMessage())
                .createdAt(job.getCreatedAt())
                .finishedAt(job.getFinishedAt())
                .build();
    }

    private SimulationResult readResult(String json) {
        try {
            return objectMapper.readValue(json, SimulationResult.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("저장된 결과를 읽을 수 없습니다", e);
        }
    }

    private String writeLogs(List<String> logs) {
        try {
            return objectMapper.writeValueAsString(logs);
        } catch (JsonProcessingException e) {
            log.warn("[Job] 로그 직렬화 실패, 빈 로그로 저장", e);
            return "[]";
        }
    }

    private List<String> readLogs(String json) {
        if (json == null || json.isBlank()) return List.of();
        try {
            return objectMapper.readValue(json, LOG_LIST);
        } catch (JsonProcessingException e) {
            log.warn("[Job] 로그 역직렬화 실패", e);
            return List.of();
        }
    }

    private void requireEnabled() {
        if (!properties.isEnabled()) {
            throw new IllegalStateException("시뮬레이션 엔진이 비활성 상태입니다");
        }
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= 2000 ? message : message.substring(0, 2000);
    }

    private record ActiveJob(SimulationRun run, Instant submittedAt) {
    }
}
