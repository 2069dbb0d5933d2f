package com.cfo.forecastengine.infra.config;

import com.cfo.forecastengine.domain.service.montecarlo.SimulationProperties;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class SimulationExecutorConfig {

    private static final int JOB_THREADS = 2;

    private final SimulationProperties properties;

    private ExecutorService workerPool;
    private ExecutorService jobExecutor;

    @Bean(name = "simulationWorkerPool")
    public ExecutorService simulationWorkerPool() {
        int threads = Math.max(1, properties.getWorkerThreads());
        workerPool = Executors.newFixedThreadPool(threads, namedThreadFactory("mc-worker"));
        log.info("[Executor] 시행 워커 풀 기동: threads={}, batchSize={}", threads, properties.getBatchSize());
        return workerPool;
    }

    @Bean(name = "simulationJobExecutor")
    public ExecutorService simulationJobExecutor() {
        jobExecutor = Executors.newFixedThreadPool(JOB_THREADS, namedThreadFactory("mc-job"));
        log.info("[Executor] 잡 실행기 기동: threads={}", JOB_THREADS);
        return jobExecutor;
    }

    @PreDestroy
    public void shutdown() {
        log.info("[Executor] 종료 시작...");
        shutdown(jobExecutor, "job");
        shutdown(workerPool, "worker");
    }

    private void shutdown(ExecutorService executor, String name) {
        if (executor == null) return;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Executor] {} 풀이 제한 시간 내 종료되지 않음", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
