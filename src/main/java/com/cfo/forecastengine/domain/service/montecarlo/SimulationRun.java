package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.SimulationResult;
import com.cfo.forecastengine.domain.model.SimulationStatus;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

public class SimulationRun {

    // trials fill this share of the bar; sensitivity and assembly own the rest
    static final double TRIAL_PHASE_WEIGHT = 0.95;

    @Getter
    private final String runId;
    @Getter
    private final int totalTrials;

    private final AtomicReference<SimulationStatus> status = new AtomicReference<>(SimulationStatus.QUEUED);
    private final AtomicInteger completedTrials = new AtomicInteger();
    private final List<String> logs = new CopyOnWriteArrayList<>();

    private volatile boolean cancelRequested;
    @Getter
    private volatile String cancelReason;
    @Getter
    private volatile SimulationResult result;
    @Getter
    private volatile String errorMessage;
    @Getter
    private volatile Instant startedAt;
    @Getter
    private volatile Instant finishedAt;

    public SimulationRun(String runId, int totalTrials) {
        this.runId = runId;
        this.totalTrials = totalTrials;
    }

    public SimulationStatus getStatus() {
        return status.get();
    }

    public double getProgress() {
        if (status.get() == SimulationStatus.DONE) return 1.0;
        if (totalTrials <= 0) return 0.0;
        return TRIAL_PHASE_WEIGHT * Math.min(1.0, (double) completedTrials.get() / totalTrials);
    }

    public int getCompletedTrials() {
        return completedTrials.get();
    }

    public List<String> getLogs() {
        return List.copyOf(logs);
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * Asks the run to stop at the next trial or batch boundary. A queued run is cancelled immediately.
     */
    public void requestCancel(String reason) {
        this.cancelReason = reason;
        this.cancelRequested = true;
        if (status.compareAndSet(SimulationStatus.QUEUED, SimulationStatus.CANCELLED)) {
            finishedAt = Instant.now();
            log("cancelled before start: " + reason);
        }
    }

    public void log(String entry) {
        logs.add(entry);
    }

    void trialCompleted() {
        completedTrials.incrementAndGet();
    }

    boolean start() {
        boolean started = status.compareAndSet(SimulationStatus.QUEUED, SimulationStatus.RUNNING);
        if (started) startedAt = Instant.now();
        return started;
    }

    void complete(SimulationResult result) {
        this.result = result;
        finish(SimulationStatus.DONE);
    }

    void fail(String errorMessage) {
        this.errorMessage = errorMessage;
        finish(SimulationStatus.FAILED);
    }

    void cancel() {
        log("cancelled: " + (cancelReason != null ? cancelReason : "requested"));
        finish(SimulationStatus.CANCELLED);
    }

    private void finish(SimulationStatus terminal) {
        if (status.compareAndSet(SimulationStatus.RUNNING, terminal)) {
            finishedAt = Instant.now();
        }
    }
}
