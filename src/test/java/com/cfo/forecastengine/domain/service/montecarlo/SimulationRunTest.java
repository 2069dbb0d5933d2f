package com.cfo.forecastengine.domain.service.montecarlo;

import com.cfo.forecastengine.domain.model.SimulationStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SimulationRun 상태/진행률 테스트")
class SimulationRunTest {

    @Test
    @DisplayName("모든 시행이 끝나도 완료 전까지 진행률은 1.0 에 도달하지 않는다")
    void progressStaysBelowOneUntilDone() {
        SimulationRun run = new SimulationRun("run-1", 10);
        assertThat(run.start()).isTrue();

        for (int i = 0; i < 5; i++) run.trialCompleted();
        assertThat(run.getProgress()).isEqualTo(0.475);

        for (int i = 0; i < 5; i++) run.trialCompleted();
        assertThat(run.getStatus()).isEqualTo(SimulationStatus.RUNNING);
        assertThat(run.getProgress()).isEqualTo(SimulationRun.TRIAL_PHASE_WEIGHT).isLessThan(1.0);

        run.complete(null);
        assertThat(run.getStatus()).isEqualTo(SimulationStatus.DONE);
        assertThat(run.getProgress()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("대기 중 취소된 실행은 시작되지 않는다")
    void cancelBeforeStart() {
        SimulationRun run = new SimulationRun("run-2", 10);

        run.requestCancel("cancel requested");

        assertThat(run.getStatus()).isEqualTo(SimulationStatus.CANCELLED);
        assertThat(run.start()).isFalse();
        assertThat(run.getFinishedAt()).isNotNull();
        assertThat(run.getLogs()).anyMatch(line -> line.contains("cancel requested"));
    }

    @Test
    @DisplayName("취소된 실행의 진행률은 멈춘 지점에 남는다")
    void cancelledRunKeepsPartialProgress() {
        SimulationRun run = new SimulationRun("run-3", 4);
        run.start();
        run.trialCompleted();
        run.trialCompleted();

        run.requestCancel("timeout after PT1S");
        run.cancel();

        assertThat(run.getStatus()).isEqualTo(SimulationStatus.CANCELLED);
        assertThat(run.getProgress()).isEqualTo(0.475);
        assertThat(run.getLogs()).anyMatch(line -> line.contains("timeout"));
    }
}
