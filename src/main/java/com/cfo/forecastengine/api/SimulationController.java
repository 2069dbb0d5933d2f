package com.cfo.forecastengine.api;

import com.cfo.forecastengine.domain.model.DistributionType;
import com.cfo.forecastengine.domain.model.SimulationJob;
import com.cfo.forecastengine.domain.model.SimulationJobView;
import com.cfo.forecastengine.domain.model.SimulationStatus;
import com.cfo.forecastengine.domain.service.job.SimulationJobService;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationRequest;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationRun;
import com.cfo.forecastengine.domain.service.montecarlo.SimulationValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/simulations")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class SimulationController {

    private final SimulationJobService jobService;

    @PostMapping
    public ResponseEntity<Object> submit(@RequestBody SimulationRequest request) {
        try {
            SimulationJob job = jobService.submit(request);
            log.info("[Simulation API] 잡 제출: jobId={}, trials={}", job.getId(), job.getNumSimulations());
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                    "success", true,
                    "jobId", job.getId(),
                    "status", job.getStatus()));
        } catch (SimulationValidationException e) {
            return validationFailure(e);
        } catch (IllegalStateException e) {
            return unavailable(e);
        }
    }

    @PostMapping("/run")
    public ResponseEntity<Object> runNow(@RequestBody SimulationRequest request) {
        SimulationRun run;
        try {
            run = jobService.runNow(request);
        } catch (SimulationValidationException e) {
            return validationFailure(e);
        } catch (IllegalStateException e) {
            return unavailable(e);
        }

        if (run.getStatus() == SimulationStatus.DONE) {
            return ResponseEntity.ok(run.getResult());
        }
        HttpStatus status = run.getStatus() == SimulationStatus.FAILED
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.CONFLICT;
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("status", run.getStatus());
        body.put("message", run.getErrorMessage() != null ? run.getErrorMessage() : "시뮬레이션이 완료되지 않았습니다");
        body.put("logs", run.getLogs());
        return ResponseEntity.status(status).body(body);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<Object> status(@PathVariable String jobId) {
        return jobService.getStatus(jobId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> notFound(jobId));
    }

    @GetMapping("/{jobId}/result")
    public ResponseEntity<Object> result(@PathVariable String jobId) {
        Optional<SimulationJobView> view = jobService.getStatus(jobId);
        if (view.isEmpty()) {
            return notFound(jobId);
        }
        if (view.get().getStatus() != SimulationStatus.DONE) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "success", false,
                    "jobId", jobId,
                    "status", view.get().getStatus(),
                    "message", "시뮬레이션 결과가 아직 없습니다."));
        }
        return jobService.getResult(jobId)
                .<ResponseEntity<Object>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                        "success", false,
                        "jobId", jobId,
                        "message", "결과 저장 중입니다. 잠시 후 다시 조회하세요.")));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<Object> cancel(@PathVariable String jobId) {
        if (jobService.getStatus(jobId).isEmpty()) {
            return notFound(jobId);
        }
        boolean accepted = jobService.cancel(jobId);
        log.info("[Simulation API] 취소 요청: jobId={}, accepted={}", jobId, accepted);
        if (!accepted) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of(
                    "success", false,
                    "jobId", jobId,
                    "message", "이미 종료된 잡입니다."));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "jobId", jobId,
                "message", "취소 요청이 접수되었습니다. 진행 중인 시행이 끝나면 중단됩니다."));
    }

    @GetMapping("/distributions")
    public ResponseEntity<List<Map<String, Object>>> distributions() {
        List<Map<String, Object>> catalogue = Arrays.stream(DistributionType.values())
                .map(d -> Map.<String, Object>of(
                        "type", d.getValue(),
                        "name", d.getDisplayName(),
                        "params", d.getParams(),
                        "description", d.getDescription()))
                .toList();
        return ResponseEntity.ok(catalogue);
    }

    private ResponseEntity<Object> validationFailure(SimulationValidationException e) {
        List<Map<String, String>> errors = e.getErrors().stream()
                .map(err -> Map.of("field", err.field(), "message", err.message()))
                .toList();
        log.info("[Simulation API] 검증 실패: errors={}", errors.size());
        return ResponseEntity.badRequest().body(Map.of(
                "success", false,
                "message", e.getMessage(),
                "errors", errors));
    }

    private ResponseEntity<Object> unavailable(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of(
                "success", false,
                "message", e.getMessage()));
    }

    private ResponseEntity<Object> notFound(String jobId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "success", false,
                "jobId", jobId,
                "message", "존재하지 않는 잡입니다."));
    }
}
