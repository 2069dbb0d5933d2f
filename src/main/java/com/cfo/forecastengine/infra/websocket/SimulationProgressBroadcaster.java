package com.cfo.forecastengine.infra.websocket;

import com.cfo.forecastengine.domain.model.SimulationJobView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SimulationProgressBroadcaster {

    private final SimpMessagingTemplate messagingTemplate;

    public void broadcast(SimulationJobView view) {
        String destination = "/topic/simulation/" + view.getJobId();
        messagingTemplate.convertAndSend(destination, Map.of(
                "jobId", view.getJobId(),
                "status", view.getStatus(),
                "progress", view.getProgress()));

        log.debug("[Broadcast] 진행률 → {}, status={}, progress={}",
                destination, view.getStatus(), String.format("%.3f", view.getProgress()));
    }
}
