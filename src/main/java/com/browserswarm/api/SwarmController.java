package com.browserswarm.api;

import com.browserswarm.orchestration.model.SwarmStatus;
import com.browserswarm.orchestration.service.SwarmRunService;
import jakarta.validation.Valid;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/swarm")
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "false", matchIfMissing = true)
public class SwarmController {

    private final SwarmRunService runService;

    public SwarmController(SwarmRunService runService) {
        this.runService = runService;
    }

    @PostMapping("/execute")
    public SwarmRunResponse execute(@Valid @RequestBody SwarmExecuteRequest request) {
        return SwarmRunResponse.from(runService.execute(request.instruction()));
    }

    @PostMapping("/execute/stream")
    public RunAcceptedResponse executeStream(@Valid @RequestBody SwarmExecuteRequest request) {
        String runId = runService.submit(request.instruction());
        return new RunAcceptedResponse(runId, Instant.now());
    }

    @PostMapping("/claim")
    public ClaimResponse claim(@Valid @RequestBody ClaimRequest request) {
        boolean approved = runService.claim(request.agentId(), request.label());
        return new ClaimResponse(approved, request.label());
    }

    @GetMapping("/status")
    public SwarmStatus status() {
        return runService.status();
    }

    @GetMapping("/runs")
    public List<RunSummaryResponse> runs() {
        return runService.recentRuns().stream()
                .map(RunSummaryResponse::from)
                .toList();
    }
}
