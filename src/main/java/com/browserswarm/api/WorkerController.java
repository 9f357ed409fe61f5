package com.browserswarm.api;

import com.browserswarm.agent.AgentBusyException;
import com.browserswarm.agent.BrowserAgent;
import com.browserswarm.pool.WorkerExecuteRequest;
import com.browserswarm.pool.WorkerExecuteResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Endpoints a worker process exposes to the coordinator's pool.
 */
@RestController
@ConditionalOnProperty(name = "swarm.worker.enabled", havingValue = "true")
@Slf4j
public class WorkerController {

    private final BrowserAgent agent;

    public WorkerController(BrowserAgent agent) {
        this.agent = agent;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }

    @PostMapping("/execute")
    public ResponseEntity<WorkerExecuteResponse> execute(@Valid @RequestBody WorkerExecuteRequest request) {
        log.info("Executing task: {}", abbreviate(request.instruction()));
        try {
            String response = agent.execute(request.instruction());
            log.info("Task completed successfully.");
            return ResponseEntity.ok(WorkerExecuteResponse.success(response));
        } catch (AgentBusyException ex) {
            log.warn(ex.getMessage());
            return ResponseEntity.status(HttpStatus.CONFLICT).body(WorkerExecuteResponse.error(ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Error executing task: {}", ex.getMessage(), ex);
            return ResponseEntity.ok(WorkerExecuteResponse.error(ex.getMessage()));
        }
    }

    private static String abbreviate(String value) {
        return value.length() <= 100 ? value : value.substring(0, 100) + "...";
    }
}
