package com.browserswarm.api;

import com.browserswarm.config.SwarmProperties;
import com.browserswarm.pool.WorkerEndpoint;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * Service discovery for front ends: external URLs derived from the pool port layout.
 */
@RestController
@RequestMapping("/api/services")
public class ServicesController {

    private final SwarmProperties properties;
    private final int serverPort;

    public ServicesController(SwarmProperties properties, @Value("${server.port:8100}") int serverPort) {
        this.properties = properties;
        this.serverPort = serverPort;
    }

    @GetMapping
    public ServicesResponse services() {
        SwarmProperties.Pool pool = properties.getPool();
        String host = pool.getPublicHost();
        List<ServicesResponse.WorkerService> workers = new ArrayList<>();
        List<ServicesResponse.BrowserService> browsers = new ArrayList<>();
        for (int id = 1; id <= pool.getSize(); id++) {
            WorkerEndpoint endpoint = WorkerEndpoint.forWorker(id, pool);
            int agentPort = pool.getAgentExternalBasePort() + id - 1;
            workers.add(new ServicesResponse.WorkerService(id,
                    "ws://%s:%d/ws".formatted(host, agentPort),
                    "http://%s:%d".formatted(host, agentPort)));
            browsers.add(new ServicesResponse.BrowserService(id,
                    "ws://%s:%d".formatted(host, endpoint.videoPort()),
                    "ws://%s:%d".formatted(host, endpoint.vncPort())));
        }
        ServicesResponse.Endpoint orchestrator = new ServicesResponse.Endpoint(
                "ws://%s:%d/ws/swarm".formatted(host, serverPort),
                "http://%s:%d".formatted(host, serverPort));
        return new ServicesResponse(orchestrator, workers, browsers, pool.getSize());
    }
}
