package com.browserswarm.api;

import java.util.List;

public record ServicesResponse(
        Endpoint orchestrator,
        List<WorkerService> workers,
        List<BrowserService> browsers,
        int workerCount
) {

    public record Endpoint(String ws, String http) {
    }

    public record WorkerService(int id, String ws, String http) {
    }

    public record BrowserService(int id, String videoWs, String vncWs) {
    }
}
