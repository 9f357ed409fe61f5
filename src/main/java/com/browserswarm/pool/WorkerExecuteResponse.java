package com.browserswarm.pool;

public record WorkerExecuteResponse(
        String response,
        String status
) {
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_ERROR = "error";

    public static WorkerExecuteResponse success(String response) {
        return new WorkerExecuteResponse(response, STATUS_SUCCESS);
    }

    public static WorkerExecuteResponse error(String message) {
        return new WorkerExecuteResponse("Error: " + message, STATUS_ERROR);
    }
}
