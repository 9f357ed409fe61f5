package com.browserswarm.pool;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@Slf4j
public class RestClientWorkerTransport implements WorkerTransport {

    private final RestClient restClient;
    private volatile boolean closed;

    public RestClientWorkerTransport(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public int probe(WorkerEndpoint endpoint) {
        ensureOpen();
        try {
            return restClient.get()
                    .uri(endpoint.baseUrl() + "/health")
                    .exchange((request, response) -> response.getStatusCode().value());
        } catch (RestClientException ex) {
            throw new WorkerTransportException("Worker " + endpoint.workerId() + " not reachable: " + ex.getMessage(), ex);
        }
    }

    @Override
    public WorkerResponse execute(WorkerEndpoint endpoint, String instruction) {
        ensureOpen();
        try {
            return restClient.post()
                    .uri(endpoint.baseUrl() + "/execute")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new WorkerExecuteRequest(instruction))
                    .exchange((request, response) -> {
                        int status = response.getStatusCode().value();
                        if (status != 200) {
                            return new WorkerResponse(status, null, null);
                        }
                        WorkerExecuteResponse payload = response.bodyTo(WorkerExecuteResponse.class);
                        if (payload == null) {
                            return new WorkerResponse(status, "", null);
                        }
                        return new WorkerResponse(status, payload.response(), payload.status());
                    });
        } catch (RestClientException ex) {
            throw new WorkerTransportException("Worker " + endpoint.workerId() + " call failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            log.info("Worker transport closed");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new WorkerTransportException("Worker transport is closed");
        }
    }
}
