package com.browserswarm.pool;

/**
 * Outbound transport the pool uses to reach worker processes.
 */
public interface WorkerTransport extends AutoCloseable {

    /**
     * Calls the worker's liveness endpoint.
     *
     * @return the HTTP status code returned by the worker
     * @throws WorkerTransportException when the worker cannot be reached
     */
    int probe(WorkerEndpoint endpoint);

    /**
     * Sends one instruction to the worker's execution endpoint and waits for the answer.
     * Non-200 answers are returned, not thrown.
     *
     * @throws WorkerTransportException when the worker cannot be reached
     */
    WorkerResponse execute(WorkerEndpoint endpoint, String instruction);

    @Override
    default void close() {
    }
}
