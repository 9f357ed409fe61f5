package com.browserswarm.pool;

import com.browserswarm.config.SwarmProperties;

/**
 * Network location of one worker. All workers share the internal agent port;
 * the auxiliary ports are exposed per worker as {@code base + index}.
 */
public record WorkerEndpoint(
        int workerId,
        String host,
        int agentPort,
        int videoPort,
        int mcpPort,
        int vncPort
) {

    public static WorkerEndpoint forWorker(int workerId, SwarmProperties.Pool config) {
        int index = workerId - 1;
        return new WorkerEndpoint(
                workerId,
                config.getHostTemplate().formatted(workerId),
                config.getAgentPort(),
                config.getVideoBasePort() + index,
                config.getMcpBasePort() + index,
                config.getVncBasePort() + index);
    }

    public String baseUrl() {
        return "http://" + host + ":" + agentPort;
    }
}
