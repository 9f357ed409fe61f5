package com.browserswarm.orchestration.model;

import org.springframework.lang.Nullable;

public record AgentRunResult(
        int agentId,
        @Nullable String claimedItem,
        String result,
        AgentStatus status,
        @Nullable String error
) {

    public static AgentRunResult working(int agentId, @Nullable String label) {
        return new AgentRunResult(agentId, label, "", AgentStatus.WORKING, null);
    }

    public static AgentRunResult done(int agentId, @Nullable String claimedItem, String result) {
        return new AgentRunResult(agentId, claimedItem, result != null ? result : "", AgentStatus.DONE, null);
    }

    public static AgentRunResult error(int agentId, String error) {
        return new AgentRunResult(agentId, null, "", AgentStatus.ERROR, error);
    }

    public AgentRunResult withClaimedItem(@Nullable String item) {
        return new AgentRunResult(agentId, item, result, status, error);
    }

    public boolean isDone() {
        return status == AgentStatus.DONE;
    }
}
