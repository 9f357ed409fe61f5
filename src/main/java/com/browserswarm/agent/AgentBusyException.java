package com.browserswarm.agent;

public class AgentBusyException extends RuntimeException {

    public AgentBusyException(int agentId) {
        super("Agent " + agentId + " is already executing an instruction");
    }
}
