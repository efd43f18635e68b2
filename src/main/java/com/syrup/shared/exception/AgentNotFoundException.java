package com.syrup.shared.exception;

public class AgentNotFoundException extends RuntimeException {

    public AgentNotFoundException(String agentName) {
        super("Agent " + agentName + " not found");
    }
}
