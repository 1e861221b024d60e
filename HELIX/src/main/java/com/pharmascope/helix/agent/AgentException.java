package com.pharmascope.helix.agent;

import com.pharmascope.helix.domain.model.AgentErrorKind;

import java.time.Duration;

/**
 * Failure raised by an agent's live or fallback path.
 */
public class AgentException extends RuntimeException {

    private final String agentName;
    private final AgentErrorKind kind;

    public AgentException(String agentName, AgentErrorKind kind, String message) {
        super(message);
        this.agentName = agentName;
        this.kind = kind;
    }

    public AgentException(String agentName, AgentErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.agentName = agentName;
        this.kind = kind;
    }

    public String getAgentName() {
        return agentName;
    }

    public AgentErrorKind getKind() {
        return kind;
    }

    public static AgentException timeout(String agentName, Duration budget) {
        return new AgentException(agentName, AgentErrorKind.TIMEOUT,
                agentName + " did not answer within " + budget.toMillis() + "ms");
    }

    public static AgentException upstream(String agentName, String message, Throwable cause) {
        return new AgentException(agentName, AgentErrorKind.UPSTREAM_ERROR, message, cause);
    }

    public static AgentException invalidInput(String agentName, String message, Throwable cause) {
        return new AgentException(agentName, AgentErrorKind.INVALID_INPUT, message, cause);
    }

    public static AgentException internal(String agentName, String message, Throwable cause) {
        return new AgentException(agentName, AgentErrorKind.INTERNAL, message, cause);
    }
}
