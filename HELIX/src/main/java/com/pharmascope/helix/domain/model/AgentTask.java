package com.pharmascope.helix.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.pharmascope.helix.exception.ErrorCode;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Execution record for one (job, agent) pair.
 * Once the status is terminal the record is never replaced.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AgentTask {

    /**
     * Name of the agent this task runs.
     */
    String agentName;

    /**
     * Current sub-status.
     */
    AgentTaskStatus status;

    /**
     * LIVE or FALLBACK; null while queued.
     */
    DataSource source;

    Instant startedAt;

    Instant finishedAt;

    /**
     * Usable result, present for SUCCEEDED and FALLBACK_USED.
     */
    AgentResult result;

    /**
     * Failure category, present when the live or fallback call failed.
     */
    AgentErrorKind errorKind;

    ErrorCode errorCode;

    String errorMessage;

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    public static AgentTask queued(String agentName) {
        return AgentTask.builder()
                .agentName(agentName)
                .status(AgentTaskStatus.QUEUED)
                .build();
    }

    /**
     * Marks the task in flight on the given path. The first call sets {@code startedAt}.
     */
    public AgentTask running(DataSource path, Instant now) {
        return toBuilder()
                .status(AgentTaskStatus.RUNNING)
                .source(path)
                .startedAt(startedAt != null ? startedAt : now)
                .build();
    }

    public AgentTask succeeded(AgentResult agentResult, Instant now) {
        return toBuilder()
                .status(AgentTaskStatus.SUCCEEDED)
                .source(DataSource.LIVE)
                .result(agentResult)
                .finishedAt(now)
                .build();
    }

    /**
     * Settles with a degraded result. A cached result keeps its own source tag
     * while the task itself is reported as FALLBACK.
     */
    public AgentTask fallbackUsed(AgentResult agentResult, AgentErrorKind liveErrorKind,
                                  String liveErrorMessage, Instant now) {
        return toBuilder()
                .status(AgentTaskStatus.FALLBACK_USED)
                .source(DataSource.FALLBACK)
                .result(agentResult)
                .errorKind(liveErrorKind)
                .errorCode(liveErrorKind != null ? liveErrorKind.getErrorCode() : null)
                .errorMessage(liveErrorMessage)
                .finishedAt(now)
                .build();
    }

    public AgentTask failed(AgentErrorKind kind, String message, DataSource attemptedSource, Instant now) {
        return toBuilder()
                .status(AgentTaskStatus.FAILED)
                .source(attemptedSource)
                .errorKind(kind)
                .errorCode(kind.getErrorCode())
                .errorMessage(message)
                .finishedAt(now)
                .build();
    }

    /**
     * Keeps the source of the path that was in flight; a task that never started has none.
     */
    public AgentTask timedOut(String message, Instant now) {
        return toBuilder()
                .status(AgentTaskStatus.TIMED_OUT)
                .errorKind(AgentErrorKind.TIMEOUT)
                .errorCode(ErrorCode.AGENT_TIMEOUT)
                .errorMessage(message)
                .finishedAt(now)
                .build();
    }
}
