package com.pharmascope.helix.orchestration;

import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.AgentTaskStatus;
import com.pharmascope.helix.domain.model.CompositeStatus;
import com.pharmascope.helix.domain.model.FailureNote;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.model.Report;
import com.pharmascope.helix.domain.model.ReportEntry;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the report of a settled job. Agent payloads are carried over as-is.
 */
@Component
public class ReportAggregator {

    public Report aggregate(Job job) {
        if (!job.allTasksTerminal()) {
            throw new IllegalStateException("Cannot aggregate job " + job.getId() + " with outstanding tasks");
        }

        Map<String, ReportEntry> entries = new LinkedHashMap<>();
        int succeeded = 0;
        int fallbackUsed = 0;
        int failed = 0;

        for (String agentName : job.getRequestedAgents()) {
            AgentTask task = job.getTask(agentName);
            AgentTaskStatus status = task.getStatus();
            if (status == AgentTaskStatus.SUCCEEDED) {
                succeeded++;
            } else if (status == AgentTaskStatus.FALLBACK_USED) {
                fallbackUsed++;
            } else {
                failed++;
            }
            entries.put(agentName, toEntry(task));
        }

        int requested = job.getRequestedAgents().size();
        double coverage = requested == 0 ? 0.0 : (double) (succeeded + fallbackUsed) / requested;

        return Report.builder()
                .jobId(job.getId())
                .query(job.getQuery())
                .entries(Collections.unmodifiableMap(entries))
                .coverageRatio(coverage)
                .compositeStatus(CompositeStatus.fromCoverage(coverage))
                .requested(requested)
                .succeeded(succeeded)
                .fallbackUsed(fallbackUsed)
                .failed(failed)
                .generatedAt(Instant.now())
                .build();
    }

    private ReportEntry toEntry(AgentTask task) {
        ReportEntry.ReportEntryBuilder entry = ReportEntry.builder()
                .agentName(task.getAgentName())
                .status(task.getStatus())
                .source(task.getSource());

        if (task.getStatus().isUsable() && task.getResult() != null) {
            return entry.result(task.getResult()).build();
        }
        return entry.failure(FailureNote.builder()
                        .status(task.getStatus())
                        .kind(task.getErrorKind())
                        .code(task.getErrorCode())
                        .message(task.getErrorMessage())
                        .build())
                .build();
    }
}
