package com.pharmascope.helix.api.v1;

import com.pharmascope.helix.api.dto.AnalysisRequest;
import com.pharmascope.helix.api.dto.JobStatusResponse;
import com.pharmascope.helix.api.dto.JobSubmitResponse;
import com.pharmascope.helix.domain.model.Report;
import com.pharmascope.helix.orchestration.ResearchOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.net.URI;

/**
 * REST controller for research analysis jobs.
 */
@RestController
@RequestMapping(AnalysisController.BASE_PATH)
@Tag(name = "Analyses", description = "Research job submission, status polling and reports")
@Slf4j
public class AnalysisController {

    static final String BASE_PATH = "/api/v1/analyses";

    private final ResearchOrchestrator orchestrator;

    public AnalysisController(ResearchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    @Operation(summary = "Submit analysis", description = "Start a research job for a query")
    @ApiResponse(responseCode = "202", description = "Job accepted")
    @ApiResponse(responseCode = "400", description = "Empty or over-long query, or unknown agent")
    public Mono<ResponseEntity<JobSubmitResponse>> submit(@Valid @RequestBody AnalysisRequest request) {
        log.info("Submitting analysis: agents={}, analysisType={}", request.getAgents(), request.getAnalysisType());

        return orchestrator.submit(request.toCommand())
                .map(job -> ResponseEntity
                        .accepted()
                        .location(URI.create(BASE_PATH + "/" + job.getId()))
                        .body(JobSubmitResponse.from(job, BASE_PATH)));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Overall status, per-agent sub-status and progress")
    @ApiResponse(responseCode = "200", description = "Job found")
    @ApiResponse(responseCode = "404", description = "Job not found")
    public Mono<ResponseEntity<JobStatusResponse>> getStatus(
            @Parameter(description = "Job ID") @PathVariable String jobId) {

        return orchestrator.status(jobId)
                .map(JobStatusResponse::from)
                .map(ResponseEntity::ok);
    }

    @GetMapping("/{jobId}/report")
    @Operation(summary = "Get report",
               description = "Aggregated report of a settled job; inspect compositeStatus for partial failure")
    @ApiResponse(responseCode = "200", description = "Report available")
    @ApiResponse(responseCode = "404", description = "Job not found")
    @ApiResponse(responseCode = "409", description = "Job still running")
    public Mono<ResponseEntity<Report>> getReport(
            @Parameter(description = "Job ID") @PathVariable String jobId) {

        return orchestrator.result(jobId)
                .map(ResponseEntity::ok);
    }
}
