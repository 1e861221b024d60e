package com.pharmascope.helix.api.v1;

import com.pharmascope.helix.orchestration.AgentDescriptor;
import com.pharmascope.helix.orchestration.EngineDiagnostics;
import com.pharmascope.helix.orchestration.ResearchOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only engine diagnostics.
 */
@RestController
@RequestMapping("/api/v1/diagnostics")
@Tag(name = "Diagnostics", description = "Circuit breaker states, job counts and agent catalog")
public class DiagnosticsController {

    private final ResearchOrchestrator orchestrator;

    public DiagnosticsController(ResearchOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping
    @Operation(summary = "Engine diagnostics", description = "Breaker state per agent and job counts by status")
    @ApiResponse(responseCode = "200", description = "Diagnostics snapshot")
    public Mono<EngineDiagnostics> getDiagnostics() {
        return orchestrator.diagnostics();
    }

    @GetMapping("/agents")
    @Operation(summary = "Agent catalog", description = "Registered agents and their effective settings")
    @ApiResponse(responseCode = "200", description = "Agent list")
    public Flux<AgentDescriptor> getAgents() {
        return orchestrator.agents();
    }
}
