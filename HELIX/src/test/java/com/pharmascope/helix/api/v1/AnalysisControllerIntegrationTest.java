package com.pharmascope.helix.api.v1;

import com.pharmascope.helix.api.dto.JobSubmitResponse;
import com.pharmascope.helix.domain.model.JobStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests of the analysis API with all agents in stub mode.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class AnalysisControllerIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    private JobSubmitResponse submit(Map<String, Object> body) {
        return webTestClient.post()
                .uri(AnalysisController.BASE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange()
                .expectStatus().isAccepted()
                .expectHeader().exists("Location")
                .expectBody(JobSubmitResponse.class)
                .returnResult()
                .getResponseBody();
    }

    private void awaitReport(String jobId) throws InterruptedException {
        long giveUpAt = System.currentTimeMillis() + Duration.ofSeconds(10).toMillis();
        while (System.currentTimeMillis() < giveUpAt) {
            HttpStatusCode status = webTestClient.get()
                    .uri(AnalysisController.BASE_PATH + "/{jobId}/report", jobId)
                    .exchange()
                    .returnResult(String.class)
                    .getStatus();
            if (status.value() == HttpStatus.OK.value()) {
                return;
            }
            assertThat(status.value()).isEqualTo(HttpStatus.CONFLICT.value());
            Thread.sleep(50);
        }
        throw new AssertionError("Report for job " + jobId + " not ready in time");
    }

    @Test
    @DisplayName("should accept a comprehensive analysis and serve a COMPLETE report")
    void submitPollAndFetchReport() throws InterruptedException {
        // Given
        JobSubmitResponse submitted = submit(Map.of("query", "imatinib"));

        // Then
        assertThat(submitted.getJobId()).isNotBlank();
        assertThat(submitted.getRequestedAgents()).hasSize(10);
        assertThat(submitted.getStatusUrl()).endsWith("/" + submitted.getJobId());

        webTestClient.get()
                .uri(AnalysisController.BASE_PATH + "/{jobId}", submitted.getJobId())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.jobId").isEqualTo(submitted.getJobId())
                .jsonPath("$.perAgent.length()").isEqualTo(10);

        awaitReport(submitted.getJobId());

        webTestClient.get()
                .uri(AnalysisController.BASE_PATH + "/{jobId}/report", submitted.getJobId())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.compositeStatus").isEqualTo("COMPLETE")
                .jsonPath("$.coverageRatio").isEqualTo(1.0)
                .jsonPath("$.entries.market.result.payload.insights").exists();

        webTestClient.get()
                .uri(AnalysisController.BASE_PATH + "/{jobId}", submitted.getJobId())
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo(JobStatus.COMPLETED.name())
                .jsonPath("$.progressFraction").isEqualTo(1.0);
    }

    @Test
    @DisplayName("should run only the agents of an explicit subset")
    void explicitSubset() {
        JobSubmitResponse submitted = submit(Map.of(
                "query", "semaglutide",
                "agents", List.of("patent", "clinical")));

        assertThat(submitted.getRequestedAgents()).containsExactly("patent", "clinical");
    }

    @Test
    @DisplayName("should answer 400 INVALID_QUERY for a blank query")
    void blankQuery() {
        webTestClient.post()
                .uri(AnalysisController.BASE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", " "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_QUERY");
    }

    @Test
    @DisplayName("should answer 400 INVALID_QUERY for an unknown agent")
    void unknownAgent() {
        webTestClient.post()
                .uri(AnalysisController.BASE_PATH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("query", "imatinib", "agents", List.of("astrology")))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_QUERY")
                .jsonPath("$.message").value(message -> assertThat((String) message).contains("astrology"));
    }

    @Test
    @DisplayName("should answer 404 NOT_FOUND for an unknown job")
    void unknownJob() {
        webTestClient.get()
                .uri(AnalysisController.BASE_PATH + "/{jobId}", "no-such-job")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo("NOT_FOUND");

        webTestClient.get()
                .uri(AnalysisController.BASE_PATH + "/{jobId}/report", "no-such-job")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    @DisplayName("should expose one breaker per agent in diagnostics")
    void diagnostics() {
        webTestClient.get()
                .uri("/api/v1/diagnostics")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.circuitBreakers.length()").isEqualTo(10)
                .jsonPath("$.jobsByStatus").exists();

        webTestClient.get()
                .uri("/api/v1/diagnostics/agents")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].name").isEqualTo("market")
                .jsonPath("$.length()").isEqualTo(10);
    }

    @Test
    @DisplayName("should report UP with breaker details on the health endpoint")
    void health() {
        webTestClient.get()
                .uri("/actuator/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.components.helix.details.agents").isEqualTo(10);
    }
}
