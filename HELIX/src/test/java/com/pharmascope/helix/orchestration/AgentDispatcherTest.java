package com.pharmascope.helix.orchestration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmascope.helix.agent.ScriptedAgent;
import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.AgentErrorKind;
import com.pharmascope.helix.domain.model.AgentTask;
import com.pharmascope.helix.domain.model.AgentTaskStatus;
import com.pharmascope.helix.domain.model.AnalysisType;
import com.pharmascope.helix.domain.model.DataSource;
import com.pharmascope.helix.domain.model.Job;
import com.pharmascope.helix.domain.repository.JobStateStore;
import com.pharmascope.helix.exception.ErrorCode;
import com.pharmascope.helix.observability.StructuredLogger;
import com.pharmascope.helix.resilience.CircuitState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AgentDispatcher}.
 */
class AgentDispatcherTest {

    private EngineFixture fixture(Duration jobDeadline, ScriptedAgent... agents) {
        return new EngineFixture(EngineFixture.properties(jobDeadline, Duration.ofSeconds(2)), List.of(agents));
    }

    private Job createJob(EngineFixture fixture, Duration deadline, String... agents) {
        return fixture.store.create("imatinib", AnalysisType.COMPREHENSIVE, List.of(agents), Map.of(), deadline)
                .block();
    }

    @Nested
    @DisplayName("Live path")
    class LivePathTests {

        @Test
        @DisplayName("should settle every healthy agent as SUCCEEDED with LIVE source")
        void healthyAgentsSucceed() {
            // Given
            ScriptedAgent market = ScriptedAgent.healthy("market");
            ScriptedAgent patent = ScriptedAgent.healthy("patent");
            EngineFixture fixture = fixture(Duration.ofSeconds(5), market, patent);
            Job job = createJob(fixture, Duration.ofSeconds(5), "market", "patent");

            // When / Then
            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> {
                        assertThat(settled.getTasks()).hasSize(2);
                        assertThat(settled.getTasks().values())
                                .allSatisfy(task -> {
                                    assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.SUCCEEDED);
                                    assertThat(task.getSource()).isEqualTo(DataSource.LIVE);
                                    assertThat(task.getStartedAt()).isNotNull();
                                    assertThat(task.getFinishedAt()).isNotNull();
                                });
                    })
                    .verifyComplete();

            assertThat(market.liveCalls()).isEqualTo(1);
            assertThat(market.fallbackCalls()).isZero();
        }

        @Test
        @DisplayName("should not let a slow agent delay the others")
        void agentsRunConcurrently() {
            ScriptedAgent slow = ScriptedAgent.healthy("market").delayed(Duration.ofMillis(400));
            ScriptedAgent fast = ScriptedAgent.healthy("patent");
            EngineFixture fixture = fixture(Duration.ofSeconds(5), slow, fast);
            Job job = createJob(fixture, Duration.ofSeconds(5), "market", "patent");

            fixture.dispatcher.dispatch(job).subscribe();

            Job midway = Mono.delay(Duration.ofMillis(150))
                    .then(fixture.store.get(job.getId()))
                    .block(Duration.ofSeconds(2));
            assertThat(midway.getTask("patent").getStatus()).isEqualTo(AgentTaskStatus.SUCCEEDED);
            assertThat(midway.getTask("market").getStatus()).isEqualTo(AgentTaskStatus.RUNNING);
            assertThat(midway.progressFraction()).isEqualTo(0.5);
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureTests {

        @Test
        @DisplayName("should retry once on the fallback path after an upstream error")
        void upstreamErrorUsesFallback() {
            ScriptedAgent market = ScriptedAgent.healthy("market").failingWith(AgentErrorKind.UPSTREAM_ERROR);
            EngineFixture fixture = fixture(Duration.ofSeconds(5), market);
            Job job = createJob(fixture, Duration.ofSeconds(5), "market");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> {
                        AgentTask task = settled.getTask("market");
                        assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.FALLBACK_USED);
                        assertThat(task.getSource()).isEqualTo(DataSource.FALLBACK);
                        assertThat(task.getErrorCode()).isEqualTo(ErrorCode.AGENT_UPSTREAM_ERROR);
                        assertThat(task.getResult()).isNotNull();
                    })
                    .verifyComplete();

            assertThat(market.fallbackCalls()).isEqualTo(1);
            assertThat(fixture.breakers.snapshot("market").getConsecutiveFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("should fail without fallback on invalid input and leave the breaker alone")
        void invalidInputFailsWithoutBreakerPenalty() {
            ScriptedAgent patent = ScriptedAgent.healthy("patent").failingWith(AgentErrorKind.INVALID_INPUT);
            EngineFixture fixture = fixture(Duration.ofSeconds(5), patent);
            Job job = createJob(fixture, Duration.ofSeconds(5), "patent");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> {
                        AgentTask task = settled.getTask("patent");
                        assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.FAILED);
                        assertThat(task.getErrorKind()).isEqualTo(AgentErrorKind.INVALID_INPUT);
                        assertThat(task.getErrorCode()).isEqualTo(ErrorCode.AGENT_INTERNAL_ERROR);
                    })
                    .verifyComplete();

            assertThat(patent.fallbackCalls()).isZero();
            assertThat(fixture.breakers.snapshot("patent").getConsecutiveFailures()).isZero();
        }

        @Test
        @DisplayName("should map an exception thrown by the agent to an internal failure")
        void thrownExceptionIsInternal() {
            ScriptedAgent web = ScriptedAgent.healthy("web").throwing(new IllegalStateException("boom"));
            EngineFixture fixture = fixture(Duration.ofSeconds(5), web);
            Job job = createJob(fixture, Duration.ofSeconds(5), "web");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> {
                        AgentTask task = settled.getTask("web");
                        assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.FAILED);
                        assertThat(task.getErrorKind()).isEqualTo(AgentErrorKind.INTERNAL);
                        assertThat(task.getErrorMessage()).contains("boom");
                    })
                    .verifyComplete();

            assertThat(fixture.breakers.snapshot("web").getConsecutiveFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("should report both causes when the fallback also fails")
        void fallbackFailureRecordsBothCauses() {
            ScriptedAgent exim = ScriptedAgent.healthy("exim")
                    .failingWith(AgentErrorKind.TIMEOUT)
                    .fallbackFailingWith("no cached trade data");
            EngineFixture fixture = fixture(Duration.ofSeconds(5), exim);
            Job job = createJob(fixture, Duration.ofSeconds(5), "exim");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> {
                        AgentTask task = settled.getTask("exim");
                        assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.FAILED);
                        assertThat(task.getErrorCode()).isEqualTo(ErrorCode.AGENT_TIMEOUT);
                        assertThat(task.getErrorMessage())
                                .startsWith("Live call failed:")
                                .contains("fallback failed: no cached trade data");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should mark an upstream error FAILED when the agent has no fallback")
        void noFallbackFails() {
            ScriptedAgent internal = ScriptedAgent.withoutFallback("internal")
                    .failingWith(AgentErrorKind.UPSTREAM_ERROR);
            EngineFixture fixture = fixture(Duration.ofSeconds(5), internal);
            Job job = createJob(fixture, Duration.ofSeconds(5), "internal");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> assertThat(settled.getTask("internal").getStatus())
                            .isEqualTo(AgentTaskStatus.FAILED))
                    .verifyComplete();

            assertThat(internal.fallbackCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("Circuit breaker")
    class CircuitBreakerTests {

        @Test
        @DisplayName("should short-circuit to fallback without a live call while OPEN")
        void openBreakerSkipsLiveCall() {
            ScriptedAgent market = ScriptedAgent.healthy("market");
            EngineFixture fixture = fixture(Duration.ofSeconds(5), market);
            fixture.tripBreaker("market");
            assertThat(fixture.breakers.currentState("market")).isEqualTo(CircuitState.OPEN);
            Job job = createJob(fixture, Duration.ofSeconds(5), "market");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> {
                        AgentTask task = settled.getTask("market");
                        assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.FALLBACK_USED);
                        assertThat(task.getSource()).isEqualTo(DataSource.FALLBACK);
                        assertThat(task.getErrorMessage()).isEqualTo("Circuit breaker open");
                    })
                    .verifyComplete();

            assertThat(market.liveCalls()).isZero();
        }

        @Test
        @DisplayName("should open after threshold consecutive failures across jobs")
        void breakerOpensAcrossJobs() {
            ScriptedAgent clinical = ScriptedAgent.healthy("clinical").failingWith(AgentErrorKind.UPSTREAM_ERROR);
            EngineFixture fixture = fixture(Duration.ofSeconds(5), clinical);

            for (int i = 0; i < 3; i++) {
                fixture.dispatcher.dispatch(createJob(fixture, Duration.ofSeconds(5), "clinical"))
                        .block(Duration.ofSeconds(5));
            }
            assertThat(clinical.liveCalls()).isEqualTo(3);
            assertThat(fixture.breakers.currentState("clinical")).isEqualTo(CircuitState.OPEN);

            Job fourth = fixture.dispatcher.dispatch(createJob(fixture, Duration.ofSeconds(5), "clinical"))
                    .block(Duration.ofSeconds(5));

            assertThat(clinical.liveCalls()).isEqualTo(3);
            assertThat(fourth.getTask("clinical").getSource()).isEqualTo(DataSource.FALLBACK);
        }

        @Test
        @DisplayName("should settle an empty live answer as FAILED and keep the breaker able to recover")
        void emptyLiveAnswerInHalfOpen() throws InterruptedException {
            // Given
            HelixProperties properties = EngineFixture.properties(Duration.ofSeconds(5), Duration.ofSeconds(2));
            properties.getCircuitBreaker().setOpenDuration(Duration.ofMillis(100));
            ScriptedAgent patent = ScriptedAgent.healthy("patent").completingEmpty();
            EngineFixture fixture = new EngineFixture(properties, List.of(patent));
            fixture.tripBreaker("patent");
            Thread.sleep(150);

            // When
            Job settled = fixture.dispatcher.dispatch(createJob(fixture, Duration.ofSeconds(5), "patent"))
                    .block(Duration.ofSeconds(5));

            // Then
            AgentTask task = settled.getTask("patent");
            assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.FAILED);
            assertThat(task.getErrorKind()).isEqualTo(AgentErrorKind.INTERNAL);
            assertThat(task.getErrorMessage()).isEqualTo("patent returned no result");
            assertThat(patent.liveCalls()).isEqualTo(1);
            assertThat(fixture.breakers.currentState("patent")).isEqualTo(CircuitState.OPEN);

            // second open period is doubled by the backoff
            patent.recovered();
            Thread.sleep(250);
            Job recovered = fixture.dispatcher.dispatch(createJob(fixture, Duration.ofSeconds(5), "patent"))
                    .block(Duration.ofSeconds(5));

            assertThat(recovered.getTask("patent").getStatus()).isEqualTo(AgentTaskStatus.SUCCEEDED);
            assertThat(recovered.getTask("patent").getSource()).isEqualTo(DataSource.LIVE);
            assertThat(patent.liveCalls()).isEqualTo(2);
            assertThat(fixture.breakers.currentState("patent")).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        @DisplayName("should hand the trial permit back when the RUNNING write fails")
        void permitReleasedWhenStoreFails() throws InterruptedException {
            HelixProperties properties = EngineFixture.properties(Duration.ofSeconds(5), Duration.ofSeconds(2));
            properties.getCircuitBreaker().setOpenDuration(Duration.ofMillis(100));
            ScriptedAgent patent = ScriptedAgent.healthy("patent");
            EngineFixture fixture = new EngineFixture(properties, List.of(patent));
            Job job = createJob(fixture, Duration.ofSeconds(5), "patent");
            fixture.tripBreaker("patent");
            Thread.sleep(150);

            JobStateStore failingStore = mock(JobStateStore.class);
            when(failingStore.recordTaskUpdate(anyString(), any()))
                    .thenReturn(Mono.error(new IllegalStateException("store unavailable")));
            when(failingStore.get(anyString())).thenReturn(Mono.empty());
            AgentDispatcher dispatcher = new AgentDispatcher(fixture.registry, fixture.breakers, failingStore,
                    properties, fixture.metrics, new StructuredLogger(new ObjectMapper()));

            dispatcher.dispatch(job).block(Duration.ofSeconds(5));

            assertThat(patent.liveCalls()).isZero();
            assertThat(fixture.breakers.currentState("patent")).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(fixture.breakers.tryAcquire("patent")).isTrue();
        }

        @Test
        @DisplayName("should serve a disabled agent from fallback without touching its breaker")
        void disabledAgentUsesFallback() {
            ScriptedAgent ml = ScriptedAgent.healthy("ml_prediction");
            EngineFixture fixture = fixture(Duration.ofSeconds(5), ml);
            HelixProperties.SourceProperties source = new HelixProperties.SourceProperties();
            source.setEnabled(false);
            fixture.properties.getAgents().getSources().put("ml_prediction", source);
            Job job = createJob(fixture, Duration.ofSeconds(5), "ml_prediction");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> assertThat(settled.getTask("ml_prediction").getStatus())
                            .isEqualTo(AgentTaskStatus.FALLBACK_USED))
                    .verifyComplete();

            assertThat(ml.liveCalls()).isZero();
            assertThat(fixture.breakers.snapshot("ml_prediction").getConsecutiveFailures()).isZero();
            assertThat(fixture.breakers.currentState("ml_prediction")).isEqualTo(CircuitState.CLOSED);
        }
    }

    @Nested
    @DisplayName("Job deadline")
    class DeadlineTests {

        @Test
        @DisplayName("should force-mark a hung agent TIMED_OUT at the job deadline")
        void hungAgentTimesOut() {
            ScriptedAgent hung = ScriptedAgent.healthy("literature").hanging();
            ScriptedAgent healthy = ScriptedAgent.healthy("market");
            EngineFixture fixture = fixture(Duration.ofMillis(300), hung, healthy);
            Job job = createJob(fixture, Duration.ofMillis(300), "literature", "market");

            StepVerifier.create(fixture.dispatcher.dispatch(job))
                    .assertNext(settled -> {
                        assertThat(settled.allTasksTerminal()).isTrue();
                        AgentTask task = settled.getTask("literature");
                        assertThat(task.getStatus()).isEqualTo(AgentTaskStatus.TIMED_OUT);
                        assertThat(task.getErrorCode()).isEqualTo(ErrorCode.AGENT_TIMEOUT);
                        assertThat(settled.getTask("market").getStatus()).isEqualTo(AgentTaskStatus.SUCCEEDED);
                    })
                    .expectComplete()
                    .verify(Duration.ofSeconds(3));

            assertThat(fixture.breakers.snapshot("literature").getConsecutiveFailures()).isEqualTo(1);
        }

        @Test
        @DisplayName("should dispatch every requested agent at once")
        void fullSubsetRunsConcurrently() {
            ScriptedAgent[] agents = AnalysisType.COMPREHENSIVE.getAgents().stream()
                    .map(name -> ScriptedAgent.healthy(name).delayed(Duration.ofMillis(300)))
                    .toArray(ScriptedAgent[]::new);
            EngineFixture fixture = fixture(Duration.ofSeconds(5), agents);
            Job job = createJob(fixture, Duration.ofSeconds(5),
                    AnalysisType.COMPREHENSIVE.getAgents().toArray(String[]::new));

            long started = System.nanoTime();
            Job settled = fixture.dispatcher.dispatch(job).block(Duration.ofSeconds(5));
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            assertThat(settled.getTasks().values()).extracting(AgentTask::getStatus)
                    .containsOnly(AgentTaskStatus.SUCCEEDED);
            assertThat(elapsed).isLessThan(Duration.ofMillis(1500));
        }
    }
}
