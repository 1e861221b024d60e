package com.pharmascope.helix.config;

import com.pharmascope.helix.domain.model.AnalysisType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for HELIX service.
 */
@Data
@Component
@ConfigurationProperties(prefix = "helix")
public class HelixProperties {

    private OrchestrationProperties orchestration = new OrchestrationProperties();
    private AgentProperties agents = new AgentProperties();
    private CircuitBreakerProperties circuitBreaker = new CircuitBreakerProperties();
    private CacheProperties cache = new CacheProperties();
    private RetentionProperties retention = new RetentionProperties();
    private ArchiveProperties archive = new ArchiveProperties();

    @Data
    public static class OrchestrationProperties {
        private Duration jobDeadline = Duration.ofSeconds(60);
        private int maxQueryLength = 500;
        private List<String> defaultAgents = new ArrayList<>(AnalysisType.COMPREHENSIVE.getAgents());
    }

    @Data
    public static class AgentProperties {
        private Duration defaultTimeout = Duration.ofSeconds(20);
        private Map<String, SourceProperties> sources = new HashMap<>();

        /**
         * Settings for one agent, defaults when the agent has no entry.
         */
        public SourceProperties source(String agentName) {
            return sources.getOrDefault(agentName, new SourceProperties());
        }

        public Duration timeoutFor(String agentName) {
            Duration timeout = source(agentName).getTimeout();
            return timeout != null ? timeout : defaultTimeout;
        }

        public boolean isEnabled(String agentName) {
            return source(agentName).isEnabled();
        }
    }

    @Data
    public static class SourceProperties {
        private boolean enabled = true;
        private Duration timeout;           // null falls back to agents.default-timeout
        private String baseUrl;             // empty runs the agent in stub mode
        private String apiKey;
    }

    @Data
    public static class CircuitBreakerProperties {
        private int failureThreshold = 3;
        private Duration openDuration = Duration.ofSeconds(30);
        private double backoffMultiplier = 2.0;
        private Duration maxOpenDuration = Duration.ofMinutes(5);
    }

    @Data
    public static class CacheProperties {
        private Duration ttl = Duration.ofHours(24);
        private int maxSize = 1000;
    }

    @Data
    public static class RetentionProperties {
        private boolean enabled = true;
        private Duration maxAge = Duration.ofHours(1);
        private int maxJobs = 100;
        private Duration sweepInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class ArchiveProperties {
        private boolean enabled = false;
        private Duration ttl = Duration.ofDays(7);
        private String keyPrefix = "helix:report:";
    }
}
