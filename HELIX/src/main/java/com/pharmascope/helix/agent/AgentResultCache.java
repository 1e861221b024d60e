package com.pharmascope.helix.agent;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.AgentResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Last-known-good live results per agent and query, served on the fallback path.
 */
@Slf4j
@Component
public class AgentResultCache {

    private final Cache<String, AgentResult> results;

    public AgentResultCache(HelixProperties helixProperties) {
        HelixProperties.CacheProperties config = helixProperties.getCache();
        this.results = Caffeine.newBuilder()
                .expireAfterWrite(config.getTtl())
                .maximumSize(config.getMaxSize())
                .recordStats()
                .build();

        log.info("Initialized agent result cache: ttl={}, maxSize={}", config.getTtl(), config.getMaxSize());
    }

    public void put(String agentName, String query, AgentResult result) {
        results.put(key(agentName, query), result);
    }

    public Optional<AgentResult> get(String agentName, String query) {
        return Optional.ofNullable(results.getIfPresent(key(agentName, query)));
    }

    public void invalidateAll() {
        results.invalidateAll();
    }

    public long size() {
        return results.estimatedSize();
    }

    public double hitRate() {
        return results.stats().hitRate();
    }

    static String key(String agentName, String query) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return agentName + "::" + normalized;
    }
}
