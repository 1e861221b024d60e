package com.pharmascope.helix.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pharmascope.helix.config.HelixProperties;
import com.pharmascope.helix.domain.model.Report;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Stores final reports in Redis as JSON with a TTL.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "helix.archive", name = "enabled", havingValue = "true")
public class RedisReportArchive implements ReportArchive {

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final HelixProperties.ArchiveProperties config;

    public RedisReportArchive(ReactiveStringRedisTemplate redisTemplate,
                              ObjectMapper objectMapper,
                              HelixProperties helixProperties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.config = helixProperties.getArchive();
        log.info("Report archive enabled: keyPrefix={}, ttl={}", config.getKeyPrefix(), config.getTtl());
    }

    @Override
    public Mono<Void> archive(Report report) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(report))
                .flatMap(json -> redisTemplate.opsForValue().set(key(report.getJobId()), json, config.getTtl()))
                .doOnNext(stored -> log.debug("Archived report for job {}: {}", report.getJobId(), stored))
                .onErrorResume(e -> {
                    log.warn("Failed to archive report for job {}: {}", report.getJobId(), e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    @Override
    public Mono<Report> find(String jobId) {
        return redisTemplate.opsForValue().get(key(jobId))
                .flatMap(json -> {
                    try {
                        return Mono.just(objectMapper.readValue(json, Report.class));
                    } catch (JsonProcessingException e) {
                        log.warn("Corrupt archived report for job {}: {}", jobId, e.getMessage());
                        return Mono.empty();
                    }
                })
                .onErrorResume(e -> {
                    log.warn("Failed to read archived report for job {}: {}", jobId, e.getMessage());
                    return Mono.empty();
                });
    }

    private String key(String jobId) {
        return config.getKeyPrefix() + jobId;
    }
}
