package com.pharmascope.helix.archive;

import com.pharmascope.helix.domain.model.Report;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

@Component
@ConditionalOnProperty(prefix = "helix.archive", name = "enabled", havingValue = "false", matchIfMissing = true)
public class NoOpReportArchive implements ReportArchive {

    @Override
    public Mono<Void> archive(Report report) {
        return Mono.empty();
    }

    @Override
    public Mono<Report> find(String jobId) {
        return Mono.empty();
    }
}
