package com.pharmascope.helix.archive;

import com.pharmascope.helix.domain.model.Report;
import reactor.core.publisher.Mono;

/**
 * Durable copy of final reports, outliving in-memory job retention.
 * Failures are the archive's own concern and never affect the job.
 */
public interface ReportArchive {

    Mono<Void> archive(Report report);

    Mono<Report> find(String jobId);
}
